package io.lrma.longsplit.infrastructure.sam;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import htsjdk.samtools.SAMFileHeader;
import htsjdk.samtools.SAMProgramRecord;
import htsjdk.samtools.SAMRecord;
import io.lrma.longsplit.domain.read.Read;
import io.lrma.longsplit.domain.read.ReadTags;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SamAdaptersTest {
  private static final ProgramInfo PROGRAM =
      new ProgramInfo("longsplit", "0.2.0", "segment", "Split array reads", "longsplit segment in=a.bam out=b.bam");

  @TempDir
  Path tempDir;

  @Test
  void sourceReadsRecordsWithTagsInFileOrder() throws Exception {
    SAMFileHeader header = SamFixtures.header();
    Path input = SamFixtures.write(tempDir.resolve("in.sam"), header, List.of(
        SamFixtures.record(header, "m1/1/ccs", "ACGTACGT", "A:0-3|B:4-7"),
        SamFixtures.record(header, "m1/2/ccs", "TTTT", null)));

    try (SamReadSource source = SamReadSource.open(input)) {
      assertNotNull(source.header().getProgramRecord(SamFixtures.UPSTREAM_PROGRAM));

      Read first = source.next();
      assertEquals("m1/1/ccs", first.name());
      assertArrayEquals("ACGTACGT".getBytes(StandardCharsets.US_ASCII), first.bases());
      assertEquals(8, first.qualities().length);
      assertEquals("A:0-3|B:4-7", first.tags().getString("SG").orElseThrow());
      assertEquals(12, first.tags().get("np").orElseThrow());
      assertTrue(first.unmapped());

      Read second = source.next();
      assertEquals("m1/2/ccs", second.name());
      assertTrue(second.tags().getString("SG").isEmpty());
      assertNull(source.next());
    }
  }

  @Test
  void sinkWritesUnmappedElementsWithProgramRecord() throws Exception {
    SAMFileHeader inputHeader = SamFixtures.header();
    Path output = tempDir.resolve("elements.bam");
    Read element = new Read(
        "m1/1/ccs_4-7_A-B",
        "ACGT".getBytes(StandardCharsets.US_ASCII),
        new byte[] {20, 21, 22, 23},
        ReadTags.of(Map.of("SG", "cdna:4-7")),
        true,
        Read.MAPPING_QUALITY_UNAVAILABLE);

    try (SamArrayElementSink sink = SamArrayElementSink.open(output, inputHeader, PROGRAM)) {
      sink.write(element);
    }

    List<SAMRecord> records = SamFixtures.readAll(output);
    assertEquals(1, records.size());
    SAMRecord record = records.get(0);
    assertEquals("m1/1/ccs_4-7_A-B", record.getReadName());
    assertEquals("ACGT", record.getReadString());
    assertArrayEquals(new byte[] {20, 21, 22, 23}, record.getBaseQualities());
    assertTrue(record.getReadUnmappedFlag());
    assertEquals(255, record.getMappingQuality());
    assertEquals("cdna:4-7", record.getStringAttribute("SG"));

    SAMFileHeader header = SamFixtures.readHeader(output);
    assertEquals(SAMFileHeader.SortOrder.unsorted, header.getSortOrder());
    SAMProgramRecord pg = header.getProgramRecord("longsplit-segment-0.2.0");
    assertNotNull(pg);
    assertEquals("longsplit", pg.getProgramName());
    assertEquals("0.2.0", pg.getProgramVersion());
    assertEquals("longsplit segment in=a.bam out=b.bam", pg.getCommandLine());
    assertEquals(SamFixtures.UPSTREAM_PROGRAM, pg.getPreviousProgramGroupId());
  }

  @Test
  void repeatedRunsGetDistinctProgramIds() {
    SAMFileHeader once = SamArrayElementSink.outputHeader(SamFixtures.header(), PROGRAM);
    SAMFileHeader twice = SamArrayElementSink.outputHeader(once, PROGRAM);

    assertNotNull(twice.getProgramRecord("longsplit-segment-0.2.0"));
    SAMProgramRecord second = twice.getProgramRecord("longsplit-segment-0.2.0.1");
    assertNotNull(second);
    assertEquals("longsplit-segment-0.2.0", second.getPreviousProgramGroupId());
  }

  @Test
  void outputHeaderLeavesInputHeaderUntouched() {
    SAMFileHeader input = SamFixtures.header();

    SamArrayElementSink.outputHeader(input, PROGRAM);

    assertEquals(1, input.getProgramRecords().size());
    assertEquals(SAMFileHeader.SortOrder.queryname, input.getSortOrder());
  }

  @Test
  void writeAfterCloseIsRejected() throws Exception {
    SamArrayElementSink sink =
        SamArrayElementSink.open(tempDir.resolve("closed.sam"), SamFixtures.header(), PROGRAM);
    sink.close();
    sink.close();

    Read element = new Read("r", "AC".getBytes(StandardCharsets.US_ASCII), null, ReadTags.empty(), true, 255);
    assertThrows(IllegalStateException.class, () -> sink.write(element));
  }

  @Test
  void mapperRoundTripsReadWithoutQualities() {
    SAMFileHeader header = SamFixtures.header();
    Read read = new Read("r1", "ACGTN".getBytes(StandardCharsets.US_ASCII), null,
        ReadTags.of(Map.of("SG", "A:0-4")), true, 255);

    Read back = SamReadMapper.toRead(SamReadMapper.toRecord(read, header));

    assertEquals(read.name(), back.name());
    assertArrayEquals(read.bases(), back.bases());
    assertEquals(0, back.qualities().length);
    assertEquals("A:0-4", back.tags().getString("SG").orElseThrow());
  }
}
