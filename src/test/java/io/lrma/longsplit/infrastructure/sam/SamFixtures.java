package io.lrma.longsplit.infrastructure.sam;

import htsjdk.samtools.SAMFileHeader;
import htsjdk.samtools.SAMFileWriter;
import htsjdk.samtools.SAMFileWriterFactory;
import htsjdk.samtools.SAMProgramRecord;
import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.SamReader;
import htsjdk.samtools.SamReaderFactory;
import htsjdk.samtools.ValidationStringency;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Writes and reads small unaligned SAM/BAM files for tests. */
public final class SamFixtures {
  /** Program id of the upstream annotation step recorded in fixture headers. */
  public static final String UPSTREAM_PROGRAM = "annotate";

  private SamFixtures() {}

  /** Header of an unaligned file produced by an upstream annotation step. */
  public static SAMFileHeader header() {
    SAMFileHeader header = new SAMFileHeader();
    header.setSortOrder(SAMFileHeader.SortOrder.queryname);
    SAMProgramRecord program = new SAMProgramRecord(UPSTREAM_PROGRAM);
    program.setProgramName("annotate");
    program.setProgramVersion("1.0");
    header.addProgramRecord(program);
    return header;
  }

  /**
   * Builds an unmapped record.
   *
   * @param header owning header
   * @param name read name
   * @param bases read bases
   * @param segments value of the {@code SG} tag, or {@code null} to omit it
   */
  public static SAMRecord record(SAMFileHeader header, String name, String bases, String segments) {
    SAMRecord record = new SAMRecord(header);
    record.setReadName(name);
    record.setReadBases(bases.getBytes(StandardCharsets.US_ASCII));
    byte[] quals = new byte[bases.length()];
    for (int i = 0; i < quals.length; i++) {
      quals[i] = (byte) (10 + i % 30);
    }
    record.setBaseQualities(quals);
    record.setReadUnmappedFlag(true);
    record.setMappingQuality(0);
    if (segments != null) {
      record.setAttribute("SG", segments);
    }
    record.setAttribute("np", 12);
    return record;
  }

  /** Writes {@code records} to {@code path} (format chosen by extension). */
  public static Path write(Path path, SAMFileHeader header, List<SAMRecord> records) {
    try (SAMFileWriter writer = new SAMFileWriterFactory().makeSAMOrBAMWriter(header, true, path)) {
      for (SAMRecord record : records) {
        writer.addAlignment(record);
      }
    }
    return path;
  }

  /** Reads every record of {@code path}. */
  public static List<SAMRecord> readAll(Path path) throws IOException {
    List<SAMRecord> records = new ArrayList<>();
    try (SamReader reader =
        SamReaderFactory.makeDefault().validationStringency(ValidationStringency.SILENT).open(path)) {
      for (SAMRecord record : reader) {
        records.add(record);
      }
    }
    return records;
  }

  /** Reads the header of {@code path}. */
  public static SAMFileHeader readHeader(Path path) throws IOException {
    try (SamReader reader =
        SamReaderFactory.makeDefault().validationStringency(ValidationStringency.SILENT).open(path)) {
      return reader.getFileHeader();
    }
  }
}
