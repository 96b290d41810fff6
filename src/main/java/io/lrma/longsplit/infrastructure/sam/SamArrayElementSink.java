package io.lrma.longsplit.infrastructure.sam;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.SAMFileHeader;
import htsjdk.samtools.SAMFileWriter;
import htsjdk.samtools.SAMFileWriterFactory;
import htsjdk.samtools.SAMProgramRecord;
import io.lrma.longsplit.application.port.ArrayElementSink;
import io.lrma.longsplit.domain.read.Read;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ArrayElementSink} writing element reads to a SAM or BAM file with htsjdk.
 * <p><strong>Header:</strong> the input header with its sort order reset to {@code unsorted} and one
 * {@code @PG} record appended, chained to the previous last program through {@code PP}.</p>
 * <p><strong>Format:</strong> chosen from the file extension: {@code .bam} writes BAM, anything else SAM.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; written by the single pipeline writer.</p>
 *
 * @since 0.1.0
 */
public final class SamArrayElementSink implements ArrayElementSink {
  private static final Logger log = LoggerFactory.getLogger(SamArrayElementSink.class);

  private final Path path;
  private final SAMFileHeader header;
  private final SAMFileWriter writer;
  private long written;
  private boolean closed;

  private SamArrayElementSink(Path path, SAMFileHeader header, SAMFileWriter writer) {
    this.path = path;
    this.header = header;
    this.writer = writer;
  }

  /**
   * Creates the output file.
   *
   * @param path output path; {@code .bam} selects BAM
   * @param inputHeader header of the source file; not modified
   * @param program provenance for the {@code @PG} line
   * @return open sink
   * @throws IOException if the file cannot be created
   */
  public static SamArrayElementSink open(Path path, SAMFileHeader inputHeader, ProgramInfo program)
      throws IOException {
    Objects.requireNonNull(path, "path");
    SAMFileHeader header = outputHeader(inputHeader, program);
    try {
      SAMFileWriter writer = new SAMFileWriterFactory().makeSAMOrBAMWriter(header, true, path);
      log.debug("Opened element sink {}", path);
      return new SamArrayElementSink(path, header, writer);
    } catch (SAMException ex) {
      throw new IOException("Unable to create " + path + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Builds the output header: a copy of {@code inputHeader}, unsorted, with a new {@code @PG} record.
   *
   * @param inputHeader source header
   * @param program provenance to record
   * @return new header
   */
  static SAMFileHeader outputHeader(SAMFileHeader inputHeader, ProgramInfo program) {
    Objects.requireNonNull(inputHeader, "inputHeader");
    Objects.requireNonNull(program, "program");
    SAMFileHeader header = inputHeader.clone();
    header.setSortOrder(SAMFileHeader.SortOrder.unsorted);

    String id = program.recordId();
    int suffix = 1;
    while (header.getProgramRecord(id) != null) {
      id = program.recordId() + "." + suffix++;
    }
    SAMProgramRecord record = new SAMProgramRecord(id);
    record.setProgramName(program.programName());
    record.setProgramVersion(program.version());
    record.setAttribute("DS", program.description());
    record.setCommandLine(program.commandLine());
    List<SAMProgramRecord> existing = header.getProgramRecords();
    if (!existing.isEmpty()) {
      record.setPreviousProgramGroupId(existing.get(existing.size() - 1).getId());
    }
    header.addProgramRecord(record);
    return header;
  }

  /**
   * Returns the header written to the output.
   *
   * @return output header
   */
  public SAMFileHeader header() {
    return header;
  }

  @Override
  public void write(Read element) throws IOException {
    if (closed) {
      throw new IllegalStateException("element sink already closed");
    }
    try {
      writer.addAlignment(SamReadMapper.toRecord(element, header));
      written++;
    } catch (SAMException ex) {
      throw new IOException("Failed to write " + path + ": " + ex.getMessage(), ex);
    }
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    try {
      writer.close();
      log.debug("Wrote {} element records to {}", written, path);
    } catch (SAMException ex) {
      throw new IOException("Failed to finalize " + path + ": " + ex.getMessage(), ex);
    }
  }
}
