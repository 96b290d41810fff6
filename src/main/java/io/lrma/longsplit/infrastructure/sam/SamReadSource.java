package io.lrma.longsplit.infrastructure.sam;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.SAMFileHeader;
import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.SAMRecordIterator;
import htsjdk.samtools.SamReader;
import htsjdk.samtools.SamReaderFactory;
import htsjdk.samtools.ValidationStringency;
import io.lrma.longsplit.application.port.ReadSource;
import io.lrma.longsplit.domain.read.Read;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ReadSource} streaming records from a SAM or BAM file with htsjdk.
 * <p><strong>Behaviour:</strong> no index is required and validation is silent, matching unaligned
 * long-read BAMs. htsjdk failures surface as {@link IOException}s naming the file.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; read from the producer thread only.</p>
 *
 * @since 0.1.0
 */
public final class SamReadSource implements ReadSource {
  private static final Logger log = LoggerFactory.getLogger(SamReadSource.class);

  private final Path path;
  private final SamReader reader;
  private final SAMRecordIterator iterator;
  private boolean closed;

  private SamReadSource(Path path, SamReader reader) {
    this.path = path;
    this.reader = reader;
    this.iterator = reader.iterator();
  }

  /**
   * Opens {@code path} for streaming.
   *
   * @param path SAM or BAM file
   * @return open source
   * @throws IOException if the file cannot be opened or is not a SAM/BAM container
   */
  public static SamReadSource open(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.isRegularFile(path)) {
      throw new NoSuchFileException(path.toString());
    }
    SamReaderFactory factory =
        SamReaderFactory.makeDefault().validationStringency(ValidationStringency.SILENT);
    SamReader reader;
    try {
      reader = factory.open(path);
    } catch (SAMException ex) {
      throw new IOException("Unable to open " + path + ": " + ex.getMessage(), ex);
    }
    log.debug("Opened read source {} ({})", path, reader.type());
    return new SamReadSource(path, reader);
  }

  /**
   * Returns the header of the input file.
   *
   * @return input header
   */
  public SAMFileHeader header() {
    return reader.getFileHeader();
  }

  @Override
  public Read next() throws IOException {
    try {
      if (closed || !iterator.hasNext()) {
        return null;
      }
      SAMRecord record = iterator.next();
      return SamReadMapper.toRead(record);
    } catch (SAMException ex) {
      throw new IOException("Failed to read " + path + ": " + ex.getMessage(), ex);
    }
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    iterator.close();
    reader.close();
  }
}
