package io.lrma.longsplit.infrastructure.sam;

import htsjdk.samtools.SAMFileHeader;
import htsjdk.samtools.SAMRecord;
import io.lrma.longsplit.domain.read.Read;
import io.lrma.longsplit.domain.read.ReadTags;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Converts between htsjdk {@link SAMRecord}s and domain {@link Read}s.
 * <p>Tag values keep their htsjdk Java types so they are written back unchanged.</p>
 *
 * @since 0.1.0
 */
public final class SamReadMapper {
  private SamReadMapper() {}

  /**
   * Maps a record to a read.
   *
   * @param record source record
   * @return immutable read; qualities are empty when the record stores {@code *}
   */
  public static Read toRead(SAMRecord record) {
    Objects.requireNonNull(record, "record");
    Map<String, Object> tags = new LinkedHashMap<>();
    for (SAMRecord.SAMTagAndValue attribute : record.getAttributes()) {
      tags.put(attribute.tag, attribute.value);
    }
    return new Read(
        record.getReadName(),
        record.getReadBases(),
        record.getBaseQualities(),
        ReadTags.of(tags),
        record.getReadUnmappedFlag(),
        record.getMappingQuality());
  }

  /**
   * Maps a read to a new unaligned record bound to {@code header}.
   *
   * @param read read to convert
   * @param header header of the output container
   * @return new record
   */
  public static SAMRecord toRecord(Read read, SAMFileHeader header) {
    Objects.requireNonNull(read, "read");
    SAMRecord record = new SAMRecord(Objects.requireNonNull(header, "header"));
    record.setReadName(read.name());
    record.setReadBases(read.length() == 0 ? SAMRecord.NULL_SEQUENCE : read.bases());
    record.setBaseQualities(read.hasQualities() ? read.qualities() : SAMRecord.NULL_QUALS);
    record.setReadUnmappedFlag(read.unmapped());
    record.setMappingQuality(read.mappingQuality());
    for (Map.Entry<String, Object> tag : read.tags().asMap().entrySet()) {
      record.setAttribute(tag.getKey(), tag.getValue());
    }
    return record;
  }
}
