package io.lrma.longsplit.application.pipeline;

import io.lrma.longsplit.domain.read.Read;
import io.lrma.longsplit.domain.read.SegmentedRead;
import io.lrma.longsplit.domain.segment.MalformedSegmentTagException;
import io.lrma.longsplit.domain.segment.MissingSegmentTagException;
import io.lrma.longsplit.domain.segment.Segment;
import io.lrma.longsplit.domain.segment.SegmentTagCodec;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Extracts a read's ordered segment list from its annotation tag.
 * <p><strong>Role:</strong> Worker-stage transformation; one call per read.</p>
 * <p><strong>Thread-safety:</strong> Immutable and stateless beyond the tag key; shared by all workers.</p>
 *
 * @since 0.1.0
 */
public final class SegmentDecoder {
  private final String segmentsTag;

  /** Creates a decoder reading the default {@value SegmentTagCodec#DEFAULT_TAG} tag. */
  public SegmentDecoder() {
    this(SegmentTagCodec.DEFAULT_TAG);
  }

  /**
   * Creates a decoder reading {@code segmentsTag}.
   *
   * @param segmentsTag tag key carrying the segment annotation; must not be blank
   */
  public SegmentDecoder(String segmentsTag) {
    Objects.requireNonNull(segmentsTag, "segmentsTag");
    if (segmentsTag.isBlank()) {
      throw new IllegalArgumentException("segmentsTag must not be blank");
    }
    this.segmentsTag = segmentsTag;
  }

  /**
   * Returns the tag key this decoder reads.
   *
   * @return tag key
   */
  public String segmentsTag() {
    return segmentsTag;
  }

  /**
   * Decodes the segments of {@code read}; the read itself is passed through unchanged.
   *
   * @param read annotated read
   * @return read paired with its segments
   * @throws MissingSegmentTagException if the read carries no segment tag
   * @throws MalformedSegmentTagException if the tag value is not a string or is malformed
   */
  public SegmentedRead decode(Read read) {
    Objects.requireNonNull(read, "read");
    Object value =
        read.tags()
            .get(segmentsTag)
            .orElseThrow(() -> new MissingSegmentTagException(read.name(), segmentsTag));
    if (!(value instanceof CharSequence text)) {
      throw new MalformedSegmentTagException(
          read.name(),
          String.valueOf(value),
          segmentsTag + " tag holds " + value.getClass().getSimpleName() + ", expected a string");
    }
    List<Segment> segments = SegmentTagCodec.decode(read.name(), text.toString());
    return new SegmentedRead(read, segments);
  }
}
