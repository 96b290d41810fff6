package io.lrma.longsplit.domain.read;

import io.lrma.longsplit.domain.segment.Segment;
import java.util.List;
import java.util.Objects;

/**
 * A read paired with its decoded segment list; the unit of work handed from workers to the writer.
 *
 * @param read source read, unchanged
 * @param segments segments in left-to-right order
 * @since 0.1.0
 */
public record SegmentedRead(Read read, List<Segment> segments) {

  /** Copies the segment list so the pair owns it exclusively. */
  public SegmentedRead {
    Objects.requireNonNull(read, "read");
    segments = List.copyOf(Objects.requireNonNull(segments, "segments"));
  }
}
