package io.lrma.longsplit.domain.segment;

import java.util.Objects;

/**
 * <strong>What:</strong> Labeled sub-range of a read's bases assigned by an upstream annotation model.
 * <p><strong>Why:</strong> Segment labels are the alphabet the delimiter matchers work over.</p>
 * <p><strong>Role:</strong> Domain value decoded from the read's segment tag and re-encoded on output.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe across threads.</p>
 *
 * @param name segment label (e.g. {@code 10x_Adapter}); never blank
 * @param start first base covered by the segment, inclusive and 0-based
 * @param end last base covered by the segment, inclusive and 0-based
 * @since 0.1.0
 */
public record Segment(String name, int start, int end) {

  /**
   * Validates the label and coordinate range.
   *
   * @throws IllegalArgumentException if the label is blank or the coordinates are inverted or negative
   */
  public Segment {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("segment name must not be blank");
    }
    if (start < 0) {
      throw new IllegalArgumentException("segment start must be >= 0 (was " + start + ")");
    }
    if (end < start) {
      throw new IllegalArgumentException(
          "segment end must be >= start (was " + start + "-" + end + ")");
    }
  }

  /**
   * Returns the number of bases spanned by this segment.
   *
   * @return inclusive length, always at least one
   */
  public int length() {
    return end - start + 1;
  }

  /**
   * Renders the segment in tag form {@code name:start-end}.
   *
   * @return tag token for this segment
   */
  public String toTag() {
    return name + ':' + start + '-' + end;
  }
}
