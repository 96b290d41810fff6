package io.lrma.longsplit.domain.split;

import java.util.Objects;

/**
 * Located array element within a source read.
 *
 * @param startCoord first emitted base, inclusive (already delimiter-adjusted)
 * @param endCoord last emitted base, inclusive (already delimiter-adjusted)
 * @param segmentStart lower bound used to select which segments belong to the element
 * @param segmentEnd upper bound used to select which segments belong to the element
 * @param previousDelimiter name of the delimiter bounding the element on the left
 * @param delimiter name of the delimiter bounding the element on the right
 * @param score match score; zero for modes that do not score
 * @since 0.1.0
 */
public record ElementSpan(
    int startCoord,
    int endCoord,
    int segmentStart,
    int segmentEnd,
    String previousDelimiter,
    String delimiter,
    int score) {

  /**
   * Validates that the emitted span is non-empty and non-negative.
   *
   * @throws IllegalArgumentException if the span is inverted or negative
   */
  public ElementSpan {
    Objects.requireNonNull(previousDelimiter, "previousDelimiter");
    Objects.requireNonNull(delimiter, "delimiter");
    if (startCoord < 0 || endCoord < startCoord) {
      throw new IllegalArgumentException("invalid element span " + startCoord + "-" + endCoord);
    }
  }

  /**
   * Returns the number of bases in the emitted span.
   *
   * @return inclusive length
   */
  public int length() {
    return endCoord - startCoord + 1;
  }
}
