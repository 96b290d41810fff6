package io.lrma.longsplit.domain.split;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of matching one read against the array structure.
 *
 * @param boundaries delimiter boundaries found (simple mode) or templates completed (bounded-region mode)
 * @param spans elements to emit, in read order
 * @since 0.1.0
 */
public record SplitResult(int boundaries, List<ElementSpan> spans) {

  /** Copies the span list. */
  public SplitResult {
    if (boundaries < 0) {
      throw new IllegalArgumentException("boundaries must be >= 0");
    }
    spans = List.copyOf(Objects.requireNonNull(spans, "spans"));
  }
}
