package io.lrma.longsplit.domain.split;

import io.lrma.longsplit.domain.segment.Segment;
import java.util.List;

/**
 * <strong>What:</strong> Locates array elements in a read from its segment labels.
 * <p><strong>Role:</strong> Domain policy invoked by the single pipeline writer once per read.</p>
 * <p><strong>Thread-safety:</strong> Implementations hold only immutable configuration and keep
 * all match state local to {@link #split(List, int)}; they are safe to share.</p>
 *
 * @since 0.1.0
 */
public interface DelimiterMatcher {

  /**
   * Matches the structure against one read's segments.
   *
   * @param segments segments of the read in left-to-right order
   * @param readLength number of bases in the read
   * @return boundaries found and the element spans to emit; never {@code null}
   */
  SplitResult split(List<Segment> segments, int readLength);

  /**
   * Returns the mode implemented by this matcher.
   *
   * @return split mode
   */
  SplitMode mode();
}
