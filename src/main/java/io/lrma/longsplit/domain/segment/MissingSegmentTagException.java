package io.lrma.longsplit.domain.segment;

/**
 * Raised when a read reaches the segmentation stage without its segment tag.
 *
 * @since 0.1.0
 */
public final class MissingSegmentTagException extends SegmentAnnotationException {
  private static final long serialVersionUID = 1L;

  private final String tag;

  /**
   * Creates the exception for a read lacking {@code tag}.
   *
   * @param readName name of the read
   * @param tag tag key that was expected
   */
  public MissingSegmentTagException(String readName, String tag) {
    super(readName, "read " + readName + " has no " + tag + " segment tag; annotate reads before segmenting");
    this.tag = tag;
  }

  /**
   * Returns the tag key that was missing.
   *
   * @return tag key
   */
  public String tag() {
    return tag;
  }
}
