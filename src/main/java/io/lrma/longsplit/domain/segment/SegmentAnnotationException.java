package io.lrma.longsplit.domain.segment;

/**
 * Raised when a read's segment annotation is absent or cannot be decoded.
 *
 * <p>Annotation problems are precondition violations of the upstream labeling stage; the
 * segmentation pipeline treats them as fatal for the run.</p>
 *
 * @since 0.1.0
 */
public class SegmentAnnotationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String readName;

  /**
   * Creates an annotation failure for the named read.
   *
   * @param readName name of the offending read; may be {@code null} when unknown
   * @param message diagnostic message
   */
  public SegmentAnnotationException(String readName, String message) {
    super(message);
    this.readName = readName;
  }

  /**
   * Creates an annotation failure with an underlying cause.
   *
   * @param readName name of the offending read; may be {@code null} when unknown
   * @param message diagnostic message
   * @param cause underlying parse failure
   */
  public SegmentAnnotationException(String readName, String message, Throwable cause) {
    super(message, cause);
    this.readName = readName;
  }

  /**
   * Returns the name of the read whose annotation failed.
   *
   * @return read name, or {@code null} when the failure is not tied to a read
   */
  public String readName() {
    return readName;
  }
}
