package io.lrma.longsplit.domain.segment;

/**
 * Raised when a segment tag token does not follow the {@code label:start-end} grammar.
 *
 * @since 0.1.0
 */
public final class MalformedSegmentTagException extends SegmentAnnotationException {
  private static final long serialVersionUID = 1L;

  private final String token;

  /**
   * Creates the exception for a bad token.
   *
   * @param readName name of the read carrying the tag; may be {@code null}
   * @param token offending token
   * @param reason short description of the violated rule
   */
  public MalformedSegmentTagException(String readName, String token, String reason) {
    super(readName, message(readName, token, reason));
    this.token = token;
  }

  /**
   * Creates the exception for a bad token with an underlying cause.
   *
   * @param readName name of the read carrying the tag; may be {@code null}
   * @param token offending token
   * @param reason short description of the violated rule
   * @param cause parse failure
   */
  public MalformedSegmentTagException(String readName, String token, String reason, Throwable cause) {
    super(readName, message(readName, token, reason), cause);
    this.token = token;
  }

  /**
   * Returns the token that failed to decode.
   *
   * @return offending token text
   */
  public String token() {
    return token;
  }

  private static String message(String readName, String token, String reason) {
    String where = readName == null ? "" : " on read " + readName;
    return "malformed segment token '" + token + "'" + where + ": " + reason;
  }
}
