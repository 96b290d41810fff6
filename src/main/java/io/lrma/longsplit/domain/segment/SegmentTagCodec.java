package io.lrma.longsplit.domain.segment;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Text codec for the segment annotation tag carried by each read.
 * <p><strong>Grammar:</strong></p>
 * <pre>
 *   tag   := token ( ('|' | ',') token )*
 *   token := label ':' start '-' end
 * </pre>
 * <p>The last {@code ':'} of a token separates the label from its range, so labels may
 * themselves contain colons. Coordinates are non-negative decimal integers with
 * {@code start <= end}. An empty tag value decodes to an empty list.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use by pipeline workers.</p>
 *
 * @since 0.1.0
 */
public final class SegmentTagCodec {
  /** Default tag key carrying segment annotations. */
  public static final String DEFAULT_TAG = "SG";

  private static final char OUTPUT_SEPARATOR = ',';

  private SegmentTagCodec() {
    // Utility
  }

  /**
   * Decodes a segment tag value.
   *
   * @param readName read the value belongs to, used for diagnostics; may be {@code null}
   * @param value raw tag value; must not be {@code null}
   * @return segments in tag order
   * @throws MalformedSegmentTagException if any token violates the grammar
   */
  public static List<Segment> decode(String readName, String value) {
    Objects.requireNonNull(value, "value");
    if (value.isBlank()) {
      return List.of();
    }
    List<Segment> segments = new ArrayList<>();
    int tokenStart = 0;
    for (int i = 0; i <= value.length(); i++) {
      if (i == value.length() || isSeparator(value.charAt(i))) {
        segments.add(decodeToken(readName, value.substring(tokenStart, i)));
        tokenStart = i + 1;
      }
    }
    return List.copyOf(segments);
  }

  /**
   * Decodes a single {@code label:start-end} token.
   *
   * @param readName read the token belongs to; may be {@code null}
   * @param token raw token text
   * @return decoded segment
   * @throws MalformedSegmentTagException if the token violates the grammar
   */
  public static Segment decodeToken(String readName, String token) {
    String trimmed = token.trim();
    if (trimmed.isEmpty()) {
      throw new MalformedSegmentTagException(readName, token, "empty token");
    }
    int colon = trimmed.lastIndexOf(':');
    if (colon <= 0 || colon == trimmed.length() - 1) {
      throw new MalformedSegmentTagException(readName, token, "expected label:start-end");
    }
    String label = trimmed.substring(0, colon);
    String range = trimmed.substring(colon + 1);
    int dash = range.indexOf('-');
    if (dash <= 0 || dash == range.length() - 1) {
      throw new MalformedSegmentTagException(readName, token, "range must be start-end");
    }
    int start = parseCoordinate(readName, token, range.substring(0, dash));
    int end = parseCoordinate(readName, token, range.substring(dash + 1));
    if (end < start) {
      throw new MalformedSegmentTagException(readName, token, "end precedes start");
    }
    return new Segment(label, start, end);
  }

  /**
   * Encodes segments as a tag value.
   *
   * @param segments segments to render, in order
   * @return encoded tag value; empty when {@code segments} is empty
   */
  public static String encode(Collection<Segment> segments) {
    StringBuilder builder = new StringBuilder(segments.size() * 20);
    for (Segment segment : segments) {
      if (builder.length() > 0) {
        builder.append(OUTPUT_SEPARATOR);
      }
      builder.append(segment.toTag());
    }
    return builder.toString();
  }

  private static int parseCoordinate(String readName, String token, String raw) {
    if (raw.isEmpty()) {
      throw new MalformedSegmentTagException(readName, token, "missing coordinate");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (!Character.isDigit(raw.charAt(i))) {
        throw new MalformedSegmentTagException(readName, token, "coordinate '" + raw + "' is not a non-negative integer");
      }
    }
    try {
      return Integer.parseInt(raw);
    } catch (NumberFormatException ex) {
      throw new MalformedSegmentTagException(readName, token, "coordinate '" + raw + "' is out of range", ex);
    }
  }

  private static boolean isSeparator(char c) {
    return c == '|' || c == ',';
  }
}
