package io.lrma.longsplit.logging;

import io.lrma.longsplit.domain.segment.Segment;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * <strong>What:</strong> Logging hygiene helpers for read-level diagnostics.
 * <p><strong>Why:</strong> Long reads carry hundreds of segments; unbounded dumps would swamp operator logs.
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** Byte budget applied to segment summaries in DEBUG output. */
  public static final int SEGMENT_SUMMARY_BYTES = 512;

  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String fallback = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return fallback + "... (truncated)";
    }
  }

  /**
   * Renders a segment list as {@code label:start-end} tokens, bounded by {@link #SEGMENT_SUMMARY_BYTES}.
   *
   * @param segments segments of one read
   * @return printable summary
   */
  public static String segments(List<Segment> segments) {
    if (segments == null) {
      return NULL_PLACEHOLDER;
    }
    StringBuilder sb = new StringBuilder();
    for (Segment segment : segments) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append(segment.toTag());
      if (sb.length() > SEGMENT_SUMMARY_BYTES * 2) {
        break;
      }
    }
    return truncate(sb.toString(), SEGMENT_SUMMARY_BYTES);
  }
}
