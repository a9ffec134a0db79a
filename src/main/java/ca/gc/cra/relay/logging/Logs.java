package ca.gc.cra.relay.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Logging hygiene helpers for bus diagnostics.
 * <p><strong>Why:</strong> Event sources and payloads are untrusted peer data; they are bounded before they reach
 * operator logs, and worker threads are tagged with their bus role.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use; MDC state is per thread.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** MDC key carrying {@code publisher} or {@code subscriber} on bus worker threads. */
  public static final String MDC_ROLE = "bus.role";
  /** Default byte budget for untrusted strings in log lines. */
  public static final int DEFAULT_MAX_BYTES = 128;

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
    return decodePrefix(bytes, maxBytes) + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
  }

  /**
   * Truncates with {@link #DEFAULT_MAX_BYTES}.
   *
   * @param value string to truncate
   * @return bounded string
   */
  public static String truncate(String value) {
    return truncate(value, DEFAULT_MAX_BYTES);
  }

  /**
   * Renders a bounded UTF-8 preview of a payload for DEBUG traffic logs.
   *
   * @param payload payload bytes; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of payload bytes to decode
   * @return preview text with control characters replaced by {@code '.'}
   */
  public static String preview(byte[] payload, int maxBytes) {
    if (payload == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    String text = decodePrefix(payload, Math.min(payload.length, maxBytes));
    StringBuilder sb = new StringBuilder(text.length() + 24);
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      sb.append(Character.isISOControl(c) ? '.' : c);
    }
    if (payload.length > maxBytes) {
      sb.append("... (").append(payload.length).append(" bytes)");
    }
    return sb.toString();
  }

  /**
   * Tags the current thread with a bus role until the returned handle is closed.
   *
   * @param role role name, e.g. {@code publisher}
   * @return closeable that removes the MDC entry
   */
  public static MDC.MDCCloseable withRole(String role) {
    return MDC.putCloseable(MDC_ROLE, role);
  }

  private static String decodePrefix(byte[] bytes, int length) {
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, length));
      return buffer.toString();
    } catch (CharacterCodingException ex) {
      return new String(bytes, 0, length, StandardCharsets.UTF_8);
    }
  }
}
