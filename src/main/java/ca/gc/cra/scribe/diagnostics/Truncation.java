package ca.gc.cra.scribe.diagnostics;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Caps rendered field values to a UTF-8 byte budget so a single oversized value cannot flood a console line.
 *
 * @implNote Decoding ignores a code point split at the boundary instead of failing.
 * @since 0.1.0
 */
public final class Truncation {
  private Truncation() {
    // Utility
  }

  /**
   * Truncates {@code value} to at most {@code maxBytes} UTF-8 bytes, appending a length marker.
   *
   * @param value text to cap; {@code null} returns {@code null}
   * @param maxBytes byte budget; must be positive
   * @return original value when it fits, otherwise the truncated prefix plus {@code "...(truncated, N bytes)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String toUtf8Bytes(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null || value.length() * 3L <= maxBytes) {
      return value;
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    String prefix;
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      prefix = buffer.toString();
    } catch (CharacterCodingException ex) {
      prefix = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
    }
    return prefix + "...(truncated, " + bytes.length + " bytes)";
  }
}
