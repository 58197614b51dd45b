package hunkstage.core.git;

import java.nio.charset.StandardCharsets;

/**
 * Byte-exact text: every char holds exactly one byte (0x00 to 0xFF) of git's output or of a file.
 *
 * <p>Diffs and patches travel in this form so that content in any encoding reaches {@code git
 * apply} unchanged. Only text shown to a user is reinterpreted as UTF-8.
 */
public final class ByteText {
  private ByteText() {}

  public static String decode(byte[] bytes) {
    return new String(bytes, StandardCharsets.ISO_8859_1);
  }

  /**
   * @throws IllegalArgumentException if {@code byteText} holds a char above 0xFF
   */
  public static byte[] encode(String byteText) {
    for (int i = 0; i < byteText.length(); i++) {
      if (byteText.charAt(i) > 0xFF) {
        throw new IllegalArgumentException(
            "Not byte text: char U+"
                + Integer.toHexString(byteText.charAt(i)).toUpperCase()
                + " at offset "
                + i
                + ".");
      }
    }
    return byteText.getBytes(StandardCharsets.ISO_8859_1);
  }

  /** Byte text of the UTF-8 encoding of {@code text}; used for paths written into patches. */
  public static String fromUnicode(String text) {
    return decode(text.getBytes(StandardCharsets.UTF_8));
  }

  /** Reads byte text as UTF-8 for display. Invalid sequences become U+FFFD. */
  public static String toUnicode(String byteText) {
    return new String(byteText.getBytes(StandardCharsets.ISO_8859_1), StandardCharsets.UTF_8);
  }
}
