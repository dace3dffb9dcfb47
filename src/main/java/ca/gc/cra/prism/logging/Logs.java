package ca.gc.cra.prism.logging;

/**
 * <strong>What:</strong> Helpers that keep remote response bodies and credentials out of operator logs.
 * <p><strong>Why:</strong> Remote-write endpoints may answer a rejection with a large body, and basic-auth
 * passwords must never be printed.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String ABSENT_PLACEHOLDER = "<none>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {}

  /**
   * Shortens {@code value} to at most {@code maxBytes} UTF-8 bytes without splitting a character.
   *
   * @param value text to shorten; {@code null} renders as {@code <null>}
   * @param maxBytes UTF-8 byte budget; must be positive
   * @return the original text, or its longest whole-character prefix followed by a truncation marker
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    int kept = 0;
    int keptBytes = 0;
    int totalBytes = 0;
    for (int i = 0; i < value.length(); ) {
      int codePoint = value.codePointAt(i);
      int width = utf8Width(codePoint);
      totalBytes += width;
      if (totalBytes <= maxBytes) {
        keptBytes = totalBytes;
        kept = i + Character.charCount(codePoint);
      }
      i += Character.charCount(codePoint);
    }
    if (totalBytes <= maxBytes) {
      return value;
    }
    return value.substring(0, kept) + "... (truncated, " + keptBytes + " of " + totalBytes + " bytes)";
  }

  /**
   * Masks a secret for display.
   *
   * @param secret secret value
   * @return {@code <none>} when the secret is absent or empty, otherwise {@code [REDACTED]}
   */
  public static String redact(String secret) {
    return secret == null || secret.isEmpty() ? ABSENT_PLACEHOLDER : REDACTED_PLACEHOLDER;
  }

  private static int utf8Width(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    }
    if (codePoint < 0x800) {
      return 2;
    }
    return codePoint < 0x10000 ? 3 : 4;
  }
}
