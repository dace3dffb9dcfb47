package ca.gc.cra.prism.validation;

import java.util.Objects;

/**
 * String checks applied to CLI and YAML values before they become HTTP headers, credentials, or file paths.
 *
 * <p>Every failure is an {@link IllegalArgumentException} whose message starts with the setting name, so the CLI
 * can print it unchanged.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private Strings() {}

  /**
   * Trims {@code value} and rejects blank or control-character input.
   *
   * @param name setting name used in the message
   * @param value candidate text
   * @return trimmed text
   * @throws NullPointerException if {@code value} is {@code null}
   */
  public static String requireNonBlank(String name, String value) {
    String trimmed = requireNoControl(name, value).trim();
    if (trimmed.isEmpty()) {
      throw invalid(name, "must not be blank");
    }
    return trimmed;
  }

  /**
   * Validates a header value: non-blank, at most {@code maxLength} characters, printable US-ASCII only.
   *
   * @param name setting name used in the message
   * @param value candidate header value
   * @param maxLength inclusive length limit after trimming
   * @return trimmed value
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw invalid(name, "length must be <= " + maxLength);
    }
    if (!trimmed.chars().allMatch(c -> c >= 0x20 && c <= 0x7E)) {
      throw invalid(name, "must contain printable ASCII characters");
    }
    return trimmed;
  }

  /**
   * Rejects control characters but keeps surrounding whitespace, which is significant in passwords.
   *
   * @param name setting name used in the message
   * @param value candidate text
   * @return {@code value} unchanged
   * @throws NullPointerException if {@code value} is {@code null}
   */
  public static String requireNoControl(String name, String value) {
    Objects.requireNonNull(value, label(name));
    if (value.chars().anyMatch(c -> Character.isISOControl((char) c))) {
      throw invalid(name, "must not contain control characters");
    }
    return value;
  }

  private static IllegalArgumentException invalid(String name, String problem) {
    return new IllegalArgumentException(label(name) + " " + problem);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
