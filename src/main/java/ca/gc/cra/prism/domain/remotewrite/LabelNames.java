package ca.gc.cra.prism.domain.remotewrite;

/**
 * <strong>What:</strong> Naming rules for remote-write labels and series names.
 * <p><strong>Why:</strong> Tag keys and metric names come from producers with arbitrary punctuation while the
 * remote store only accepts {@code [a-zA-Z_][a-zA-Z0-9_]*} label names.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 * <p><strong>Performance:</strong> Single pass per call; returns the input unchanged when already valid.</p>
 *
 * @since 0.1.0
 */
public final class LabelNames {
  private LabelNames() {
    // Utility
  }

  /**
   * Maps an arbitrary key onto the label-name grammar by replacing every invalid character with {@code _}.
   * A leading digit is invalid and is replaced as well; an empty key becomes {@code _}.
   *
   * @param key tag key; {@code null} is treated as empty
   * @return valid label name of the same length (or {@code _} for empty input)
   */
  public static String sanitize(String key) {
    if (key == null || key.isEmpty()) {
      return "_";
    }
    StringBuilder out = null;
    for (int i = 0; i < key.length(); i++) {
      char c = key.charAt(i);
      boolean valid = isLetter(c) || c == '_' || (i > 0 && isDigit(c));
      if (!valid && out == null) {
        out = new StringBuilder(key.length()).append(key, 0, i);
      }
      if (out != null) {
        out.append(valid ? c : '_');
      }
    }
    return out == null ? key : out.toString();
  }

  /**
   * Builds the {@code __name__} value for one field: dots and hyphens in the metric name become
   * underscores, then {@code _} and the field key are appended verbatim.
   *
   * @param metricName record name, e.g. {@code cpu.usage}
   * @param fieldKey field key, e.g. {@code idle}
   * @return series name, e.g. {@code cpu_usage_idle}
   */
  public static String seriesName(String metricName, String fieldKey) {
    return metricName.replace('.', '_').replace('-', '_') + '_' + fieldKey;
  }

  /**
   * Checks a name against {@code [a-zA-Z_][a-zA-Z0-9_]*}.
   *
   * @param name candidate
   * @return {@code true} when valid
   */
  public static boolean isValid(String name) {
    if (name == null || name.isEmpty()) {
      return false;
    }
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (!(isLetter(c) || c == '_' || (i > 0 && isDigit(c)))) {
        return false;
      }
    }
    return true;
  }

  private static boolean isLetter(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
