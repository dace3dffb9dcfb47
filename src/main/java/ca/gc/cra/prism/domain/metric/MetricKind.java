package ca.gc.cra.prism.domain.metric;

import java.util.Locale;

/**
 * <strong>What:</strong> Value kinds a metric record may declare.
 * <p><strong>Why:</strong> The remote-write encoder only ships scalar kinds; histograms and summaries are dropped.</p>
 * <p><strong>Role:</strong> Domain enumeration referenced by {@link MetricRecord} and the encoder.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * @since 0.1.0
 */
public enum MetricKind {
  /** Monotonic counter. */
  COUNTER,
  /** Point-in-time gauge. */
  GAUGE,
  /** Bucketed distribution; never shipped. */
  HISTOGRAM,
  /** Quantile summary; never shipped. */
  SUMMARY,
  /** Kind not declared by the producer. */
  UNTYPED;

  /**
   * Indicates whether records of this kind are encoded into time series.
   *
   * @return {@code false} for {@link #HISTOGRAM} and {@link #SUMMARY}
   */
  public boolean isShippable() {
    return this != HISTOGRAM && this != SUMMARY;
  }

  /**
   * Parses a case-insensitive kind name; blank input maps to {@link #UNTYPED}.
   *
   * @param raw kind name such as {@code gauge}
   * @return parsed kind
   * @throws IllegalArgumentException when the name is not a known kind
   */
  public static MetricKind fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return UNTYPED;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    try {
      return MetricKind.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown metric kind: " + raw, ex);
    }
  }
}
