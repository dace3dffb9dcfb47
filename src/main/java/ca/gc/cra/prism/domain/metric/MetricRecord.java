package ca.gc.cra.prism.domain.metric;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> One metric observation as produced by the metric pipeline.
 * <p><strong>Why:</strong> Decouples the remote-write encoder from any particular metric producer or input format.</p>
 * <p><strong>Role:</strong> Domain value consumed by {@code TimeSeriesEncoder}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; tag and field maps are defensively copied and unmodifiable.</p>
 * <p><strong>Performance:</strong> Copies preserve insertion order so encoded series follow producer order.</p>
 *
 * @param name metric name (e.g., {@code cpu.usage}); must not be {@code null}
 * @param tags tag key to value, iteration order preserved
 * @param fields field key to typed value, iteration order preserved
 * @param timestamp observation time with nanosecond precision
 * @param kind declared metric kind
 * @since 0.1.0
 */
public record MetricRecord(
    String name,
    Map<String, String> tags,
    Map<String, FieldValue> fields,
    Instant timestamp,
    MetricKind kind) {

  public MetricRecord {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(timestamp, "timestamp");
    kind = Objects.requireNonNullElse(kind, MetricKind.UNTYPED);
    tags = tags == null ? Map.of() : copyOf(tags, "tag");
    fields = fields == null ? Map.of() : copyOf(fields, "field");
  }

  /**
   * Returns the observation time truncated to whole milliseconds since the epoch.
   *
   * @return epoch milliseconds, floored for pre-epoch instants
   */
  public long timestampMillis() {
    return timestamp.toEpochMilli();
  }

  private static <V> Map<String, V> copyOf(Map<String, V> source, String what) {
    Map<String, V> copy = new LinkedHashMap<>(source.size() * 2);
    for (Map.Entry<String, V> entry : source.entrySet()) {
      String key = Objects.requireNonNull(entry.getKey(), what + " key");
      copy.put(key, Objects.requireNonNull(entry.getValue(), () -> what + " value for " + key));
    }
    return Collections.unmodifiableMap(copy);
  }
}
