package ca.gc.cra.prism.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Built-in settings that apply when neither the CLI nor {@code prism.yaml} names a key.
 *
 * <p>Transport defaults are taken from {@link RemoteWriteConfig} so the two never drift apart.</p>
 */
public final class DefaultsForMode {
  /** Default number of records per remote-write request. */
  public static final int DEFAULT_BATCH_SIZE = 1_000;

  private static final Map<String, String> TELEMETRY = Map.of(
      "metricsExporter", "none",
      "otelEndpoint", "",
      "otelResourceAttributes", "");

  private static final Map<String, Map<String, String>> BY_MODE = Map.of("ship", ship());

  private DefaultsForMode() {}

  /**
   * Returns the telemetry defaults plus the defaults of {@code mode}.
   *
   * @param mode command name, case-insensitive ({@code ship})
   * @return unmodifiable defaults
   * @throws IllegalArgumentException if the command has no defaults
   */
  public static Map<String, String> asFlatMap(String mode) {
    String normalized = Objects.requireNonNull(mode, "mode").trim().toLowerCase(Locale.ROOT);
    Map<String, String> modeDefaults = BY_MODE.get(normalized);
    if (modeDefaults == null) {
      throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    Map<String, String> merged = new LinkedHashMap<>(TELEMETRY);
    merged.putAll(modeDefaults);
    return Map.copyOf(merged);
  }

  private static Map<String, String> ship() {
    String timeoutMillis = Long.toString(RemoteWriteConfig.DEFAULT_TIMEOUT.toMillis());
    return Map.of(
        "poolMultiplier", Integer.toString(RemoteWriteConfig.DEFAULT_POOL_MULTIPLIER),
        "timeoutMillis", timeoutMillis,
        "connectTimeoutMillis", timeoutMillis,
        "insecureSkipVerify", "false",
        "batchSize", Integer.toString(DEFAULT_BATCH_SIZE));
  }
}
