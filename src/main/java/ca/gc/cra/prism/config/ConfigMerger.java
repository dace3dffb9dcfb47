package ca.gc.cra.prism.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private static final Map<String, String> SNAKE_CASE_ALIASES = Map.ofEntries(
      Map.entry("basic_username", "basicUsername"),
      Map.entry("basic_password", "basicPassword"),
      Map.entry("tls_ca", "tlsCa"),
      Map.entry("tls_cert", "tlsCert"),
      Map.entry("tls_key", "tlsKey"),
      Map.entry("insecure_skip_verify", "insecureSkipVerify"),
      Map.entry("pool_multiplier", "poolMultiplier"),
      Map.entry("timeout_ms", "timeoutMillis"),
      Map.entry("connect_timeout_ms", "connectTimeoutMillis"),
      Map.entry("user_agent", "userAgent"),
      Map.entry("batch_size", "batchSize"));

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = canonicalKeys(yaml.orElse(Map.of()));
    Map<String, String> cliCopy = cli == null ? Map.of() : canonicalKeys(cli);

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  /**
   * Rewrites snake_case keys to their camelCase names so they take precedence over camelCase defaults.
   */
  static Map<String, String> canonicalKeys(Map<String, String> source) {
    Map<String, String> result = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : source.entrySet()) {
      String key = entry.getKey();
      result.put(key == null ? null : SNAKE_CASE_ALIASES.getOrDefault(key, key), entry.getValue());
    }
    return result;
  }

  private static void validate(String mode, Map<String, String> effective) {
    if ("ship".equalsIgnoreCase(mode)) {
      String cert = trim(firstPresent(effective, "tlsCert", "tls_cert"));
      String key = trim(firstPresent(effective, "tlsKey", "tls_key"));
      if (cert.isEmpty() != key.isEmpty()) {
        throw new IllegalArgumentException("tlsCert and tlsKey must be configured together");
      }
    }
  }

  private static String firstPresent(Map<String, String> effective, String primary, String alias) {
    String value = effective.get(primary);
    return value != null && !value.isBlank() ? value : effective.get(alias);
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
