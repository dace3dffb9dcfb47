package ca.gc.cra.prism.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads {@code prism.yaml} and flattens the {@code common} and command sections into one key/value map.
 *
 * <p>Nested mappings fold into camelCase keys, so {@code tls: {ca: /x.pem}} yields {@code tlsCa}. Only plain
 * YAML types are constructed and duplicate keys are rejected.</p>
 */
public final class YamlConfigLoader {
  private static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads the file at {@code path}; the command section overrides {@code common}.
   *
   * @param path YAML file
   * @param mode command section to merge ({@code ship})
   * @return flattened settings, or empty when the file does not exist
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when the document is not valid PRISM configuration
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, path.toString(), mode));
    }
  }

  static Map<String, String> parse(Reader reader, String source, String mode) {
    Object document;
    try {
      LoaderOptions options = new LoaderOptions();
      options.setAllowDuplicateKeys(false);
      document = new Yaml(new SafeConstructor(options)).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + source, ex);
    }
    if (document == null) {
      return Map.of();
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException(source + ": top level must be a mapping of sections");
    }
    Map<String, String> flattened = new LinkedHashMap<>();
    for (String section : new String[] {COMMON_SECTION, mode.trim().toLowerCase(Locale.ROOT)}) {
      Object body = section(root, section);
      if (body == null) {
        continue;
      }
      if (!(body instanceof Map<?, ?> entries)) {
        throw new IllegalArgumentException(source + ": section '" + section + "' must be a mapping");
      }
      fold(entries, "", section, flattened);
    }
    return Map.copyOf(flattened);
  }

  private static Object section(Map<?, ?> root, String name) {
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      if (entry.getKey() instanceof String key && key.trim().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void fold(Map<?, ?> entries, String prefix, String path, Map<String, String> target) {
    for (Map.Entry<?, ?> entry : entries.entrySet()) {
      if (!(entry.getKey() instanceof String raw) || raw.isBlank()) {
        throw new IllegalArgumentException(path + " contains a blank or non-string key");
      }
      String key = prefix.isEmpty() ? raw.trim() : prefix + capitalize(raw.trim());
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        fold(nested, key, path + '.' + raw, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException(path + '.' + raw + ": lists are not supported");
      } else {
        target.put(key, value == null ? "" : value.toString());
      }
    }
  }

  private static String capitalize(String key) {
    return Character.toUpperCase(key.charAt(0)) + key.substring(1);
  }
}
