package ca.gc.cra.prism.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndShipSections() throws IOException {
    Path yaml = tempDir.resolve("prism.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
        ship:
          url: https://metrics.example/api/v1/write
          pool_multiplier: 2
          basic_password:
          tls:
            ca: /etc/prism/ca.pem
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "ship").orElseThrow();

    assertEquals("none", map.get("metricsExporter"));
    assertEquals("https://metrics.example/api/v1/write", map.get("url"));
    assertEquals("2", map.get("pool_multiplier"));
    assertEquals("", map.get("basic_password"));
    assertEquals("/etc/prism/ca.pem", map.get("tlsCa"));
  }

  @Test
  void shipSectionOverridesCommon() throws IOException {
    Path yaml = tempDir.resolve("prism.yaml");
    Files.writeString(yaml, """
        common:
          userAgent: common
        SHIP:
          userAgent: ship
        """);

    assertEquals("ship", YamlConfigLoader.load(yaml, "ship").orElseThrow().get("userAgent"));
  }

  @Test
  void duplicateKeysAreRejected() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("dup.yaml"), "ship:\n  url: http://a/\n  url: http://b/\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "ship"));
  }

  @Test
  void nonMappingSectionIsRejected() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("section.yaml"), "ship: just-a-string\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "ship"));
  }

  @Test
  void missingFileReturnsEmpty() throws IOException {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "ship").isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("empty.yaml"), "");

    assertEquals(Optional.of(Map.of()), YamlConfigLoader.load(yaml, "ship"));
  }

  @Test
  void arraysAndMalformedDocumentsAreRejected() throws IOException {
    Path arrays = Files.writeString(tempDir.resolve("arrays.yaml"), "ship:\n  url: [a, b]\n");
    Path broken = Files.writeString(tempDir.resolve("broken.yaml"), "ship: [unterminated\n");
    Path scalar = Files.writeString(tempDir.resolve("scalar.yaml"), "just text\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(arrays, "ship"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "ship"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(scalar, "ship"));
  }
}
