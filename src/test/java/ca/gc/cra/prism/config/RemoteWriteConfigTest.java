package ca.gc.cra.prism.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.validation.Net;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RemoteWriteConfigTest {

  @Test
  void defaultsApplyWhenOnlyUrlGiven() {
    RemoteWriteConfig config = RemoteWriteConfig.fromMap(Map.of("url", "http://metrics.example:9090/api/v1/write"));

    assertEquals(URI.create("http://metrics.example:9090/api/v1/write"), config.url());
    assertEquals(5, config.poolMultiplier());
    assertEquals(Duration.ofSeconds(5), config.timeout());
    assertEquals(Duration.ofSeconds(5), config.connectTimeout());
    assertEquals(RemoteWriteConfig.defaultUserAgent(), config.userAgent());
    assertTrue(config.userAgent().startsWith("PRISM/"));
    assertFalse(config.hasBasicAuth());
    assertFalse(config.tls().isCustomized());
  }

  @Test
  void acceptsSnakeCaseKeys() {
    Map<String, String> args = new HashMap<>();
    args.put("url", "https://metrics.example/write");
    args.put("basic_username", "prism");
    args.put("tls_ca", "/etc/prism/ca.pem");
    args.put("insecure_skip_verify", "yes");
    args.put("pool_multiplier", "2");
    args.put("timeout_ms", "1500");
    args.put("connect_timeout_ms", "250");
    args.put("user_agent", "agent/1.0");

    RemoteWriteConfig config = RemoteWriteConfig.fromMap(args);

    assertEquals("prism", config.basicUsername().orElseThrow());
    assertTrue(config.hasBasicAuth());
    assertEquals(Path.of("/etc/prism/ca.pem"), config.tls().caFile());
    assertTrue(config.tls().insecureSkipVerify());
    assertEquals(2, config.poolMultiplier());
    assertEquals(Duration.ofMillis(1500), config.timeout());
    assertEquals(Duration.ofMillis(250), config.connectTimeout());
    assertEquals("agent/1.0", config.userAgent());
  }

  @Test
  void passwordAloneEnablesBasicAuthAndIsRedacted() {
    RemoteWriteConfig config = RemoteWriteConfig.fromMap(
        Map.of("url", "http://localhost/write", "basicPassword", "s3cret"));

    assertTrue(config.hasBasicAuth());
    assertFalse(config.toString().contains("s3cret"));
    assertTrue(config.toString().contains("[REDACTED]"));
  }

  @Test
  void rejectsMissingOrMalformedUrl() {
    assertThrows(IllegalArgumentException.class, () -> RemoteWriteConfig.fromMap(Map.of()));
    assertThrows(IllegalArgumentException.class, () -> RemoteWriteConfig.fromMap(Map.of("url", "ftp://host/x")));
    assertThrows(IllegalArgumentException.class, () -> RemoteWriteConfig.fromMap(Map.of("url", "/relative/only")));
    assertThrows(IllegalArgumentException.class, () -> RemoteWriteConfig.fromMap(Map.of("url", "http://bad host/")));
  }

  @Test
  void acceptsContainerServiceNameHost() {
    RemoteWriteConfig config = RemoteWriteConfig.fromMap(Map.of("url", "http://prom_server:9090/api/v1/write"));

    assertEquals("prom_server", Net.bareHost(config.url()));
    assertEquals(9090, Net.port(config.url()));
  }

  @Test
  void rejectsOutOfRangeTuning() {
    assertThrows(IllegalArgumentException.class,
        () -> RemoteWriteConfig.fromMap(Map.of("url", "http://h/", "poolMultiplier", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> RemoteWriteConfig.fromMap(Map.of("url", "http://h/", "poolMultiplier", "65")));
    assertThrows(IllegalArgumentException.class,
        () -> RemoteWriteConfig.fromMap(Map.of("url", "http://h/", "timeoutMillis", "soon")));
    assertThrows(IllegalArgumentException.class,
        () -> RemoteWriteConfig.fromMap(Map.of("url", "http://h/", "insecureSkipVerify", "maybe")));
  }

  @Test
  void rejectsCertificateWithoutKey() {
    assertThrows(IllegalArgumentException.class,
        () -> RemoteWriteConfig.fromMap(Map.of("url", "http://h/", "tlsCert", "/tmp/cert.pem")));
  }

  @Test
  void builderAppliesOverrides() {
    RemoteWriteConfig config = RemoteWriteConfig.builder(URI.create("http://h/write"))
        .basicUsername("u")
        .poolMultiplier(3)
        .timeout(Duration.ofMillis(100))
        .build();

    assertEquals("u", config.basicUsername().orElseThrow());
    assertEquals(3, config.poolMultiplier());
    assertEquals(Duration.ofMillis(100), config.timeout());
    assertThrows(IllegalArgumentException.class,
        () -> RemoteWriteConfig.builder(URI.create("http://h/")).timeout(Duration.ZERO).build());
  }
}
