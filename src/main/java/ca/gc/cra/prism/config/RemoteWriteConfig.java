package ca.gc.cra.prism.config;

import ca.gc.cra.prism.validation.Net;
import ca.gc.cra.prism.validation.Numbers;
import ca.gc.cra.prism.validation.Strings;
import java.net.URI;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validated settings for one remote-write shipper instance.
 * <p><strong>Why:</strong> Normalizes the endpoint URL, credentials, TLS material, and transport tuning knobs so the
 * shipper never has to re-validate them on the delivery path.</p>
 * <p><strong>Role:</strong> Adapter configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Require an absolute {@code http}/{@code https} URL with a host.</li>
 *   <li>Accept both camelCase keys and the snake_case keys used by agent-style TOML/YAML files.</li>
 *   <li>Bound the pool multiplier and transport timeouts.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable once constructed; safe for concurrent reads.</p>
 * <p><strong>Observability:</strong> {@link #toString()} redacts the password.</p>
 *
 * @since 0.1.0
 */
public final class RemoteWriteConfig {
  /** Default number of transport handles created per resolved address. */
  public static final int DEFAULT_POOL_MULTIPLIER = 5;
  /** Default request and connect timeout. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

  private static final int MAX_POOL_MULTIPLIER = 64;
  private static final int MAX_TIMEOUT_MILLIS = 600_000;
  private static final int MAX_USER_AGENT_LENGTH = 256;

  private final URI url;
  private final Optional<String> basicUsername;
  private final Optional<String> basicPassword;
  private final TlsSettings tls;
  private final int poolMultiplier;
  private final Duration timeout;
  private final Duration connectTimeout;
  private final String userAgent;

  private RemoteWriteConfig(Builder builder) {
    this.url = Objects.requireNonNull(builder.url, "url");
    this.basicUsername = Objects.requireNonNullElse(builder.basicUsername, Optional.empty());
    this.basicPassword = Objects.requireNonNullElse(builder.basicPassword, Optional.empty());
    this.tls = Objects.requireNonNullElse(builder.tls, TlsSettings.none());
    this.poolMultiplier = (int) Numbers.requireRange(
        "poolMultiplier", builder.poolMultiplier, 1, MAX_POOL_MULTIPLIER);
    this.timeout = requireTimeout("timeoutMillis", builder.timeout);
    this.connectTimeout = requireTimeout("connectTimeoutMillis", builder.connectTimeout);
    this.userAgent = builder.userAgent == null ? defaultUserAgent() : builder.userAgent;
  }

  /**
   * Builds a configuration from flattened key/value pairs (CLI merged over YAML over defaults).
   *
   * @param args configuration map; must not be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException if a required key is missing or any value is invalid
   */
  public static RemoteWriteConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    String rawUrl = first(args, "url").orElseThrow(
        () -> new IllegalArgumentException("url is required"));
    Builder builder = builder(Net.validateHttpUrl("url", rawUrl));

    first(args, "basicUsername", "basic_username")
        .map(value -> Strings.requireNoControl("basicUsername", value))
        .ifPresent(builder::basicUsername);
    first(args, "basicPassword", "basic_password")
        .map(value -> Strings.requireNoControl("basicPassword", value))
        .ifPresent(builder::basicPassword);

    Path ca = first(args, "tlsCa", "tls_ca").map(value -> toPath("tlsCa", value)).orElse(null);
    Path cert = first(args, "tlsCert", "tls_cert").map(value -> toPath("tlsCert", value)).orElse(null);
    Path key = first(args, "tlsKey", "tls_key").map(value -> toPath("tlsKey", value)).orElse(null);
    boolean skipVerify = first(args, "insecureSkipVerify", "insecure_skip_verify")
        .map(value -> parseBoolean("insecureSkipVerify", value))
        .orElse(false);
    builder.tls(new TlsSettings(ca, cert, key, skipVerify));

    first(args, "poolMultiplier", "pool_multiplier")
        .map(value -> Numbers.parseIntInRange("poolMultiplier", value, 1, MAX_POOL_MULTIPLIER))
        .ifPresent(builder::poolMultiplier);
    first(args, "timeoutMillis", "timeout_ms")
        .map(value -> Numbers.parseIntInRange("timeoutMillis", value, 1, MAX_TIMEOUT_MILLIS))
        .ifPresent(ms -> builder.timeout(Duration.ofMillis(ms)));
    first(args, "connectTimeoutMillis", "connect_timeout_ms")
        .map(value -> Numbers.parseIntInRange("connectTimeoutMillis", value, 1, MAX_TIMEOUT_MILLIS))
        .ifPresent(ms -> builder.connectTimeout(Duration.ofMillis(ms)));
    first(args, "userAgent", "user_agent")
        .map(value -> Strings.requirePrintableAscii("userAgent", value, MAX_USER_AGENT_LENGTH))
        .ifPresent(builder::userAgent);

    return builder.build();
  }

  /**
   * Starts a builder for programmatic construction.
   *
   * @param url validated endpoint URL
   * @return builder seeded with defaults
   */
  public static Builder builder(URI url) {
    return new Builder(url);
  }

  /**
   * Returns the default {@code User-Agent} header value.
   *
   * @return {@code PRISM/<version>}
   */
  public static String defaultUserAgent() {
    return "PRISM/" + BuildInfo.version();
  }

  public URI url() {
    return url;
  }

  public Optional<String> basicUsername() {
    return basicUsername;
  }

  public Optional<String> basicPassword() {
    return basicPassword;
  }

  /**
   * Indicates whether basic auth should be sent; true when either a username or a password is set.
   *
   * @return {@code true} when credentials are configured
   */
  public boolean hasBasicAuth() {
    return basicUsername.isPresent() || basicPassword.isPresent();
  }

  public TlsSettings tls() {
    return tls;
  }

  public int poolMultiplier() {
    return poolMultiplier;
  }

  public Duration timeout() {
    return timeout;
  }

  public Duration connectTimeout() {
    return connectTimeout;
  }

  public String userAgent() {
    return userAgent;
  }

  @Override
  public String toString() {
    return "RemoteWriteConfig{url=" + url
        + ", basicUsername=" + basicUsername.orElse("<none>")
        + ", basicPassword=" + (basicPassword.isPresent() ? "[REDACTED]" : "<none>")
        + ", tls=" + tls
        + ", poolMultiplier=" + poolMultiplier
        + ", timeout=" + timeout
        + ", connectTimeout=" + connectTimeout
        + ", userAgent=" + userAgent + '}';
  }

  private static Optional<String> first(Map<String, String> args, String... keys) {
    for (String key : keys) {
      String value = args.get(key);
      if (value != null && !value.isEmpty()) {
        return Optional.of(value);
      }
    }
    return Optional.empty();
  }

  private static Path toPath(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw);
    try {
      return Path.of(trimmed);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + trimmed, ex);
    }
  }

  private static boolean parseBoolean(String name, String raw) {
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0", "" -> false;
      default -> throw new IllegalArgumentException(name + " must be true or false (was " + raw + ")");
    };
  }

  private static Duration requireTimeout(String name, Duration value) {
    Duration effective = Objects.requireNonNullElse(value, DEFAULT_TIMEOUT);
    Numbers.requireRange(name, effective.toMillis(), 1, MAX_TIMEOUT_MILLIS);
    return effective;
  }

  /**
   * Mutable builder; not thread-safe.
   */
  public static final class Builder {
    private final URI url;
    private Optional<String> basicUsername = Optional.empty();
    private Optional<String> basicPassword = Optional.empty();
    private TlsSettings tls = TlsSettings.none();
    private int poolMultiplier = DEFAULT_POOL_MULTIPLIER;
    private Duration timeout = DEFAULT_TIMEOUT;
    private Duration connectTimeout = DEFAULT_TIMEOUT;
    private String userAgent;

    private Builder(URI url) {
      this.url = Objects.requireNonNull(url, "url");
    }

    public Builder basicUsername(String value) {
      this.basicUsername = Optional.ofNullable(value);
      return this;
    }

    public Builder basicPassword(String value) {
      this.basicPassword = Optional.ofNullable(value);
      return this;
    }

    public Builder tls(TlsSettings value) {
      this.tls = value;
      return this;
    }

    public Builder poolMultiplier(int value) {
      this.poolMultiplier = value;
      return this;
    }

    public Builder timeout(Duration value) {
      this.timeout = value;
      return this;
    }

    public Builder connectTimeout(Duration value) {
      this.connectTimeout = value;
      return this;
    }

    public Builder userAgent(String value) {
      this.userAgent = value;
      return this;
    }

    public RemoteWriteConfig build() {
      return new RemoteWriteConfig(this);
    }
  }
}
