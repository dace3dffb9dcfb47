package ca.gc.cra.prism.infrastructure.metrics;

import ca.gc.cra.prism.config.BuildInfo;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the meter provider behind {@link OpenTelemetryMetricsAdapter}.
 *
 * <p>Settings come from {@code otel.*} system properties (set by the CLI from {@code metricsExporter},
 * {@code otelEndpoint}, {@code otelResourceAttributes}), falling back to the standard {@code OTEL_*} environment
 * variables. Anything other than {@code otlp} disables export.</p>
 */
final class OpenTelemetryBootstrap {
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.prism";

  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final long SHUTDOWN_WAIT_SECONDS = 5;

  private OpenTelemetryBootstrap() {}

  static BootstrapResult initialize() {
    return initialize(ExportSettings.read(System::getProperty, System::getenv));
  }

  static BootstrapResult initialize(ExportSettings settings) {
    if (!settings.otlp()) {
      log.info("OpenTelemetry metrics export disabled");
      return BootstrapResult.noop();
    }
    try {
      OtlpGrpcMetricExporter exporter = OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(settings.interval()).build();
      BootstrapResult result = start(reader, settings.resourceAttributes());
      log.info("Exporting PRISM metrics over OTLP to {} every {} s",
          settings.endpoint(), settings.interval().toSeconds());
      return result;
    } catch (RuntimeException ex) {
      log.error("OpenTelemetry metrics could not start; continuing without export", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return start(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static BootstrapResult start(MetricReader reader, Attributes extraResource) {
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource(extraResource))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(BuildInfo.version())
        .build();
    return BootstrapResult.active(provider, meter);
  }

  private static Resource resource(Attributes extra) {
    AttributesBuilder service = Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), "prism")
        .put(AttributeKey.stringKey("service.namespace"), "ca.gc.cra")
        .put(AttributeKey.stringKey("service.version"), BuildInfo.version())
        .put(AttributeKey.stringKey("service.instance.id"), instanceId());
    // user-supplied attributes win over the built-in service identity
    return Resource.getDefault().merge(Resource.create(service.build())).merge(Resource.create(extra));
  }

  private static String instanceId() {
    long pid = ProcessHandle.current().pid();
    try {
      return InetAddress.getLocalHost().getHostName() + ":" + pid;
    } catch (UnknownHostException ex) {
      log.debug("Local host name unavailable; using pid only for service.instance.id", ex);
      return "pid-" + pid;
    }
  }

  /**
   * Parses {@code key=value,key=value}; malformed entries are logged and skipped.
   */
  static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    if (raw == null) {
      return builder.build();
    }
    for (String entry : raw.split(",")) {
      int eq = entry.indexOf('=');
      String key = eq < 0 ? "" : entry.substring(0, eq).trim();
      String value = eq < 0 ? "" : entry.substring(eq + 1).trim();
      if (key.isEmpty() || value.isEmpty()) {
        if (!entry.isBlank()) {
          log.warn("Ignoring malformed resource attribute '{}'", entry.trim());
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  /**
   * Export settings resolved from properties then environment.
   *
   * @param otlp whether the OTLP exporter was selected
   * @param endpoint OTLP gRPC endpoint
   * @param interval export period
   * @param resourceAttributes extra resource attributes
   */
  record ExportSettings(boolean otlp, String endpoint, Duration interval, Attributes resourceAttributes) {
    static final String DEFAULT_ENDPOINT = "http://localhost:4317";
    static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

    static ExportSettings read(UnaryOperator<String> properties, UnaryOperator<String> environment) {
      String exporter = lookup(properties, environment, "otel.metrics.exporter", "OTEL_METRICS_EXPORTER", "none")
          .toLowerCase(Locale.ROOT);
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        log.warn("Unsupported metrics exporter '{}'; export disabled", exporter);
      }
      String endpoint = lookup(properties, environment,
          "otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_ENDPOINT);
      String intervalMillis = lookup(properties, environment,
          "otel.metric.export.interval", "OTEL_METRIC_EXPORT_INTERVAL", "");
      return new ExportSettings(
          exporter.equals("otlp"),
          endpoint,
          interval(intervalMillis),
          parseResourceAttributes(lookup(properties, environment,
              "otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES", "")));
    }

    private static Duration interval(String millis) {
      if (millis.isEmpty()) {
        return DEFAULT_INTERVAL;
      }
      try {
        long value = Long.parseLong(millis);
        if (value > 0) {
          return Duration.ofMillis(value);
        }
      } catch (NumberFormatException ex) {
        log.debug("Export interval '{}' is not a number", millis, ex);
      }
      log.warn("Ignoring invalid metric export interval '{}' ms; using {} s", millis, DEFAULT_INTERVAL.toSeconds());
      return DEFAULT_INTERVAL;
    }

    private static String lookup(
        UnaryOperator<String> properties, UnaryOperator<String> environment,
        String property, String variable, String fallback) {
      String value = properties.apply(property);
      if (value == null || value.isBlank()) {
        value = environment.apply(variable);
      }
      return value == null || value.isBlank() ? fallback : value.trim();
    }
  }

  /**
   * Meter plus the provider that owns it; the provider is {@code null} in noop mode.
   */
  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    static BootstrapResult active(SdkMeterProvider provider, Meter meter) {
      return new BootstrapResult(Objects.requireNonNull(meter, "meter"), Objects.requireNonNull(provider, "provider"));
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode pending, String what) {
      if (!pending.join(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS).isSuccess()) {
        log.warn("OpenTelemetry meter provider {} did not complete within {} s", what, SHUTDOWN_WAIT_SECONDS);
      }
    }
  }
}
