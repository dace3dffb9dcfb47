package ca.gc.cra.prism.config;

import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.port.HostResolver;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.application.port.TransportFactory;
import ca.gc.cra.prism.application.remotewrite.RemoteWriteShipper;
import ca.gc.cra.prism.infrastructure.http.JdkHttpTransportFactory;
import ca.gc.cra.prism.infrastructure.input.NdjsonMetricRecordReader;
import ca.gc.cra.prism.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.prism.infrastructure.net.SystemHostResolver;
import ca.gc.cra.prism.infrastructure.remotewrite.SnappyProtobufPackager;
import ca.gc.cra.prism.infrastructure.time.SystemClockAdapter;
import java.util.Objects;

/**
 * <strong>What:</strong> Central composition root that wires the remote-write shipper to concrete adapters.
 * <p><strong>Why:</strong> Keeps adapter selection (DNS, HTTP, packager, metrics exporter) out of the CLI and the use
 * case.</p>
 * <p><strong>Role:</strong> Adapter composition root for the {@code ship} command.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods create new instances.</p>
 *
 * @since 0.1.0
 * @see RemoteWriteShipper
 */
public final class CompositionRoot implements AutoCloseable {
  private final RemoteWriteConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final HostResolver resolver;
  private final TransportFactory transports;

  /**
   * Creates a composition root with production adapters.
   *
   * @param config validated remote-write settings
   * @param exportMetrics whether to export self-telemetry through OpenTelemetry
   */
  public CompositionRoot(RemoteWriteConfig config, boolean exportMetrics) {
    this(config, exportMetrics, new SystemHostResolver());
  }

  private CompositionRoot(RemoteWriteConfig config, boolean exportMetrics, HostResolver resolver) {
    this(
        config,
        exportMetrics ? new OpenTelemetryMetricsAdapter() : MetricsPort.NO_OP,
        new SystemClockAdapter(),
        resolver,
        new JdkHttpTransportFactory(config.connectTimeout(), config.timeout(), resolver));
  }

  /**
   * Creates a composition root with explicit adapters; used by tests to substitute DNS or transports.
   */
  public CompositionRoot(
      RemoteWriteConfig config,
      MetricsPort metrics,
      ClockPort clock,
      HostResolver resolver,
      TransportFactory transports) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.transports = Objects.requireNonNull(transports, "transports");
  }

  /**
   * Builds an unconnected shipper.
   *
   * @return new shipper instance
   */
  public RemoteWriteShipper shipper() {
    return new RemoteWriteShipper(config, resolver, transports, new SnappyProtobufPackager(), metrics, clock);
  }

  /**
   * Builds the NDJSON input reader sharing this root's clock.
   *
   * @return record reader
   */
  public NdjsonMetricRecordReader recordReader() {
    return new NdjsonMetricRecordReader(clock);
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public RemoteWriteConfig config() {
    return config;
  }

  /**
   * Flushes and shuts down the metrics exporter, if one was created.
   */
  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }
}
