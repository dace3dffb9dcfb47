package ca.gc.cra.prism.application.remotewrite;

import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.port.HostResolver;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.application.port.TransportFactory;
import ca.gc.cra.prism.application.port.WriteRequestPackager;
import ca.gc.cra.prism.config.RemoteWriteConfig;
import ca.gc.cra.prism.domain.metric.MetricRecord;
import java.security.SecureRandom;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Ships batches of metric records to a Prometheus remote-write endpoint.
 * <p><strong>Why:</strong> Binds the encoder, packager, transport pool, and delivery client into the two operations
 * callers need: {@link #connect()} and {@link #write(List)}.</p>
 * <p><strong>Role:</strong> Application use case constructed by the composition root.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the endpoint and build the transport pool on connect.</li>
 *   <li>Encode, pack, and post each batch as one request.</li>
 *   <li>Log failures and surface them as typed {@link RemoteWriteException}s.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single writer only. Serialize calls to {@link #write(List)} externally.</p>
 * <p><strong>Observability:</strong> Emits {@code remote_write.encode.*} and {@code remote_write.payload.bytes} in
 * addition to the delivery client's metrics.</p>
 *
 * @since 0.1.0
 */
public final class RemoteWriteShipper implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RemoteWriteShipper.class);

  private final RemoteWriteConfig config;
  private final TimeSeriesEncoder encoder;
  private final WriteRequestPackager packager;
  private final MetricsPort metrics;
  private final TransportPool pool;
  private final RemoteWriteDeliveryClient client;
  private boolean connected;

  public RemoteWriteShipper(
      RemoteWriteConfig config,
      HostResolver resolver,
      TransportFactory transports,
      WriteRequestPackager packager,
      MetricsPort metrics,
      ClockPort clock) {
    this(config, resolver, transports, packager, metrics, clock, new SecureRandom());
  }

  /**
   * Creates a shipper with an explicit jitter source.
   *
   * @param config validated remote-write settings
   * @param resolver DNS port
   * @param transports transport factory
   * @param packager serializer/compressor
   * @param metrics metrics sink
   * @param clock wall clock driving pool refresh
   * @param random jitter source for refresh deadlines
   */
  public RemoteWriteShipper(
      RemoteWriteConfig config,
      HostResolver resolver,
      TransportFactory transports,
      WriteRequestPackager packager,
      MetricsPort metrics,
      ClockPort clock,
      Random random) {
    this.config = Objects.requireNonNull(config, "config");
    this.packager = Objects.requireNonNull(packager, "packager");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.encoder = new TimeSeriesEncoder();
    this.pool = new TransportPool(
        config.url(), config.tls(), config.poolMultiplier(), resolver, transports, clock, random);
    this.client = new RemoteWriteDeliveryClient(config, pool, packager, this.metrics, clock);
  }

  /**
   * Resolves the endpoint and builds the transport pool.
   *
   * @throws ConfigurationException if TLS material cannot be loaded
   * @throws ResolutionException if the endpoint host does not resolve
   */
  public void connect() throws ConfigurationException, ResolutionException {
    try {
      pool.resolve();
    } catch (ConfigurationException | ResolutionException ex) {
      log.error("Remote write connect to {} failed: {}", config.url(), ex.getMessage());
      throw ex;
    }
    connected = true;
    log.info("Remote write shipper connected to {} with {} transport(s)", config.url(), pool.size());
  }

  /**
   * Encodes and delivers {@code records} as a single remote-write request.
   *
   * <p>An empty or fully skipped batch is still posted as an empty request.</p>
   *
   * @param records batch to ship; must not be {@code null}
   * @throws IllegalStateException if {@link #connect()} has not succeeded
   * @throws RemoteWriteException if encoding, delivery, or the subsequent pool refresh fails
   */
  public void write(List<MetricRecord> records) throws RemoteWriteException {
    Objects.requireNonNull(records, "records");
    if (!connected) {
      throw new IllegalStateException("remote write shipper not connected; call connect() first");
    }
    EncodedBatch batch = encoder.encodeBatch(records);
    if (batch.recordsSkipped() > 0 || batch.fieldsSkipped() > 0) {
      log.debug("Skipped {} record(s) and {} non-numeric field(s) of {}",
          batch.recordsSkipped(), batch.fieldsSkipped(), batch.recordsSeen());
    }
    metrics.observe("remote_write.encode.skipped", batch.recordsSkipped());
    metrics.observe("remote_write.encode.series", batch.seriesEmitted());

    try {
      byte[] payload = packager.pack(batch.request());
      metrics.observe("remote_write.payload.bytes", payload.length);
      client.send(payload);
    } catch (EncodingException ex) {
      metrics.increment("remote_write.deliver.failure." + ex.kind().token());
      log.warn("Remote write encoding failed: {}", ex.getMessage());
      throw ex;
    } catch (RemoteWriteException ex) {
      log.warn("Remote write to {} failed ({}): {}", config.url(), ex.kind().token(), ex.getMessage());
      throw ex;
    }
  }

  public boolean isConnected() {
    return connected;
  }

  public DeliveryState lastState() {
    return client.lastState();
  }

  TransportPool pool() {
    return pool;
  }

  /**
   * Closes pooled transports. The shipper must be reconnected before further writes.
   */
  @Override
  public void close() {
    connected = false;
    pool.close();
  }
}
