package ca.gc.cra.prism.application.remotewrite;

import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.application.port.TransportHandle;
import ca.gc.cra.prism.application.port.TransportRequest;
import ca.gc.cra.prism.application.port.TransportResponse;
import ca.gc.cra.prism.application.port.WriteRequestPackager;
import ca.gc.cra.prism.config.RemoteWriteConfig;
import ca.gc.cra.prism.logging.Logs;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Posts one packed remote-write payload over the next pooled transport.
 * <p><strong>Why:</strong> Keeps header construction, status mapping, and the post-success pool refresh in one place.</p>
 * <p><strong>Role:</strong> Application service used by {@link RemoteWriteShipper}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Attach the protocol headers, user agent, and optional basic credentials.</li>
 *   <li>Map I/O failures to {@link TransportException} and non-2xx statuses to {@link RemoteRejectedException}.</li>
 *   <li>Refresh the {@link TransportPool} after a delivered request once its deadline has passed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; shares the single-writer contract of its pool.</p>
 * <p><strong>Observability:</strong> Emits {@code remote_write.deliver.*} and {@code remote_write.pool.refresh}.</p>
 *
 * @since 0.1.0
 */
public final class RemoteWriteDeliveryClient {
  private static final Logger log = LoggerFactory.getLogger(RemoteWriteDeliveryClient.class);

  /** Remote-write protocol version advertised on every request. */
  public static final String PROTOCOL_VERSION = "0.1.0";
  /** Header carrying {@link #PROTOCOL_VERSION}. */
  public static final String VERSION_HEADER = "X-Prometheus-Remote-Write-Version";
  /** Maximum number of response body bytes kept in a rejection. */
  public static final int MAX_BODY_EXCERPT_BYTES = 512;

  private final RemoteWriteConfig config;
  private final TransportPool pool;
  private final WriteRequestPackager packager;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final String authorization;
  private DeliveryState lastState = DeliveryState.IDLE;

  /**
   * Creates a delivery client bound to {@code pool}.
   *
   * @param config endpoint, credentials, and user agent
   * @param pool transport pool; must already be resolved before {@link #send(byte[])}
   * @param packager packager whose content headers describe the payload
   * @param metrics metrics sink
   */
  public RemoteWriteDeliveryClient(
      RemoteWriteConfig config,
      TransportPool pool,
      WriteRequestPackager packager,
      MetricsPort metrics,
      ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.pool = Objects.requireNonNull(pool, "pool");
    this.packager = Objects.requireNonNull(packager, "packager");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.authorization = config.hasBasicAuth() ? basicAuthorization(config) : null;
  }

  /**
   * Sends {@code payload} and, on success, refreshes the pool if due.
   *
   * <p>A refresh failure after a delivered request still propagates; {@link #lastState()} stays
   * {@link DeliveryState#DELIVERED} in that case.</p>
   *
   * @param payload packed request bytes
   * @throws TransportException if the request could not be completed
   * @throws RemoteRejectedException if the endpoint answered with a non-2xx status
   * @throws ResolutionException if the due refresh could not resolve the host
   * @throws ConfigurationException if the due refresh could not rebuild the transports
   */
  public void send(byte[] payload) throws RemoteWriteException {
    Objects.requireNonNull(payload, "payload");
    TransportHandle handle = pool.acquire();
    TransportRequest request = new TransportRequest(config.url(), headers(), payload);
    lastState = DeliveryState.SENDING;
    long start = clock.monotonicNanos();
    TransportResponse response;
    try {
      response = handle.execute(request);
    } catch (IOException ex) {
      fail(ErrorKind.TRANSPORT, start);
      throw new TransportException("remote write to " + config.url() + " failed: " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      fail(ErrorKind.TRANSPORT, start);
      throw new TransportException("remote write to " + config.url() + " interrupted", ex);
    }

    if (!response.isSuccess()) {
      fail(ErrorKind.REMOTE_REJECTED, start);
      throw new RemoteRejectedException(
          response.statusCode(), Logs.truncate(response.body(), MAX_BODY_EXCERPT_BYTES));
    }

    lastState = DeliveryState.DELIVERED;
    metrics.observe("remote_write.deliver.latencyNanos", clock.monotonicNanos() - start);
    metrics.increment("remote_write.deliver.success");
    log.debug("Delivered {} bytes to {} (status {})", payload.length, config.url(), response.statusCode());

    if (pool.maybeRefresh()) {
      metrics.increment("remote_write.pool.refresh");
    }
  }

  /**
   * Returns the outcome of the most recent {@link #send(byte[])} call.
   *
   * @return delivery state; {@link DeliveryState#IDLE} before the first call
   */
  public DeliveryState lastState() {
    return lastState;
  }

  private void fail(ErrorKind kind, long start) {
    lastState = DeliveryState.FAILED;
    metrics.observe("remote_write.deliver.latencyNanos", clock.monotonicNanos() - start);
    metrics.increment("remote_write.deliver.failure." + kind.token());
  }

  private Map<String, String> headers() {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Content-Encoding", packager.contentEncoding());
    headers.put("Content-Type", packager.contentType());
    headers.put(VERSION_HEADER, PROTOCOL_VERSION);
    headers.put("User-Agent", config.userAgent());
    if (authorization != null) {
      headers.put("Authorization", authorization);
    }
    return headers;
  }

  static String basicAuthorization(RemoteWriteConfig config) {
    String user = config.basicUsername().orElse("");
    String password = config.basicPassword().orElse("");
    String token = Base64.getEncoder()
        .encodeToString((user + ":" + password).getBytes(StandardCharsets.UTF_8));
    return "Basic " + token;
  }
}
