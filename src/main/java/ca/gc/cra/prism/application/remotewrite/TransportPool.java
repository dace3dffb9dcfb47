package ca.gc.cra.prism.application.remotewrite;

import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.port.HostResolver;
import ca.gc.cra.prism.application.port.TransportFactory;
import ca.gc.cra.prism.application.port.TransportHandle;
import ca.gc.cra.prism.config.TlsSettings;
import ca.gc.cra.prism.validation.Net;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Round-robin pool of transport handles sized from the endpoint's DNS answer.
 * <p><strong>Why:</strong> Endpoints behind DNS load balancing change addresses over time; rebuilding the pool on a
 * jittered deadline spreads new connections across the current addresses while keeping many shipper instances
 * from refreshing in lock step.</p>
 * <p><strong>Role:</strong> Explicit pool state owned by one {@link RemoteWriteShipper}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the URL host and create {@code multiplier x max(1, addresses)} handles.</li>
 *   <li>Hand out handles in round-robin order.</li>
 *   <li>Rebuild wholesale once the refresh deadline has passed, keeping the old pool if the rebuild fails.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. The cursor and deadline are plain fields; callers must not share
 * one pool between concurrent writers.</p>
 * <p><strong>Performance:</strong> {@link #acquire()} is O(1); {@link #resolve()} blocks on DNS and handle creation.</p>
 *
 * @since 0.1.0
 */
public final class TransportPool implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TransportPool.class);

  /** Fixed part of the refresh interval. */
  public static final long REFRESH_BASE_MILLIS = 60_000L;
  /** Exclusive upper bound of the random part of the refresh interval. */
  public static final long REFRESH_JITTER_MILLIS = 90_000L;

  private final URI url;
  private final TlsSettings tls;
  private final int multiplier;
  private final HostResolver resolver;
  private final TransportFactory factory;
  private final ClockPort clock;
  private final Random random;

  private List<TransportHandle> handles = List.of();
  private int cursor;
  private long refreshDeadlineMillis;
  private int addressCount;
  private long generation;

  /**
   * Creates an unresolved pool; call {@link #resolve()} before {@link #acquire()}.
   *
   * @param url endpoint whose host is resolved
   * @param tls TLS material handed to the factory on every rebuild
   * @param multiplier handles created per resolved address; positive
   * @param resolver DNS port
   * @param factory transport handle factory
   * @param clock wall clock for the refresh deadline
   * @param random jitter source
   */
  public TransportPool(
      URI url,
      TlsSettings tls,
      int multiplier,
      HostResolver resolver,
      TransportFactory factory,
      ClockPort clock,
      Random random) {
    this.url = Objects.requireNonNull(url, "url");
    this.tls = Objects.requireNonNull(tls, "tls");
    if (multiplier <= 0) {
      throw new IllegalArgumentException("multiplier must be positive (was " + multiplier + ")");
    }
    this.multiplier = multiplier;
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.factory = Objects.requireNonNull(factory, "factory");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.random = Objects.requireNonNull(random, "random");
  }

  /**
   * Resolves the endpoint host and replaces the pool with freshly created handles.
   *
   * <p>On failure the current handles, cursor, and deadline are left untouched.</p>
   *
   * @throws ConfigurationException if the URL has no host
   * @throws TlsConfigException if the TLS material cannot be loaded
   * @throws ResolutionException if the host cannot be resolved
   */
  public void resolve() throws ConfigurationException, ResolutionException {
    String host = Net.bareHost(url);
    if (host == null || host.isBlank()) {
      throw new ConfigurationException("remote-write url has no host: " + url);
    }
    List<InetAddress> addresses;
    try {
      addresses = resolver.resolve(host);
    } catch (UnknownHostException ex) {
      throw new ResolutionException(host, ex);
    }
    int resolved = addresses == null ? 0 : addresses.size();
    int size = multiplier * Math.max(1, resolved);
    List<TransportHandle> fresh = List.copyOf(factory.create(size, tls));
    if (fresh.size() != size) {
      throw new IllegalStateException(
          "transport factory returned " + fresh.size() + " handles, expected " + size);
    }

    long now = clock.nowMillis();
    this.handles = fresh;
    this.cursor = 0;
    this.addressCount = resolved;
    this.refreshDeadlineMillis = now + REFRESH_BASE_MILLIS + random.nextLong(REFRESH_JITTER_MILLIS);
    this.generation++;
    log.info("Resolved {} to {} address(es); transport pool size {} (generation {}), next refresh in {} ms",
        host, resolved, size, generation, refreshDeadlineMillis - now);
  }

  /**
   * Advances the cursor, wrapping to zero at the pool size, and returns the handle at the new position.
   *
   * @return transport handle for the next delivery attempt
   * @throws IllegalStateException if the pool has not been resolved
   */
  public TransportHandle acquire() {
    if (handles.isEmpty()) {
      throw new IllegalStateException("transport pool not resolved; call connect() first");
    }
    cursor++;
    if (cursor >= handles.size()) {
      cursor = 0;
    }
    return handles.get(cursor);
  }

  /**
   * Rebuilds the pool when the refresh deadline has passed.
   *
   * @return {@code true} if a rebuild happened
   * @throws ConfigurationException if TLS material became unusable
   * @throws ResolutionException if the host no longer resolves
   */
  public boolean maybeRefresh() throws ConfigurationException, ResolutionException {
    if (clock.nowMillis() < refreshDeadlineMillis) {
      return false;
    }
    log.debug("Transport pool refresh deadline passed; re-resolving {}", Net.bareHost(url));
    resolve();
    return true;
  }

  public boolean isResolved() {
    return !handles.isEmpty();
  }

  public int size() {
    return handles.size();
  }

  public int cursor() {
    return cursor;
  }

  public long refreshDeadlineMillis() {
    return refreshDeadlineMillis;
  }

  public int addressCount() {
    return addressCount;
  }

  /**
   * Returns how many times the pool has been (re)built; doubles as a resolution counter.
   *
   * @return successful resolve count
   */
  public long generation() {
    return generation;
  }

  List<TransportHandle> handles() {
    return handles;
  }

  /**
   * Closes every handle of the current generation and empties the pool.
   */
  @Override
  public void close() {
    List<TransportHandle> current = handles;
    handles = List.of();
    cursor = 0;
    for (TransportHandle handle : current) {
      handle.close();
    }
  }
}
