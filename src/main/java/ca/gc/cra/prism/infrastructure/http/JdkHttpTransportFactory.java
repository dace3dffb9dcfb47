package ca.gc.cra.prism.infrastructure.http;

import ca.gc.cra.prism.application.port.HostResolver;
import ca.gc.cra.prism.application.port.TransportFactory;
import ca.gc.cra.prism.application.port.TransportHandle;
import ca.gc.cra.prism.application.remotewrite.TlsConfigException;
import ca.gc.cra.prism.config.TlsSettings;
import ca.gc.cra.prism.infrastructure.net.SystemHostResolver;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import javax.net.ssl.SSLContext;

/**
 * <strong>What:</strong> {@link TransportFactory} that creates one {@link HttpClient} per handle.
 * <p><strong>Why:</strong> Each client keeps its own connection pool, so a pool of handles spreads keep-alive
 * connections across the addresses behind the endpoint's name.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; the SSL context is built once per {@link #create(int, TlsSettings)}
 * call and shared by the handles of that generation.</p>
 *
 * @since 0.1.0
 */
public final class JdkHttpTransportFactory implements TransportFactory {
  private final Duration connectTimeout;
  private final Duration requestTimeout;
  private final HostResolver resolver;

  public JdkHttpTransportFactory(Duration connectTimeout, Duration requestTimeout) {
    this(connectTimeout, requestTimeout, new SystemHostResolver());
  }

  /**
   * Creates a factory.
   *
   * @param connectTimeout TCP/TLS connect timeout for every client
   * @param requestTimeout per-request timeout covering the full exchange
   * @param resolver addresses hosts that {@link HttpClient} cannot take by name
   */
  public JdkHttpTransportFactory(Duration connectTimeout, Duration requestTimeout, HostResolver resolver) {
    this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  @Override
  public List<TransportHandle> create(int count, TlsSettings tls) throws TlsConfigException {
    if (count <= 0) {
      throw new IllegalArgumentException("count must be positive (was " + count + ")");
    }
    SSLContext context = TlsContextFactory.create(Objects.requireNonNull(tls, "tls"));
    List<TransportHandle> handles = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      HttpClient client = HttpClient.newBuilder()
          .version(HttpClient.Version.HTTP_1_1)
          .followRedirects(HttpClient.Redirect.NEVER)
          .connectTimeout(connectTimeout)
          .sslContext(context)
          .build();
      handles.add(new JdkHttpTransportHandle(client, requestTimeout, resolver));
    }
    return handles;
  }
}
