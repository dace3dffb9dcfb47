package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.application.remotewrite.TlsConfigException;
import ca.gc.cra.prism.config.TlsSettings;
import java.util.List;

/**
 * <strong>What:</strong> Port creating batches of transport handles sharing one TLS configuration.
 * <p><strong>Why:</strong> Each pool rebuild creates a fresh set of handles; TLS material is re-read on every rebuild
 * so rotated certificates are picked up.</p>
 * <p><strong>Role:</strong> Output port used by {@code TransportPool}.</p>
 * <p><strong>Thread-safety:</strong> Implementations should be stateless.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.prism.infrastructure.http.JdkHttpTransportFactory
 */
@FunctionalInterface
public interface TransportFactory {
  /**
   * Creates {@code count} handles configured with {@code tls}.
   *
   * @param count number of handles to create; positive
   * @param tls TLS material and verification preferences
   * @return list of exactly {@code count} handles
   * @throws TlsConfigException if the TLS material cannot be loaded
   */
  List<TransportHandle> create(int count, TlsSettings tls) throws TlsConfigException;
}
