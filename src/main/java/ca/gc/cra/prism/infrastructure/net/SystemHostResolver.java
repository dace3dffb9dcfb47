package ca.gc.cra.prism.infrastructure.net;

import ca.gc.cra.prism.application.port.HostResolver;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link HostResolver} that asks the JVM's configured name service.
 * <p><strong>Thread-safety:</strong> Stateless; thread-safe.</p>
 * <p><strong>Performance:</strong> Subject to the JVM DNS cache ({@code networkaddress.cache.ttl}); a short TTL lets
 * pool refreshes observe address changes.</p>
 *
 * @since 0.1.0
 */
public final class SystemHostResolver implements HostResolver {
  private static final Logger log = LoggerFactory.getLogger(SystemHostResolver.class);

  @Override
  public List<InetAddress> resolve(String host) throws UnknownHostException {
    List<InetAddress> addresses = List.of(InetAddress.getAllByName(host));
    log.debug("Resolved {} -> {}", host, addresses);
    return addresses;
  }
}
