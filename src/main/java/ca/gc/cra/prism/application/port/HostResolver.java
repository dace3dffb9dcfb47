package ca.gc.cra.prism.application.port;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

/**
 * <strong>What:</strong> Port resolving a host name to its current addresses.
 * <p><strong>Why:</strong> Pool sizing follows the number of addresses behind the remote-write endpoint; tests
 * substitute a counting resolver to observe refresh behaviour.</p>
 * <p><strong>Role:</strong> Output port used by {@code TransportPool}.</p>
 * <p><strong>Thread-safety:</strong> Implementations should be thread-safe.</p>
 * <p><strong>Performance:</strong> May block for the duration of a DNS lookup.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.prism.infrastructure.net.SystemHostResolver
 */
@FunctionalInterface
public interface HostResolver {
  /**
   * Resolves {@code host} to one or more addresses.
   *
   * @param host host name or address literal; never {@code null}
   * @return non-empty list of addresses
   * @throws UnknownHostException if the name cannot be resolved
   */
  List<InetAddress> resolve(String host) throws UnknownHostException;
}
