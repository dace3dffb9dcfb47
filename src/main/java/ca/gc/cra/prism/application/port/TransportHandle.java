package ca.gc.cra.prism.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> One HTTP-capable transport handle held in the transport pool.
 * <p><strong>Why:</strong> The pool rotates requests across several interchangeable handles so connection reuse is
 * spread across the addresses behind the endpoint.</p>
 * <p><strong>Role:</strong> Output port implemented by {@code JdkHttpTransportHandle}.</p>
 * <p><strong>Thread-safety:</strong> Implementations should tolerate sequential use from different threads.</p>
 * <p><strong>Performance:</strong> {@link #execute(TransportRequest)} blocks until the response is read.</p>
 *
 * @since 0.1.0
 */
public interface TransportHandle extends AutoCloseable {
  /**
   * Issues the request and waits for the response.
   *
   * @param request request to send
   * @return status and body
   * @throws IOException on connect, TLS, timeout, or read failures
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  TransportResponse execute(TransportRequest request) throws IOException, InterruptedException;

  /**
   * Releases resources held by the handle. Default does nothing; connection lifecycle belongs to the HTTP stack.
   */
  @Override
  default void close() {}
}
