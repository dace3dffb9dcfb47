package ca.gc.cra.prism.application.port;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * Outbound HTTP POST handed to a {@link TransportHandle}.
 *
 * @param uri target endpoint
 * @param headers request headers in insertion order
 * @param body request body; not copied
 * @since 0.1.0
 */
public record TransportRequest(URI uri, Map<String, String> headers, byte[] body) {
  public TransportRequest {
    Objects.requireNonNull(uri, "uri");
    headers = Map.copyOf(Objects.requireNonNull(headers, "headers"));
    Objects.requireNonNull(body, "body");
  }
}
