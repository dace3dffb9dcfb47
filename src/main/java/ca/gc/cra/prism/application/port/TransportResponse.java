package ca.gc.cra.prism.application.port;

/**
 * Status and body returned by the remote endpoint.
 *
 * @param statusCode HTTP status code
 * @param body response body decoded as UTF-8; empty when absent
 * @since 0.1.0
 */
public record TransportResponse(int statusCode, String body) {
  public TransportResponse {
    body = body == null ? "" : body;
  }

  /**
   * Indicates a 2xx status.
   *
   * @return {@code true} when {@code statusCode / 100 == 2}
   */
  public boolean isSuccess() {
    return statusCode / 100 == 2;
  }
}
