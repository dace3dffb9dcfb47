package ca.gc.cra.prism.application.remotewrite;

/**
 * Thrown when the endpoint answers with a status outside the 2xx class.
 *
 * @since 0.1.0
 */
public final class RemoteRejectedException extends RemoteWriteException {
  private final int statusCode;
  private final String bodyExcerpt;

  /**
   * Creates a rejection carrying the response status and a truncated body.
   *
   * @param statusCode HTTP status returned by the endpoint
   * @param bodyExcerpt leading part of the response body; never {@code null}
   */
  public RemoteRejectedException(int statusCode, String bodyExcerpt) {
    super(ErrorKind.REMOTE_REJECTED, "server returned HTTP status " + statusCode
        + (bodyExcerpt == null || bodyExcerpt.isBlank() ? "" : ": " + bodyExcerpt));
    this.statusCode = statusCode;
    this.bodyExcerpt = bodyExcerpt == null ? "" : bodyExcerpt;
  }

  public int statusCode() {
    return statusCode;
  }

  public String bodyExcerpt() {
    return bodyExcerpt;
  }
}
