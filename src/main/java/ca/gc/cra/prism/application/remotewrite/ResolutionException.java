package ca.gc.cra.prism.application.remotewrite;

/**
 * Thrown when the endpoint host name cannot be resolved.
 *
 * @since 0.1.0
 */
public final class ResolutionException extends RemoteWriteException {
  private final String host;

  public ResolutionException(String host, Throwable cause) {
    super(ErrorKind.RESOLUTION, "Failed to resolve remote-write host " + host, cause);
    this.host = host;
  }

  public String host() {
    return host;
  }
}
