package ca.gc.cra.prism.application.remotewrite;

/**
 * Thrown when the HTTP exchange fails before a response status is read.
 *
 * @since 0.1.0
 */
public final class TransportException extends RemoteWriteException {
  public TransportException(String message, Throwable cause) {
    super(ErrorKind.TRANSPORT, message, cause);
  }
}
