package ca.gc.cra.prism.application.remotewrite;

/**
 * Thrown when a write request cannot be serialized or compressed.
 *
 * @since 0.1.0
 */
public final class EncodingException extends RemoteWriteException {
  public EncodingException(String message, Throwable cause) {
    super(ErrorKind.ENCODING, message, cause);
  }
}
