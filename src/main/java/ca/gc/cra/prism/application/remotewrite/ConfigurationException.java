package ca.gc.cra.prism.application.remotewrite;

/**
 * Thrown when the endpoint URL or TLS material cannot be used.
 *
 * @since 0.1.0
 */
public class ConfigurationException extends RemoteWriteException {
  public ConfigurationException(String message) {
    super(ErrorKind.CONFIGURATION, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(ErrorKind.CONFIGURATION, message, cause);
  }
}
