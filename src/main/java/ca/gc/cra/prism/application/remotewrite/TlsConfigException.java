package ca.gc.cra.prism.application.remotewrite;

/**
 * Thrown when a CA bundle, client certificate, or private key cannot be loaded.
 *
 * @since 0.1.0
 */
public final class TlsConfigException extends ConfigurationException {
  public TlsConfigException(String message) {
    super(message);
  }

  public TlsConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
