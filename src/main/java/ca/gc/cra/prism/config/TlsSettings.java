package ca.gc.cra.prism.config;

import java.nio.file.Path;
import java.util.Optional;

/**
 * <strong>What:</strong> TLS material and verification preferences for the remote-write transport.
 * <p><strong>Why:</strong> Lets operators pin a private CA, present a client certificate, or (for testing only)
 * skip verification.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable.</p>
 *
 * @param caFile PEM bundle of trusted CA certificates; {@code null} uses the JVM trust store
 * @param certFile PEM client certificate chain; requires {@code keyFile}
 * @param keyFile unencrypted PEM private key (PKCS#8, PKCS#1 or SEC1) matching {@code certFile}
 * @param insecureSkipVerify trust any server certificate and skip host name verification
 * @since 0.1.0
 */
public record TlsSettings(Path caFile, Path certFile, Path keyFile, boolean insecureSkipVerify) {
  public TlsSettings {
    if ((certFile == null) != (keyFile == null)) {
      throw new IllegalArgumentException("tlsCert and tlsKey must be configured together");
    }
  }

  /**
   * Returns settings that rely on the JVM defaults.
   *
   * @return settings with no custom material
   */
  public static TlsSettings none() {
    return new TlsSettings(null, null, null, false);
  }

  /**
   * Indicates whether any custom TLS behaviour was requested.
   *
   * @return {@code true} when a CA, client certificate, or skip-verify is configured
   */
  public boolean isCustomized() {
    return caFile != null || certFile != null || insecureSkipVerify;
  }

  public Optional<Path> ca() {
    return Optional.ofNullable(caFile);
  }

  public Optional<Path> cert() {
    return Optional.ofNullable(certFile);
  }

  public Optional<Path> key() {
    return Optional.ofNullable(keyFile);
  }
}
