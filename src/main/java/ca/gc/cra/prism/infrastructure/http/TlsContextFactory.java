package ca.gc.cra.prism.infrastructure.http;

import ca.gc.cra.prism.application.remotewrite.TlsConfigException;
import ca.gc.cra.prism.config.TlsSettings;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMException;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;
import org.bouncycastle.util.encoders.DecoderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds an {@link SSLContext} from PEM files described by {@link TlsSettings}.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Trust the certificates in the CA file instead of the JVM trust store when one is configured.</li>
 *   <li>Present the client certificate chain and its unencrypted key when configured. Keys may be PKCS#8
 *   ({@code BEGIN PRIVATE KEY}), PKCS#1 ({@code BEGIN RSA PRIVATE KEY}) or SEC1 ({@code BEGIN EC PRIVATE KEY}).</li>
 *   <li>Accept any server certificate and host name when skip-verify is enabled.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class TlsContextFactory {
  private static final Logger log = LoggerFactory.getLogger(TlsContextFactory.class);
  private static final char[] EPHEMERAL_PASSWORD = "prism".toCharArray();

  private TlsContextFactory() {
    // Utility
  }

  /**
   * Creates an SSL context honouring {@code settings}.
   *
   * @param settings TLS material; {@link TlsSettings#none()} yields the JVM default context
   * @return initialized context
   * @throws TlsConfigException if a file cannot be read or parsed
   */
  public static SSLContext create(TlsSettings settings) throws TlsConfigException {
    try {
      if (!settings.isCustomized()) {
        return SSLContext.getDefault();
      }
      KeyManager[] keyManagers = null;
      if (settings.certFile() != null) {
        keyManagers = keyManagers(settings.certFile(), settings.keyFile());
      }
      TrustManager[] trustManagers = null;
      if (settings.insecureSkipVerify()) {
        log.warn("TLS certificate and host name verification disabled (insecureSkipVerify=true)");
        trustManagers = new TrustManager[] {new TrustAllManager()};
      } else if (settings.caFile() != null) {
        trustManagers = trustManagers(settings.caFile());
      }
      SSLContext context = SSLContext.getInstance("TLS");
      context.init(keyManagers, trustManagers, null);
      return context;
    } catch (GeneralSecurityException ex) {
      throw new TlsConfigException("failed to build TLS context: " + ex.getMessage(), ex);
    }
  }

  private static TrustManager[] trustManagers(Path caFile) throws TlsConfigException, GeneralSecurityException {
    List<X509Certificate> anchors = readCertificates("tlsCa", caFile);
    KeyStore store = emptyStore();
    for (int i = 0; i < anchors.size(); i++) {
      store.setCertificateEntry("ca-" + i, anchors.get(i));
    }
    TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
    factory.init(store);
    return factory.getTrustManagers();
  }

  private static KeyManager[] keyManagers(Path certFile, Path keyFile)
      throws TlsConfigException, GeneralSecurityException {
    List<X509Certificate> chain = readCertificates("tlsCert", certFile);
    PrivateKey key = readPrivateKey(keyFile);
    KeyStore store = emptyStore();
    store.setKeyEntry("client", key, EPHEMERAL_PASSWORD, chain.toArray(new Certificate[0]));
    KeyManagerFactory factory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
    factory.init(store, EPHEMERAL_PASSWORD);
    return factory.getKeyManagers();
  }

  static List<X509Certificate> readCertificates(String name, Path file) throws TlsConfigException {
    try (InputStream in = Files.newInputStream(file)) {
      Collection<? extends Certificate> parsed = CertificateFactory.getInstance("X.509").generateCertificates(in);
      List<X509Certificate> certificates = new ArrayList<>(parsed.size());
      for (Certificate certificate : parsed) {
        certificates.add((X509Certificate) certificate);
      }
      if (certificates.isEmpty()) {
        throw new TlsConfigException(name + " contains no certificates: " + file);
      }
      return certificates;
    } catch (IOException ex) {
      throw new TlsConfigException("cannot read " + name + " file " + file, ex);
    } catch (GeneralSecurityException ex) {
      throw new TlsConfigException("cannot parse " + name + " file " + file + ": " + ex.getMessage(), ex);
    }
  }

  static PrivateKey readPrivateKey(Path file) throws TlsConfigException {
    Object entry;
    try (PEMParser parser = new PEMParser(Files.newBufferedReader(file, StandardCharsets.US_ASCII))) {
      while ((entry = parser.readObject()) != null) {
        if (entry instanceof PEMKeyPair
            || entry instanceof PrivateKeyInfo
            || entry instanceof PKCS8EncryptedPrivateKeyInfo
            || entry instanceof PEMEncryptedKeyPair) {
          break;
        }
        log.debug("Skipping {} entry in tlsKey {}", entry.getClass().getSimpleName(), file);
      }
    } catch (IOException | DecoderException ex) {
      throw new TlsConfigException("cannot read tlsKey file " + file, ex);
    }
    if (entry == null) {
      throw new TlsConfigException("tlsKey contains no PEM private key: " + file);
    }
    if (entry instanceof PKCS8EncryptedPrivateKeyInfo || entry instanceof PEMEncryptedKeyPair) {
      throw new TlsConfigException("tlsKey is encrypted; PRISM needs an unencrypted key: " + file);
    }
    PrivateKeyInfo info = entry instanceof PEMKeyPair pair ? pair.getPrivateKeyInfo() : (PrivateKeyInfo) entry;
    try {
      return new JcaPEMKeyConverter().getPrivateKey(info);
    } catch (PEMException ex) {
      throw new TlsConfigException("cannot load tlsKey " + file + ": " + ex.getMessage(), ex);
    }
  }

  private static KeyStore emptyStore() throws GeneralSecurityException {
    KeyStore store = KeyStore.getInstance(KeyStore.getDefaultType());
    try {
      store.load(null, null);
    } catch (IOException ex) {
      throw new GeneralSecurityException("cannot initialize in-memory key store", ex);
    }
    return store;
  }

  /**
   * Extended trust manager that accepts every chain. Being an {@link X509ExtendedTrustManager}, it also bypasses the
   * endpoint identification the JDK would otherwise wrap around it.
   */
  private static final class TrustAllManager extends X509ExtendedTrustManager {
    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {
      // trust all
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {
      // trust all
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
      // trust all
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
      // trust all
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
      // trust all
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
      // trust all
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }
}
