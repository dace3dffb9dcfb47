package ca.gc.cra.prism.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the running PRISM version from the jar manifest or Maven metadata.
 *
 * @since 0.1.0
 */
public final class BuildInfo {
  private static final Logger log = LoggerFactory.getLogger(BuildInfo.class);
  private static final String POM_PROPERTIES = "/META-INF/maven/ca.gc.cra/prism/pom.properties";
  private static final String FALLBACK_VERSION = "0.0.0-dev";
  private static volatile String cached;

  private BuildInfo() {
    // Utility
  }

  /**
   * Returns the implementation version, falling back to {@code 0.0.0-dev} when running from classes.
   *
   * @return version string; never blank
   */
  public static String version() {
    String value = cached;
    if (value == null) {
      value = detect();
      cached = value;
    }
    return value;
  }

  private static String detect() {
    Package pkg = BuildInfo.class.getPackage();
    if (pkg != null) {
      String impl = pkg.getImplementationVersion();
      if (impl != null && !impl.isBlank()) {
        return impl;
      }
    }
    try (InputStream in = BuildInfo.class.getResourceAsStream(POM_PROPERTIES)) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        String version = props.getProperty("version");
        if (version != null && !version.isBlank()) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("Unable to read pom.properties for version detection", ex);
    }
    return FALLBACK_VERSION;
  }
}
