package ca.gc.cra.prism.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Switches PRISM loggers to DEBUG when {@code --verbose} is given.
 *
 * <p>Only the {@code ca.gc.cra.prism} hierarchy is raised; OpenTelemetry and JDK HTTP client loggers keep the
 * levels from {@code logback.xml}.</p>
 */
public final class LoggingConfigurator {
  static final String PRISM_LOGGER = "ca.gc.cra.prism";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {}

  /**
   * Raises the PRISM logger hierarchy to DEBUG.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("--verbose ignored: logging backend {} cannot change levels at runtime",
          factory.getClass().getName());
      return false;
    }
    Logger prism = context.getLogger(PRISM_LOGGER);
    prism.setLevel(Level.DEBUG);
    log.debug("Verbose logging enabled for {}", PRISM_LOGGER);
    return true;
  }
}
