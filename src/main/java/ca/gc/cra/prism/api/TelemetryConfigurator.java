package ca.gc.cra.prism.api;

import ca.gc.cra.prism.validation.Net;
import ca.gc.cra.prism.validation.Strings;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves telemetry settings from the merged configuration into the {@code otel.*} system properties read by the
 * OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Removes {@code metricsExporter}, {@code otelEndpoint}, and {@code otelResourceAttributes} from {@code args} and
   * applies them.
   *
   * @param args mutable merged configuration
   * @return {@code true} when the OTLP exporter is selected
   * @throws IllegalArgumentException if a telemetry value is invalid
   */
  static boolean configureMetrics(Map<String, String> args) {
    String exporter = trimToEmpty(args.remove("metricsExporter")).toLowerCase(Locale.ROOT);
    if (exporter.isEmpty()) {
      exporter = "none";
    }
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    System.setProperty("otel.metrics.exporter", exporter);
    log.debug("Configured OpenTelemetry metrics exporter: {}", exporter);

    String endpoint = trimToEmpty(args.remove("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      Net.validateHttpUrl("otelEndpoint", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
      log.debug("Configured OTLP endpoint: {}", endpoint);
    }

    String resourceAttributes = trimToEmpty(args.remove("otelResourceAttributes"));
    if (!resourceAttributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty("otel.resource.attributes", resourceAttributes);
    }
    return exporter.equals("otlp");
  }

  private static String trimToEmpty(String value) {
    return value == null ? "" : value.trim();
  }
}
