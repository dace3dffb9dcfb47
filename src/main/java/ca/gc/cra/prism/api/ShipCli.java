package ca.gc.cra.prism.api;

import ca.gc.cra.prism.application.remotewrite.RemoteWriteException;
import ca.gc.cra.prism.application.remotewrite.RemoteWriteShipper;
import ca.gc.cra.prism.config.CompositionRoot;
import ca.gc.cra.prism.config.ConfigMerger;
import ca.gc.cra.prism.config.DefaultsForMode;
import ca.gc.cra.prism.config.RemoteWriteConfig;
import ca.gc.cra.prism.config.YamlConfigLoader;
import ca.gc.cra.prism.domain.metric.MetricRecord;
import ca.gc.cra.prism.logging.LoggingConfigurator;
import ca.gc.cra.prism.logging.Logs;
import ca.gc.cra.prism.validation.Numbers;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point that ships NDJSON metric records to a Prometheus remote-write endpoint.
 *
 * @since 0.1.0
 */
public final class ShipCli {
  private static final Logger log = LoggerFactory.getLogger(ShipCli.class);
  private static final String MODE = "ship";
  private static final int MAX_BATCH_SIZE = 1_000_000;
  private static final Set<String> KNOWN_FLAGS = Set.of("--dry-run");
  private static final String SUMMARY_USAGE =
      "usage: ship url=URL in=PATH [config=PATH] [batchSize=N] [poolMultiplier=N] "
          + "[basicUsername=USER basicPassword=PASS] [tlsCa=PEM] [tlsCert=PEM tlsKey=PEM] "
          + "[insecureSkipVerify=true|false] [--dry-run]";
  private static final String HELP_TEXT = """
      PRISM remote-write shipper

      Usage:
        ship url=URL in=PATH [options]

      Endpoint:
        url=URL                    http(s) remote-write endpoint (required)
        basicUsername=USER         Basic auth user name
        basicPassword=PASS         Basic auth password (never printed)
        tlsCa=PEM                  CA bundle used instead of the JVM trust store
        tlsCert=PEM tlsKey=PEM     Client certificate chain and unencrypted key
        insecureSkipVerify=BOOL    Accept any server certificate (default false)

      Transport:
        poolMultiplier=N           Transports per resolved address, 1-64 (default 5)
        timeoutMillis=N            Request timeout (default 5000)
        connectTimeoutMillis=N     Connect timeout (default 5000)
        userAgent=TEXT             User-Agent header (default PRISM/<version>)

      Input:
        in=PATH                    NDJSON metric records, one object per line
        batchSize=N                Records per remote-write request, 1-1000000 (default 1000)

      Global options:
        config=PATH                YAML file with common/ship sections (default ~/.prism/prism.yaml)
        metricsExporter=otlp|none  Self-telemetry exporter (default none)
        otelEndpoint=URL           OTLP endpoint when metricsExporter=otlp
        --dry-run                  Validate configuration and print the plan without sending
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private ShipCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the ship command and returns a normalized exit code.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.printBlock(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for ship CLI");
    }
    List<String> unknownFlags = input.unknownFlags(KNOWN_FLAGS);
    if (!unknownFlags.isEmpty()) {
      log.error("Unknown option(s): {}", unknownFlags);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    boolean dryRun = input.hasFlag("--dry-run");

    Map<String, String> cliKv;
    try {
      cliKv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String explicitConfig = cliKv.remove("config");
    Optional<Map<String, String>> yaml;
    try {
      yaml = loadYamlConfig(explicitConfig);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    Map<String, String> effective;
    boolean exportMetrics;
    Optional<Path> inputFile;
    int batchSize;
    RemoteWriteConfig config;
    try {
      effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          MODE, yaml, cliKv, DefaultsForMode.asFlatMap(MODE), log::warn));
      exportMetrics = TelemetryConfigurator.configureMetrics(effective);
      inputFile = Optional.ofNullable(effective.remove("in"))
          .filter(value -> !value.isBlank())
          .map(ShipCli::toPath);
      batchSize = Numbers.parseIntInRange("batchSize", effective.remove("batchSize"), 1, MAX_BATCH_SIZE);
      config = RemoteWriteConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid ship configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, inputFile, batchSize, exportMetrics);
      return ExitCode.SUCCESS;
    }
    if (inputFile.isEmpty()) {
      log.error("in=PATH is required unless --dry-run is given");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot(config, exportMetrics)) {
      return ship(root, inputFile.get(), batchSize);
    }
  }

  private static ExitCode ship(CompositionRoot root, Path inputFile, int batchSize) {
    List<MetricRecord> records;
    try {
      records = root.recordReader().read(inputFile);
    } catch (IOException ex) {
      log.error("Unable to read input file {}", inputFile, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid input record in {}: {}", inputFile, ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }

    int batches = 0;
    try (RemoteWriteShipper shipper = root.shipper()) {
      shipper.connect();
      // One request per batch; an empty input still posts one empty request.
      int offset = 0;
      do {
        int end = Math.min(records.size(), offset + batchSize);
        shipper.write(records.subList(offset, end));
        batches++;
        offset = end;
      } while (offset < records.size());
      log.info("Shipped {} record(s) in {} request(s) to {}", records.size(), batches, root.config().url());
      return ExitCode.SUCCESS;
    } catch (RemoteWriteException ex) {
      if (Thread.currentThread().isInterrupted()) {
        log.error("Shipping interrupted after {} request(s)", batches);
        return ExitCode.INTERRUPTED;
      }
      log.error("Shipping stopped after {} successful request(s): {}", batches, ex.getMessage());
      return switch (ex.kind()) {
        case CONFIGURATION -> ExitCode.CONFIG_ERROR;
        case RESOLUTION, TRANSPORT, REMOTE_REJECTED -> ExitCode.DELIVERY_FAILED;
        case ENCODING -> ExitCode.RUNTIME_FAILURE;
      };
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while shipping", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static Optional<Map<String, String>> loadYamlConfig(String explicitPath) throws CliAbort {
    Path yamlPath;
    if (explicitPath == null || explicitPath.isBlank()) {
      yamlPath = Path.of(System.getProperty("user.home", "."), ".prism", "prism.yaml");
    } else {
      try {
        yamlPath = Path.of(explicitPath.trim());
      } catch (InvalidPathException ex) {
        log.error("Invalid configuration path: {}", explicitPath);
        throw new CliAbort(ExitCode.INVALID_ARGS);
      }
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        throw new CliAbort(ExitCode.INVALID_ARGS);
      }
    }
    try {
      return YamlConfigLoader.load(yamlPath, MODE);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", yamlPath, ex);
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }

  private static Path toPath(String raw) {
    try {
      return Path.of(raw.trim());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("in is not a valid path: " + raw, ex);
    }
  }

  private static void printDryRunPlan(
      RemoteWriteConfig config, Optional<Path> inputFile, int batchSize, boolean exportMetrics) {
    CliPrinter.printLines(
        "Ship dry-run: nothing will be sent.",
        " Endpoint         : " + config.url(),
        " Basic auth       : " + (config.hasBasicAuth()
            ? config.basicUsername().orElse("") + " / " + Logs.redact(config.basicPassword().orElse(""))
            : "<none>"),
        " TLS CA           : " + config.tls().ca().map(Path::toString).orElse("<system>"),
        " TLS client cert  : " + config.tls().cert().map(Path::toString).orElse("<none>"),
        " Skip verify      : " + config.tls().insecureSkipVerify(),
        " Pool multiplier  : " + config.poolMultiplier(),
        " Timeouts (ms)    : request " + config.timeout().toMillis()
            + ", connect " + config.connectTimeout().toMillis(),
        " User-Agent       : " + config.userAgent(),
        " Input            : " + inputFile.map(Path::toString).orElse("<none>"),
        " Batch size       : " + batchSize,
        " Metrics exporter : " + (exportMetrics ? "otlp" : "none"),
        " Re-run without --dry-run to ship records.");
  }

  private static final class CliAbort extends Exception {
    private final ExitCode exitCode;

    CliAbort(ExitCode exitCode) {
      super(null, null, false, false);
      this.exitCode = exitCode;
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }
}
