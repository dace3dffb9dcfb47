package ca.gc.cra.prism.api;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints an annotated sample {@code prism.yaml} to stdout.
 *
 * @since 0.1.0
 */
final class SampleConfigCli {
  private static final Logger log = LoggerFactory.getLogger(SampleConfigCli.class);
  static final String RESOURCE = "/prism-sample.yaml";

  private SampleConfigCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println("usage: sample-config    Print an annotated prism.yaml to stdout");
      return ExitCode.SUCCESS;
    }
    try (InputStream in = SampleConfigCli.class.getResourceAsStream(RESOURCE)) {
      if (in == null) {
        log.error("Sample configuration resource {} is missing from the classpath", RESOURCE);
        return ExitCode.RUNTIME_FAILURE;
      }
      CliPrinter.printBlock(new String(in.readAllBytes(), StandardCharsets.UTF_8));
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to read sample configuration", ex);
      return ExitCode.IO_ERROR;
    }
  }
}
