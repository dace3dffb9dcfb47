package ca.gc.cra.prism.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void captureOutput() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: prism"));
  }

  @Test
  void globalHelpWithoutCommand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("PRISM command dispatcher"));
  }

  @Test
  void globalHelpIsForwardedToCommand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help", "ship"}));
    assertTrue(buffer.toString().contains("PRISM remote-write shipper"));
  }

  @Test
  void unknownCommandIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
  }

  @Test
  void sampleConfigPrintsBundledYaml() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"sample-config"}));
    String output = buffer.toString();
    assertTrue(output.contains("common:"));
    assertTrue(output.contains("ship:"));
  }
}
