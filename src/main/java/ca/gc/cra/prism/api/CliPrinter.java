package ca.gc.cra.prism.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Stdout sink for usage text, dry-run plans, and the sample configuration.
 *
 * <p>Logs go to stderr through Logback; everything printed here is meant for the operator or a pipe.</p>
 */
final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final AtomicReference<PrintWriter> TEST_WRITER = new AtomicReference<>();

  private CliPrinter() {}

  static void println(String message) {
    PrintWriter out = out();
    out.println(message);
    out.flush();
  }

  /**
   * Prints a multi-line block such as help text, dropping trailing blank lines.
   */
  static void printBlock(String text) {
    println(text == null ? "" : text.stripTrailing());
  }

  static void printLines(String... lines) {
    PrintWriter out = out();
    for (String line : lines) {
      out.println(line);
    }
    out.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    TEST_WRITER.set(writer);
  }

  static void clearTestWriter() {
    TEST_WRITER.set(null);
  }

  private static PrintWriter out() {
    PrintWriter override = TEST_WRITER.get();
    return override == null ? STDOUT : override;
  }
}
