package ca.gc.cra.parley.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output for CLI reports and usage text.
 *
 * <p>Writes through the native stdout descriptor so reports never interleave with Logback's
 * console appender configuration.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints a multi-line block, one output line per line of {@code block}.
   *
   * @param block text such as a rendered summary; {@code null} prints nothing
   */
  public static void printBlock(String block) {
    if (block == null) {
      return;
    }
    PrintWriter writer = writer();
    block.lines().forEach(writer::println);
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
