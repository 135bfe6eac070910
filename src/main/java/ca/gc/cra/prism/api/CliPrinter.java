package ca.gc.cra.prism.api;

import ca.gc.cra.prism.application.json.JsonSupport;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Minimal console output helper for CLI usage text and JSON results.
 *
 * <p>Uses native file descriptors in order to avoid direct {@code System.out} references while
 * preserving simple stdout writes that play nicely with logging configurations.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final JsonSupport JSON = new JsonSupport();
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout using the shared CLI writer.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints {@code value} as pretty JSON.
   *
   * @param value maps, lists and scalars accepted by {@link JsonSupport#write(Object, boolean)}
   */
  public static void printJson(Object value) {
    writer().println(new String(JSON.write(value, true), StandardCharsets.UTF_8));
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
