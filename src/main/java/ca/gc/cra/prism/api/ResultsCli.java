package ca.gc.cra.prism.api;

import ca.gc.cra.prism.application.json.JsonSupport;
import ca.gc.cra.prism.application.json.JsonViews;
import ca.gc.cra.prism.application.store.ResultStore;
import ca.gc.cra.prism.config.CompositionRoot;
import ca.gc.cra.prism.config.DefaultsForMode;
import ca.gc.cra.prism.domain.chain.AggregateWindow;
import ca.gc.cra.prism.domain.error.NotFoundException;
import ca.gc.cra.prism.domain.store.ResultFilter;
import ca.gc.cra.prism.domain.store.ResultSummary;
import ca.gc.cra.prism.domain.store.StoredResult;
import ca.gc.cra.prism.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists, shows and deletes stored results.
 *
 * @since PRISM 0.1
 */
public final class ResultsCli {
  private static final Logger log = LoggerFactory.getLogger(ResultsCli.class);
  private static final String SUMMARY_USAGE =
      "usage: results <list|get|delete> [key=KEY] [jobKey=PREFIX] [window=hour|day|week] [config=PATH]";
  private static final String HELP_TEXT = """
      PRISM stored results

      Usage:
        results list [jobKey=PREFIX] [window=hour|day|week]
        results get key=KEY
        results delete key=KEY

      Options:
        store.mode=MEMORY|FILE     Result store backend (default FILE)
        store.directory=PATH       Result directory for FILE (default ~/.prism/results)
        config=PATH                YAML file with common/results sections
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private ResultsCli() {}

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
   * Executes the results CLI and returns a normalized exit code.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for results CLI");
    }
    String action = input.positional(0);
    if (action == null) {
      log.error("Missing results action");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ConfigCliUtils.Resolved resolved;
    try {
      resolved = ConfigCliUtils.resolve("results", CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid results arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    try (CompositionRoot root = new CompositionRoot(resolved.config())) {
      ResultStore store = root.resultStore();
      return switch (action.toLowerCase(Locale.ROOT)) {
        case "list" -> list(store, resolved);
        case "get" -> get(store, requireKey(resolved));
        case "delete" -> delete(store, requireKey(resolved));
        default -> {
          log.error("Unknown results action: {}", action);
          CliPrinter.println(SUMMARY_USAGE);
          yield ExitCode.INVALID_ARGS;
        }
      };
    } catch (IllegalArgumentException ex) {
      log.error("Invalid results arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (NotFoundException ex) {
      log.error("{}", ex.describe());
      return ExitCode.NOT_FOUND;
    } catch (IOException ex) {
      log.error("Result store I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in results CLI", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode list(ResultStore store, ConfigCliUtils.Resolved resolved) throws IOException {
    String prefix = resolved.get(DefaultsForMode.JOB_KEY);
    String window = resolved.get(DefaultsForMode.WINDOW);
    ResultFilter filter = new ResultFilter(
        prefix.isEmpty() ? Optional.empty() : Optional.of(prefix),
        window.isEmpty() ? Optional.empty() : Optional.of(AggregateWindow.parse(window)));
    List<Object> rows = new ArrayList<>();
    for (ResultSummary summary : store.list(filter)) {
      rows.add(JsonViews.resultSummary(summary));
    }
    CliPrinter.printJson(rows);
    log.debug("Listed {} stored results", rows.size());
    return ExitCode.SUCCESS;
  }

  private static ExitCode get(ResultStore store, String key) throws NotFoundException, IOException {
    StoredResult result = store.get(key);
    Map<String, Object> output = new LinkedHashMap<>();
    output.put("result", JsonViews.resultSummary(result.summary()));
    output.put("payload", payloadView(result));
    CliPrinter.printJson(output);
    return ExitCode.SUCCESS;
  }

  private static ExitCode delete(ResultStore store, String key) throws IOException {
    boolean deleted = store.delete(key);
    Map<String, Object> output = new LinkedHashMap<>();
    output.put("key", key);
    output.put("deleted", deleted);
    CliPrinter.printJson(output);
    if (!deleted) {
      log.warn("No stored result under {}", key);
      return ExitCode.NOT_FOUND;
    }
    return ExitCode.SUCCESS;
  }

  private static Object payloadView(StoredResult result) {
    try {
      return new JsonSupport().parse(result.payload());
    } catch (IllegalArgumentException ex) {
      log.debug("Payload of {} is not JSON; printing as text", result.key());
      return result.payloadText();
    }
  }

  private static String requireKey(ConfigCliUtils.Resolved resolved) {
    String key = resolved.get(DefaultsForMode.KEY);
    if (key.isEmpty()) {
      throw new IllegalArgumentException("key is required for get and delete");
    }
    return key;
  }
}
