package ca.gc.cra.prism.api;

import ca.gc.cra.prism.application.json.JsonViews;
import ca.gc.cra.prism.config.CompositionRoot;
import ca.gc.cra.prism.config.DefaultsForMode;
import ca.gc.cra.prism.domain.aggregate.AggregateRecord;
import ca.gc.cra.prism.domain.chain.AggregateWindow;
import ca.gc.cra.prism.domain.chain.BlockRange;
import ca.gc.cra.prism.domain.error.PipelineException;
import ca.gc.cra.prism.domain.vector.EncodedVector;
import ca.gc.cra.prism.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plaintext mode: fetches a block range, aggregates it locally and prints the aggregate as JSON.
 *
 * @since PRISM 0.1
 */
public final class AggregateCli {
  private static final Logger log = LoggerFactory.getLogger(AggregateCli.class);
  private static final String SUMMARY_USAGE =
      "usage: aggregate range=START-END [window=hour|day|week] [config=PATH] [key=value ...] [--vector]";
  private static final String HELP_TEXT = """
      PRISM plaintext aggregation

      Usage:
        aggregate range=START-END [options]

      Options:
        range=START-END            Inclusive block heights to fetch (required)
        window=hour|day|week       Reporting window recorded on the aggregate (default day)
        config=PATH                YAML file with common/aggregate sections
        source.baseUrl=URL         Block explorer base URL
        source.chain=NAME          Chain path segment (default zcash)
        codec.bucketPolicy=P       STATIC or DYNAMIC_MAX
        codec.shieldedPolicy=P     ANY, COUNTS or FLAG
        --vector                   Also print the encoded vector and its metadata
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private AggregateCli() {}

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
   * Executes the aggregate CLI and returns a normalized exit code.
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
      log.debug("Verbose logging enabled for aggregate CLI");
    }

    ConfigCliUtils.Resolved resolved;
    BlockRange range;
    AggregateWindow window;
    try {
      resolved = ConfigCliUtils.resolve("aggregate", CliArgsParser.toMap(input.keyValueArgs()));
      range = BlockRange.parse(resolved.get(DefaultsForMode.RANGE));
      window = AggregateWindow.parse(resolved.get(DefaultsForMode.WINDOW));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid aggregate arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    try (CompositionRoot root = new CompositionRoot(resolved.config())) {
      log.info("Aggregating blocks {} ({} window)", range, window.label());
      AggregateRecord aggregate = root.aggregator().ingest(root.sourceClient(), range, window);
      Map<String, Object> output = new LinkedHashMap<>();
      output.put("range", range.toString());
      output.put("aggregate", JsonViews.aggregate(aggregate));
      if (input.hasFlag("--vector")) {
        EncodedVector vector = root.vectorCodec().encode(aggregate);
        output.put("vector", JsonViews.vector(vector));
      }
      CliPrinter.printJson(output);
      return ExitCode.SUCCESS;
    } catch (PipelineException ex) {
      log.error("Aggregation failed: {}", ex.describe());
      return ExitCode.PIPELINE_FAILED;
    } catch (IOException ex) {
      log.error("Aggregation I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Aggregation interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in aggregate CLI", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
