package ca.gc.cra.prism.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.application.pipeline.PipelineOrchestrator;
import ca.gc.cra.prism.application.port.Sleeper;
import ca.gc.cra.prism.config.CompositionRoot;
import ca.gc.cra.prism.config.PrismConfig;
import ca.gc.cra.prism.domain.chain.AggregateWindow;
import ca.gc.cra.prism.domain.chain.BlockRange;
import ca.gc.cra.prism.domain.job.JobParams;
import ca.gc.cra.prism.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.prism.testing.RecordingMetricsPort;
import ca.gc.cra.prism.testing.ScriptedHttpTransport;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AnalyzeCliTest {
  private static final String BLOCK = """
      {"data":[
        {"hash":"t1","fee":"0.0001","shielded_spend_count":1},
        {"hash":"t2","fee":0.0002}
      ]}
      """;
  private static final JobParams PARAMS = new JobParams(new BlockRange(100, 101), AggregateWindow.DAY);
  private static final Duration POLL = Duration.ofMillis(10);
  private static final Duration WAIT = Duration.ofSeconds(30);

  private StringWriter out;
  private ScriptedHttpTransport http;

  @BeforeEach
  void setUp() {
    out = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(out, true));
    http = new ScriptedHttpTransport();
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void completedJobPrintsResultAndSummary() throws Exception {
    http.reply(200, BLOCK, 2);

    try (CompositionRoot root = newRoot()) {
      ExitCode exit = AnalyzeCli.execute(root, "job-ok", PARAMS, POLL, WAIT, Sleeper.SYSTEM);

      assertEquals(ExitCode.SUCCESS, exit);
      assertTrue(root.resultStore().find("job-ok").isPresent());
      assertTrue(root.resultStore().find("job-ok" + PipelineOrchestrator.SUMMARY_SUFFIX).isPresent());
    }
    String printed = out.toString();
    assertTrue(printed.contains("SUMMARIZED"), printed);
    assertTrue(printed.contains("\"summary\""), printed);
    assertTrue(printed.contains("shielded_ratio"), printed);
  }

  @Test
  void failedFetchEndsInPipelineFailure() throws Exception {
    http.reply(400, "bad height");

    try (CompositionRoot root = newRoot()) {
      ExitCode exit = AnalyzeCli.execute(root, "", PARAMS, POLL, WAIT, Sleeper.SYSTEM);

      assertEquals(ExitCode.PIPELINE_FAILED, exit);
    }
    String printed = out.toString();
    assertTrue(printed.contains("FAILED"), printed);
    assertTrue(printed.contains("FETCH_EXHAUSTED"), printed);
  }

  @Test
  void secondRunOverStoredRangeReusesResult(@TempDir Path storeDir) throws Exception {
    http.reply(200, BLOCK, 2);
    Map<String, String> fileStore = Map.of("store.mode", "FILE", "store.directory", storeDir.toString());

    try (CompositionRoot first = newRoot(fileStore)) {
      assertEquals(ExitCode.SUCCESS, AnalyzeCli.execute(first, "", PARAMS, POLL, WAIT, Sleeper.SYSTEM));
    }
    int requests = http.requests().size();
    try (CompositionRoot second = newRoot(fileStore)) {
      assertEquals(ExitCode.SUCCESS, AnalyzeCli.execute(second, "", PARAMS, POLL, WAIT, Sleeper.SYSTEM));
    }

    assertEquals(requests, http.requests().size());
    assertFalse(out.toString().contains("STORAGE_CONFLICT"), out.toString());
  }

  @Test
  void helpAndMissingRangeNeverWire() {
    assertEquals(ExitCode.SUCCESS, AnalyzeCli.run(new String[] {"--help"}));
    assertEquals(ExitCode.INVALID_ARGS, AnalyzeCli.run(new String[] {"window=day"}));
    assertEquals(ExitCode.INVALID_ARGS, AnalyzeCli.run(new String[] {"range=1-2", "pollInterval=soon"}));
  }

  private CompositionRoot newRoot() throws Exception {
    return newRoot(Map.of());
  }

  private CompositionRoot newRoot(Map<String, String> overrides) throws Exception {
    Map<String, String> settings = new HashMap<>(Map.of(
        "source.baseUrl", "https://api.example",
        "gateway.pollBaseDelay", "10ms",
        "gateway.pollMaxDelay", "20ms",
        "gateway.simulatedPendingPolls", "1",
        "pipeline.workers", "1"));
    settings.putAll(overrides);
    PrismConfig config = PrismConfig.fromMap(settings);
    return new CompositionRoot(config, new RecordingMetricsPort(), http, new SystemClockAdapter(), Sleeper.SYSTEM);
  }
}
