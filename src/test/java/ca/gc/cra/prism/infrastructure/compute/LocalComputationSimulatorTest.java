package ca.gc.cra.prism.infrastructure.compute;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.application.pipeline.VectorCodec;
import ca.gc.cra.prism.application.port.ComputationGateway.PollResult;
import ca.gc.cra.prism.application.port.ComputationGateway.PollStatus;
import ca.gc.cra.prism.domain.error.ComputationRejectedException;
import ca.gc.cra.prism.domain.vector.EncodedVector;
import ca.gc.cra.prism.testing.Fixtures;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LocalComputationSimulatorTest {
  private final VectorCodec codec = new VectorCodec(1_000_000L, 4);

  @Test
  void answersPendingThenEchoesVector() throws Exception {
    LocalComputationSimulator simulator = new LocalComputationSimulator(2, 0);
    EncodedVector vector = codec.encode(Fixtures.aggregate(10, 4, 0.01, 0.00001, Map.of(), 4));

    String token = simulator.submit(vector, "key-1");

    assertEquals(PollStatus.PENDING, simulator.poll(token).status());
    assertEquals(PollStatus.PENDING, simulator.poll(token).status());
    PollResult done = simulator.poll(token);
    assertEquals(PollStatus.DONE, done.status());
    assertEquals(vector, simulator.decodeResult(done.resultBlob().orElseThrow()));
  }

  @Test
  void sameIdempotencyKeyReusesComputation() throws Exception {
    LocalComputationSimulator simulator = new LocalComputationSimulator(0, 0);
    EncodedVector vector = codec.encode(Fixtures.aggregate(10, 4, 0.01, 0.00001, Map.of(), 4));

    String first = simulator.submit(vector, "key-1");
    String second = simulator.submit(vector, "key-1");
    String other = simulator.submit(vector, "key-2");

    assertEquals(first, second);
    assertNotEquals(first, other);
    assertEquals(2, simulator.computationCount());
  }

  @Test
  void keepsAtMostTheConfiguredNumberOfComputations() throws Exception {
    LocalComputationSimulator simulator = new LocalComputationSimulator(0, 0, 3, Duration.ofMinutes(5));
    EncodedVector vector = codec.encode(Fixtures.aggregate(10, 4, 0.01, 0.00001, Map.of(), 4));

    for (int i = 0; i < 50; i++) {
      simulator.submit(vector, "key-" + i);
    }

    assertTrue(simulator.computationCount() <= 3, "held " + simulator.computationCount());
  }

  @Test
  void rejectsNonPositiveRetentionBounds() {
    assertThrows(IllegalArgumentException.class,
        () -> new LocalComputationSimulator(0, 0, 0, Duration.ofMinutes(5)));
    assertThrows(IllegalArgumentException.class,
        () -> new LocalComputationSimulator(0, 0, 10, Duration.ZERO));
  }

  @Test
  void rejectsOversizedVectorsAndUnknownTokens() throws Exception {
    LocalComputationSimulator simulator = new LocalComputationSimulator(0, 6);
    EncodedVector vector = codec.encode(Fixtures.aggregate(10, 4, 0.01, 0.00001, Map.of(), 4));

    assertThrows(ComputationRejectedException.class, () -> simulator.submit(vector, "key-1"));
    assertThrows(ComputationRejectedException.class, () -> simulator.poll("sim-unknown"));
  }
}
