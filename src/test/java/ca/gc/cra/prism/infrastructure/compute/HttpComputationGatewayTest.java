package ca.gc.cra.prism.infrastructure.compute;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.application.pipeline.VectorCodec;
import ca.gc.cra.prism.application.port.ComputationGateway.PollResult;
import ca.gc.cra.prism.application.port.ComputationGateway.PollStatus;
import ca.gc.cra.prism.domain.error.ComputationRejectedException;
import ca.gc.cra.prism.domain.error.ComputationUnavailableException;
import ca.gc.cra.prism.domain.error.DecodeMismatchException;
import ca.gc.cra.prism.domain.vector.EncodedVector;
import ca.gc.cra.prism.testing.Fixtures;
import ca.gc.cra.prism.testing.ScriptedHttpTransport;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpComputationGatewayTest {
  private ScriptedHttpTransport http;
  private HttpComputationGateway gateway;
  private EncodedVector vector;

  @BeforeEach
  void setUp() throws Exception {
    http = new ScriptedHttpTransport();
    gateway = new HttpComputationGateway(http, "https://compute.example/", Duration.ofSeconds(2));
    vector = new VectorCodec(1_000_000L, 4).encode(Fixtures.aggregate(10, 4, 0.01, 0.00001, Map.of(), 4));
  }

  @Test
  void submitPostsEnvelopeWithIdempotencyKey() throws Exception {
    http.reply(202, "{\"token\":\"abc\"}");

    String token = gateway.submit(vector, "hash-1");

    assertEquals("abc", token);
    ScriptedHttpTransport.Request request = http.requests().get(0);
    assertEquals("POST", request.method());
    assertEquals("https://compute.example/jobs", request.uri().toString());
    assertEquals("hash-1", request.headers().get("Idempotency-Key"));
    assertEquals(vector, new VectorEnvelopeCodec().decode(request.body()));
  }

  @Test
  void pollMapsRemoteStatuses() throws Exception {
    byte[] envelope = new VectorEnvelopeCodec().encode(vector);
    http.reply(200, "{\"status\":\"running\"}")
        .reply(200, "{\"status\":\"done\"}")
        .reply(200, new String(envelope, StandardCharsets.UTF_8))
        .reply(200, "{\"status\":\"failed\",\"reason\":\"bad input\"}");

    assertEquals(PollStatus.PENDING, gateway.poll("a b").status());
    PollResult done = gateway.poll("a b");
    PollResult failed = gateway.poll("a b");

    assertEquals(PollStatus.DONE, done.status());
    assertArrayEquals(envelope, done.resultBlob().orElseThrow());
    assertEquals("https://compute.example/jobs/a+b/result", http.requests().get(2).uri().toString());
    assertEquals(PollStatus.FAILED, failed.status());
    assertEquals("bad input", failed.reason().orElseThrow());
  }

  @Test
  void serverErrorsAndIoFailuresAreRetryable() {
    http.reply(503, "down").fail(new IOException("reset"));

    ComputationUnavailableException status = assertThrows(ComputationUnavailableException.class,
        () -> gateway.poll("t"));
    ComputationUnavailableException io = assertThrows(ComputationUnavailableException.class,
        () -> gateway.poll("t"));

    assertTrue(status.retryable());
    assertTrue(io.retryable());
  }

  @Test
  void clientErrorsAndMalformedRepliesAreRejected() {
    http.reply(400, "vector too long").reply(200, "{\"nope\":1}").reply(200, "{\"status\":\"exploded\"}");

    ComputationRejectedException refused = assertThrows(ComputationRejectedException.class,
        () -> gateway.submit(vector, "hash-1"));
    assertThrows(ComputationRejectedException.class, () -> gateway.submit(vector, "hash-1"));
    assertThrows(ComputationRejectedException.class, () -> gateway.poll("t"));

    assertFalse(refused.retryable());
    assertTrue(refused.getMessage().contains("400"));
  }

  @Test
  void undecodableResultIsMismatch() {
    assertThrows(DecodeMismatchException.class,
        () -> gateway.decodeResult("{\"values\":[1.5]}".getBytes(StandardCharsets.UTF_8)));
  }
}
