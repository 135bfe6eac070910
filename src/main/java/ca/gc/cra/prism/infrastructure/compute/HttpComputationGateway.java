package ca.gc.cra.prism.infrastructure.compute;

import ca.gc.cra.prism.application.json.JsonSupport;
import ca.gc.cra.prism.application.port.ComputationGateway;
import ca.gc.cra.prism.domain.error.ComputationRejectedException;
import ca.gc.cra.prism.domain.error.ComputationUnavailableException;
import ca.gc.cra.prism.domain.error.DecodeMismatchException;
import ca.gc.cra.prism.domain.error.PipelineException;
import ca.gc.cra.prism.domain.vector.EncodedVector;
import ca.gc.cra.prism.infrastructure.http.HttpReply;
import ca.gc.cra.prism.infrastructure.http.HttpTransport;
import ca.gc.cra.prism.logging.Logs;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ComputationGateway} backed by a remote computation service.
 *
 * <ul>
 *   <li>{@code POST {endpoint}/jobs} with header {@code Idempotency-Key} and the vector envelope; replies
 *   {@code {"token": "..."}}.</li>
 *   <li>{@code GET {endpoint}/jobs/{token}} replies {@code {"status": "pending|done|failed", "reason": "..."}}.</li>
 *   <li>{@code GET {endpoint}/jobs/{token}/result} returns the result envelope.</li>
 * </ul>
 *
 * <p>4xx replies are terminal ({@link ComputationRejectedException}); 5xx replies and transport failures are
 * retryable ({@link ComputationUnavailableException}).</p>
 *
 * @since PRISM 0.1
 */
public final class HttpComputationGateway implements ComputationGateway {
  private static final Logger log = LoggerFactory.getLogger(HttpComputationGateway.class);
  private static final int BODY_PREVIEW = 200;

  private final HttpTransport http;
  private final String endpoint;
  private final Duration timeout;
  private final JsonSupport json = new JsonSupport();
  private final VectorEnvelopeCodec envelopes = new VectorEnvelopeCodec();

  /**
   * Creates a gateway.
   *
   * @param http transport
   * @param endpoint service base URL
   * @param timeout per-request timeout
   */
  public HttpComputationGateway(HttpTransport http, String endpoint, Duration timeout) {
    this.http = Objects.requireNonNull(http, "http");
    String base = Objects.requireNonNull(endpoint, "endpoint").trim();
    this.endpoint = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public String submit(EncodedVector vector, String idempotencyKey) throws PipelineException {
    URI uri = URI.create(endpoint + "/jobs");
    HttpReply reply = call("submit", () ->
        http.post(uri, Map.of("Idempotency-Key", idempotencyKey), envelopes.encode(vector), timeout));
    requireSuccess("submit", reply);
    String token = field(reply, "token");
    log.debug("Remote computation {} accepted for key {}", token, Logs.shortId(idempotencyKey));
    return token;
  }

  @Override
  public PollResult poll(String token) throws PipelineException {
    HttpReply reply = call("poll", () -> http.get(jobUri(token, ""), Map.of(), timeout));
    requireSuccess("poll", reply);
    String status = field(reply, "status").toLowerCase(Locale.ROOT);
    return switch (status) {
      case "pending", "running", "queued" -> PollResult.pending();
      case "done", "completed" -> PollResult.done(fetchResult(token));
      case "failed", "error" -> PollResult.failed(
          JsonSupport.optString(json.parseObject(reply.body()), "reason").orElse("remote computation failed"));
      default -> throw new ComputationRejectedException("unknown computation status '" + status + "'");
    };
  }

  @Override
  public EncodedVector decodeResult(byte[] resultBlob) throws DecodeMismatchException {
    return envelopes.decode(resultBlob);
  }

  private byte[] fetchResult(String token) throws PipelineException {
    HttpReply reply = call("result", () -> http.get(jobUri(token, "/result"), Map.of(), timeout));
    requireSuccess("result", reply);
    return reply.body();
  }

  private URI jobUri(String token, String suffix) {
    return URI.create(endpoint + "/jobs/" + URLEncoder.encode(token, StandardCharsets.UTF_8) + suffix);
  }

  private HttpReply call(String operation, HttpCall call) throws PipelineException {
    try {
      return call.execute();
    } catch (IOException ex) {
      throw new ComputationUnavailableException(operation + " failed: " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new ComputationUnavailableException(operation + " interrupted", ex);
    }
  }

  private static void requireSuccess(String operation, HttpReply reply) throws PipelineException {
    if (reply.success()) {
      return;
    }
    String detail = operation + " returned " + reply.status() + ": " + Logs.truncate(reply.bodyText(), BODY_PREVIEW);
    if (reply.serverError()) {
      throw new ComputationUnavailableException(detail);
    }
    throw new ComputationRejectedException(detail);
  }

  private String field(HttpReply reply, String name) throws ComputationRejectedException {
    try {
      return JsonSupport.requireString(json.parseObject(reply.body()), name);
    } catch (IllegalArgumentException ex) {
      throw new ComputationRejectedException("malformed service reply: " + ex.getMessage(), ex);
    }
  }

  @FunctionalInterface
  private interface HttpCall {
    HttpReply execute() throws IOException, InterruptedException;
  }
}
