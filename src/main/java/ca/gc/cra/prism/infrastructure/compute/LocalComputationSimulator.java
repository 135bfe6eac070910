package ca.gc.cra.prism.infrastructure.compute;

import ca.gc.cra.prism.application.port.ComputationGateway;
import ca.gc.cra.prism.domain.error.ComputationRejectedException;
import ca.gc.cra.prism.domain.error.DecodeMismatchException;
import ca.gc.cra.prism.domain.error.PipelineException;
import ca.gc.cra.prism.domain.vector.EncodedVector;
import ca.gc.cra.prism.logging.Logs;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process {@link ComputationGateway} performing an identity computation.
 *
 * <p>Tokens are derived from the idempotency key, so resubmission returns the same token and does not create a
 * second computation. A computation reports {@code PENDING} for the configured number of polls and then
 * {@code DONE} with the submitted envelope as its result.</p>
 *
 * <p>Computations are held in a bounded Caffeine cache and dropped once idle for the retention period or when
 * the bound is reached; polling a dropped token is rejected like any unknown one.</p>
 *
 * @since PRISM 0.1
 */
public final class LocalComputationSimulator implements ComputationGateway {
  private static final Logger log = LoggerFactory.getLogger(LocalComputationSimulator.class);

  /** Computations kept by {@link #LocalComputationSimulator(int, int)}. */
  public static final long DEFAULT_MAX_COMPUTATIONS = 10_000L;

  /** Idle time after which {@link #LocalComputationSimulator(int, int)} forgets a computation. */
  public static final Duration DEFAULT_RETENTION = Duration.ofHours(1);

  private final int pendingPolls;
  private final int maxVectorLength;
  private final VectorEnvelopeCodec envelopes = new VectorEnvelopeCodec();
  private final Cache<String, Computation> computations;

  /**
   * Creates a simulator with the default retention bounds.
   *
   * @param pendingPolls polls answered with {@code PENDING} before a computation is done
   * @param maxVectorLength longest accepted vector; zero accepts any length
   */
  public LocalComputationSimulator(int pendingPolls, int maxVectorLength) {
    this(pendingPolls, maxVectorLength, DEFAULT_MAX_COMPUTATIONS, DEFAULT_RETENTION);
  }

  /**
   * Creates a simulator.
   *
   * @param pendingPolls polls answered with {@code PENDING} before a computation is done
   * @param maxVectorLength longest accepted vector; zero accepts any length
   * @param maxComputations computations kept at once; positive
   * @param retention idle time after which a computation is forgotten; positive
   */
  public LocalComputationSimulator(int pendingPolls, int maxVectorLength, long maxComputations, Duration retention) {
    if (pendingPolls < 0 || maxVectorLength < 0) {
      throw new IllegalArgumentException("pendingPolls and maxVectorLength must be non-negative");
    }
    if (maxComputations <= 0) {
      throw new IllegalArgumentException("maxComputations must be positive");
    }
    Objects.requireNonNull(retention, "retention");
    if (retention.isNegative() || retention.isZero()) {
      throw new IllegalArgumentException("retention must be positive");
    }
    this.pendingPolls = pendingPolls;
    this.maxVectorLength = maxVectorLength;
    this.computations = Caffeine.newBuilder()
        .maximumSize(maxComputations)
        .expireAfterAccess(retention)
        .executor(Runnable::run)
        .build();
  }

  @Override
  public String submit(EncodedVector vector, String idempotencyKey) throws PipelineException {
    Objects.requireNonNull(vector, "vector");
    Objects.requireNonNull(idempotencyKey, "idempotencyKey");
    if (maxVectorLength > 0 && vector.length() > maxVectorLength) {
      throw new ComputationRejectedException(
          "vector length " + vector.length() + " exceeds simulator limit " + maxVectorLength);
    }
    String token = tokenFor(idempotencyKey);
    computations.get(token, key -> {
      log.debug("Simulator accepted computation {} for key {}", key, Logs.shortId(idempotencyKey));
      return new Computation(envelopes.encode(vector));
    });
    return token;
  }

  @Override
  public PollResult poll(String token) throws PipelineException {
    Computation computation = computations.getIfPresent(Objects.requireNonNull(token, "token"));
    if (computation == null) {
      throw new ComputationRejectedException("unknown computation token " + token);
    }
    int polls = computation.polls.incrementAndGet();
    return polls > pendingPolls ? PollResult.done(computation.result) : PollResult.pending();
  }

  @Override
  public EncodedVector decodeResult(byte[] resultBlob) throws DecodeMismatchException {
    return envelopes.decode(resultBlob);
  }

  /**
   * Number of computations currently held.
   *
   * @return computation count
   */
  public int computationCount() {
    computations.cleanUp();
    return (int) computations.estimatedSize();
  }

  private static String tokenFor(String idempotencyKey) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(idempotencyKey.getBytes(StandardCharsets.UTF_8));
      return "sim-" + HexFormat.of().formatHex(hash, 0, 12);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 unavailable", ex);
    }
  }

  private static final class Computation {
    private final byte[] result;
    private final AtomicInteger polls = new AtomicInteger();

    private Computation(byte[] result) {
      this.result = result;
    }
  }
}
