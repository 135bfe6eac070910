package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.domain.error.PipelineException;
import ca.gc.cra.prism.domain.vector.EncodedVector;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Port for submitting encoded vectors to an external computation service.
 * <p><strong>Why:</strong> The orchestrator is agnostic to whether computation runs in the local simulator or a
 * remote service; exactly one implementation is chosen at construction time.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>{@link #submit} is idempotent per idempotency key: repeated calls return the same token.</li>
 *   <li>{@link #poll} never blocks for the whole computation; callers poll with backoff.</li>
 *   <li>{@link #decodeResult} turns the opaque blob back into an {@link EncodedVector} for the codec.</li>
 * </ul>
 * <p><strong>Errors:</strong> {@link ca.gc.cra.prism.domain.error.ComputationRejectedException} is terminal;
 * {@link ca.gc.cra.prism.domain.error.ComputationUnavailableException} is retryable.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface ComputationGateway {
  /**
   * Submits a vector for computation.
   *
   * @param vector encoded vector
   * @param idempotencyKey content-derived key; identical keys yield identical tokens
   * @return opaque job token
   * @throws PipelineException when the service rejects the vector or is unavailable
   */
  String submit(EncodedVector vector, String idempotencyKey) throws PipelineException;

  /**
   * Reads the current state of a submitted computation.
   *
   * @param token token returned by {@link #submit}
   * @return current status, with the result blob once done
   * @throws PipelineException when the service cannot be reached or does not know the token
   */
  PollResult poll(String token) throws PipelineException;

  /**
   * Interprets a result blob as an encoded vector.
   *
   * @param resultBlob blob from a {@link PollStatus#DONE} poll
   * @return vector ready for decoding
   * @throws PipelineException if the blob is malformed
   */
  EncodedVector decodeResult(byte[] resultBlob) throws PipelineException;

  /** Computation state reported by {@link #poll}. */
  enum PollStatus {
    PENDING,
    DONE,
    FAILED
  }

  /**
   * Poll outcome.
   *
   * @param status computation state
   * @param resultBlob result bytes, present when {@code status == DONE}
   * @param reason failure reason, present when {@code status == FAILED}
   */
  record PollResult(PollStatus status, Optional<byte[]> resultBlob, Optional<String> reason) {
    public PollResult {
      Objects.requireNonNull(status, "status");
      Objects.requireNonNull(resultBlob, "resultBlob");
      Objects.requireNonNull(reason, "reason");
      if (status == PollStatus.DONE && resultBlob.isEmpty()) {
        throw new IllegalArgumentException("DONE poll results must carry a blob");
      }
    }

    public static PollResult pending() {
      return new PollResult(PollStatus.PENDING, Optional.empty(), Optional.empty());
    }

    public static PollResult done(byte[] blob) {
      return new PollResult(PollStatus.DONE, Optional.of(blob.clone()), Optional.empty());
    }

    public static PollResult failed(String reason) {
      return new PollResult(PollStatus.FAILED, Optional.empty(), Optional.of(reason));
    }
  }
}
