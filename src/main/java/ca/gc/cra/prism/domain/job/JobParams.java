package ca.gc.cra.prism.domain.job;

import ca.gc.cra.prism.domain.chain.AggregateWindow;
import ca.gc.cra.prism.domain.chain.BlockRange;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Inputs of one pipeline job.
 *
 * @param range block range to ingest
 * @param window reporting window recorded on the aggregate
 * @since PRISM 0.1
 */
public record JobParams(BlockRange range, AggregateWindow window) {
  public JobParams {
    Objects.requireNonNull(range, "range");
    Objects.requireNonNull(window, "window");
  }

  /**
   * Content-derived job key for callers that do not supply one.
   *
   * @param source upstream identifier the job will read from
   * @return {@code "job-"} followed by 32 hex characters of SHA-256 over source, range and window
   */
  public String contentKey(String source) {
    String canonical = Objects.requireNonNull(source, "source") + '|' + range + '|' + window.label();
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
      return "job-" + HexFormat.of().formatHex(hash, 0, 16);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 unavailable", ex);
    }
  }
}
