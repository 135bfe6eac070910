package ca.gc.cra.prism.infrastructure.http;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Minimal blocking HTTP client contract.
 *
 * <p>Implementations return every status code as an {@link HttpReply}; only transport failures (connect errors,
 * timeouts) raise {@link IOException}.</p>
 *
 * @since PRISM 0.1
 */
public interface HttpTransport {
  /**
   * Issues a GET.
   *
   * @param uri target
   * @param headers request headers
   * @param timeout per-request timeout
   * @return response
   * @throws IOException on transport failure or timeout
   * @throws InterruptedException if interrupted while waiting
   */
  HttpReply get(URI uri, Map<String, String> headers, Duration timeout) throws IOException, InterruptedException;

  /**
   * Issues a POST.
   *
   * @param uri target
   * @param headers request headers
   * @param body request body
   * @param timeout per-request timeout
   * @return response
   * @throws IOException on transport failure or timeout
   * @throws InterruptedException if interrupted while waiting
   */
  HttpReply post(URI uri, Map<String, String> headers, byte[] body, Duration timeout)
      throws IOException, InterruptedException;
}
