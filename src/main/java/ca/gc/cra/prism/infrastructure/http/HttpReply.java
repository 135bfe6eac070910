package ca.gc.cra.prism.infrastructure.http;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Status code and body of an HTTP response.
 *
 * @param status HTTP status code
 * @param body response body; copied on the way in and out
 * @since PRISM 0.1
 */
public record HttpReply(int status, byte[] body) {
  public HttpReply {
    Objects.requireNonNull(body, "body");
    body = body.clone();
  }

  /**
   * Convenience factory for text bodies.
   *
   * @param status status code
   * @param body UTF-8 body text
   * @return reply
   */
  public static HttpReply of(int status, String body) {
    return new HttpReply(status, body.getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public byte[] body() {
    return body.clone();
  }

  public String bodyText() {
    return new String(body, StandardCharsets.UTF_8);
  }

  public boolean success() {
    return status >= 200 && status < 300;
  }

  public boolean serverError() {
    return status >= 500;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof HttpReply that && status == that.status && Arrays.equals(body, that.body);
  }

  @Override
  public int hashCode() {
    return 31 * status + Arrays.hashCode(body);
  }

  @Override
  public String toString() {
    return "HttpReply[status=" + status + ", bodyBytes=" + body.length + "]";
  }
}
