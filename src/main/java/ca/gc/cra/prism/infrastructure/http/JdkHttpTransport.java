package ca.gc.cra.prism.infrastructure.http;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * {@link HttpTransport} over {@link HttpClient}. One client instance is shared across calls.
 *
 * @since PRISM 0.1
 */
public final class JdkHttpTransport implements HttpTransport {
  private static final String USER_AGENT = "prism/0.1";

  private final HttpClient client;

  /**
   * Creates a transport.
   *
   * @param connectTimeout TCP connect timeout
   */
  public JdkHttpTransport(Duration connectTimeout) {
    this(HttpClient.newBuilder()
        .connectTimeout(Objects.requireNonNull(connectTimeout, "connectTimeout"))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build());
  }

  JdkHttpTransport(HttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public HttpReply get(URI uri, Map<String, String> headers, Duration timeout)
      throws IOException, InterruptedException {
    HttpRequest.Builder request = base(uri, headers, timeout).GET();
    return send(request.build());
  }

  @Override
  public HttpReply post(URI uri, Map<String, String> headers, byte[] body, Duration timeout)
      throws IOException, InterruptedException {
    HttpRequest.Builder request = base(uri, headers, timeout)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofByteArray(body));
    return send(request.build());
  }

  private HttpRequest.Builder base(URI uri, Map<String, String> headers, Duration timeout) {
    HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
        .timeout(timeout)
        .header("Accept", "application/json")
        .header("User-Agent", USER_AGENT);
    headers.forEach(builder::header);
    return builder;
  }

  private HttpReply send(HttpRequest request) throws IOException, InterruptedException {
    HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
    return new HttpReply(response.statusCode(), response.body());
  }
}
