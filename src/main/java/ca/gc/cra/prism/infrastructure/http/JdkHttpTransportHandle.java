package ca.gc.cra.prism.infrastructure.http;

import ca.gc.cra.prism.application.port.HostResolver;
import ca.gc.cra.prism.application.port.TransportHandle;
import ca.gc.cra.prism.application.port.TransportRequest;
import ca.gc.cra.prism.application.port.TransportResponse;
import ca.gc.cra.prism.validation.Net;
import java.io.IOException;
import java.io.InputStream;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transport handle that POSTs through a dedicated {@link HttpClient}.
 *
 * <p>At most {@link #MAX_BODY_BYTES} of a response body are read. {@link HttpClient} refuses URIs whose host is not
 * an RFC 2396 host name ({@code prom_server}); such requests go to the first resolved address instead.</p>
 *
 * @since 0.1.0
 */
final class JdkHttpTransportHandle implements TransportHandle {
  static final int MAX_BODY_BYTES = 4096;

  private static final Logger log = LoggerFactory.getLogger(JdkHttpTransportHandle.class);

  private final HttpClient client;
  private final Duration requestTimeout;
  private final HostResolver resolver;

  JdkHttpTransportHandle(HttpClient client, Duration requestTimeout, HostResolver resolver) {
    this.client = Objects.requireNonNull(client, "client");
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  @Override
  public TransportResponse execute(TransportRequest request) throws IOException, InterruptedException {
    HttpRequest.Builder builder = HttpRequest.newBuilder(target(request.uri()))
        .timeout(requestTimeout)
        .POST(HttpRequest.BodyPublishers.ofByteArray(request.body()));
    for (Map.Entry<String, String> header : request.headers().entrySet()) {
      builder.header(header.getKey(), header.getValue());
    }
    HttpResponse<InputStream> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
    try (InputStream body = response.body()) {
      byte[] head = body.readNBytes(MAX_BODY_BYTES);
      return new TransportResponse(response.statusCode(), new String(head, StandardCharsets.UTF_8));
    }
  }

  URI target(URI uri) throws IOException {
    if (uri.getHost() != null) {
      return uri;
    }
    String host = Net.bareHost(uri);
    if (host == null || host.isBlank()) {
      throw new IOException("remote-write url has no host: " + uri);
    }
    List<InetAddress> addresses = resolver.resolve(host);
    if (addresses == null || addresses.isEmpty()) {
      throw new IOException("no addresses for " + host);
    }
    InetAddress address = addresses.get(0);
    String literal = address instanceof Inet6Address
        ? "[" + address.getHostAddress() + "]"
        : address.getHostAddress();
    int port = Net.port(uri);
    StringBuilder rebuilt = new StringBuilder()
        .append(uri.getScheme()).append("://").append(literal);
    if (port != -1) {
      rebuilt.append(':').append(port);
    }
    if (uri.getRawPath() != null) {
      rebuilt.append(uri.getRawPath());
    }
    if (uri.getRawQuery() != null) {
      rebuilt.append('?').append(uri.getRawQuery());
    }
    try {
      URI resolved = new URI(rebuilt.toString());
      log.debug("Addressing {} as {}", host, resolved);
      return resolved;
    } catch (URISyntaxException ex) {
      throw new IOException("cannot address " + host + " via " + literal, ex);
    }
  }

  HttpClient client() {
    return client;
  }
}
