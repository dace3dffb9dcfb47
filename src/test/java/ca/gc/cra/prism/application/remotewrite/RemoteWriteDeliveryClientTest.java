package ca.gc.cra.prism.application.remotewrite;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.application.port.TransportHandle;
import ca.gc.cra.prism.application.port.TransportRequest;
import ca.gc.cra.prism.application.port.TransportResponse;
import ca.gc.cra.prism.application.port.WriteRequestPackager;
import ca.gc.cra.prism.application.remotewrite.FakeTransports.CountingResolver;
import ca.gc.cra.prism.application.remotewrite.FakeTransports.Factory;
import ca.gc.cra.prism.application.remotewrite.FakeTransports.FakeHandle;
import ca.gc.cra.prism.application.remotewrite.FakeTransports.MutableClock;
import ca.gc.cra.prism.config.RemoteWriteConfig;
import ca.gc.cra.prism.config.TlsSettings;
import ca.gc.cra.prism.domain.remotewrite.WriteRequest;
import java.net.ConnectException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RemoteWriteDeliveryClientTest {
  private static final URI URL = URI.create("http://metrics.example.com:9090/api/v1/write");
  private static final byte[] PAYLOAD = {1, 2, 3};

  private final WriteRequestPackager packager = new WriteRequestPackager() {
    @Override
    public byte[] pack(WriteRequest request) {
      return PAYLOAD;
    }

    @Override
    public String contentEncoding() {
      return "snappy";
    }

    @Override
    public String contentType() {
      return "application/x-protobuf";
    }
  };

  private CountingResolver resolver;
  private Factory factory;
  private MutableClock clock;
  private RecordingMetricsPort metrics;
  private TransportPool pool;

  @BeforeEach
  void setUp() throws Exception {
    resolver = new CountingResolver();
    factory = new Factory();
    clock = new MutableClock(0L);
    metrics = new RecordingMetricsPort();
    pool = new TransportPool(URL, TlsSettings.none(), 5, resolver, factory, clock,
        new Random(7));
    pool.resolve();
  }

  private RemoteWriteDeliveryClient client(RemoteWriteConfig config) {
    return new RemoteWriteDeliveryClient(config, pool, packager, metrics, clock);
  }

  @Test
  void sendsProtocolHeadersAndBody() throws Exception {
    RemoteWriteConfig config = RemoteWriteConfig.builder(URL).userAgent("PRISM/test").build();
    RemoteWriteDeliveryClient client = client(config);
    clock.nanosPerReading = 250L;
    assertEquals(DeliveryState.IDLE, client.lastState());

    client.send(PAYLOAD);

    TransportRequest request = factory.requests.get(0);
    assertEquals(URL, request.uri());
    assertArrayEquals(PAYLOAD, request.body());
    Map<String, String> headers = request.headers();
    assertEquals("snappy", headers.get("Content-Encoding"));
    assertEquals("application/x-protobuf", headers.get("Content-Type"));
    assertEquals("0.1.0", headers.get("X-Prometheus-Remote-Write-Version"));
    assertEquals("PRISM/test", headers.get("User-Agent"));
    assertFalse(headers.containsKey("Authorization"));
    assertEquals(DeliveryState.DELIVERED, client.lastState());
    assertEquals(1, metrics.count("remote_write.deliver.success"));
    assertEquals(List.of(250L), metrics.observed("remote_write.deliver.latencyNanos"));
  }

  @Test
  void basicAuthHeaderEncodesUserAndPassword() throws Exception {
    RemoteWriteConfig config = RemoteWriteConfig.builder(URL)
        .basicUsername("Aladdin")
        .basicPassword("open sesame")
        .build();

    client(config).send(PAYLOAD);

    assertEquals("Basic QWxhZGRpbjpvcGVuIHNlc2FtZQ==",
        factory.requests.get(0).headers().get("Authorization"));
  }

  @Test
  void usernameWithoutPasswordStillSendsBasicAuth() throws Exception {
    RemoteWriteConfig config = RemoteWriteConfig.builder(URL).basicUsername("user").build();

    client(config).send(PAYLOAD);

    assertEquals("Basic dXNlcjo=", factory.requests.get(0).headers().get("Authorization"));
  }

  @Test
  void successiveCallsRotateThroughPool() throws Exception {
    RemoteWriteDeliveryClient client = client(RemoteWriteConfig.builder(URL).build());

    for (int i = 0; i < 4; i++) {
      client.send(PAYLOAD);
    }

    List<Integer> indices = new ArrayList<>();
    for (FakeHandle handle : factory.usedHandles) {
      indices.add(handle.index);
    }
    assertEquals(List.of(1, 2, 3, 4), indices);
  }

  @Test
  void serviceUnavailableIsRejectedAndPoolUntouched() {
    factory.response = new TransportResponse(503, "overloaded");
    RemoteWriteDeliveryClient client = client(RemoteWriteConfig.builder(URL).build());
    List<TransportHandle> before = pool.handles();
    clock.now = pool.refreshDeadlineMillis() + 1;

    RemoteRejectedException ex = assertThrows(RemoteRejectedException.class, () -> client.send(PAYLOAD));

    assertEquals(503, ex.statusCode());
    assertEquals("overloaded", ex.bodyExcerpt());
    assertEquals(ErrorKind.REMOTE_REJECTED, ex.kind());
    assertTrue(ex.getMessage().contains("503"));
    assertSame(before, pool.handles());
    assertEquals(1, pool.generation());
    assertEquals(1, resolver.lookups);
    assertEquals(DeliveryState.FAILED, client.lastState());
    assertEquals(1, metrics.count("remote_write.deliver.failure.remote_rejected"));
    assertEquals(0, metrics.count("remote_write.deliver.success"));
  }

  @Test
  void rejectionBodyIsTruncated() {
    factory.response = new TransportResponse(400, "x".repeat(4096));
    RemoteWriteDeliveryClient client = client(RemoteWriteConfig.builder(URL).build());

    RemoteRejectedException ex = assertThrows(RemoteRejectedException.class, () -> client.send(PAYLOAD));

    assertTrue(ex.bodyExcerpt().startsWith("x".repeat(512)));
    assertTrue(ex.bodyExcerpt().contains("truncated"));
    assertFalse(ex.bodyExcerpt().startsWith("x".repeat(513)));
  }

  @Test
  void ioFailureBecomesTransportException() {
    factory.failure = new ConnectException("Connection refused");
    RemoteWriteDeliveryClient client = client(RemoteWriteConfig.builder(URL).build());
    clock.now = pool.refreshDeadlineMillis() + 1;

    TransportException ex = assertThrows(TransportException.class, () -> client.send(PAYLOAD));

    assertEquals(ErrorKind.TRANSPORT, ex.kind());
    assertTrue(ex.getCause() instanceof ConnectException);
    assertEquals(1, resolver.lookups);
    assertEquals(1, metrics.count("remote_write.deliver.failure.transport"));
  }

  @Test
  void successPastDeadlineRefreshesExactlyOnce() throws Exception {
    RemoteWriteDeliveryClient client = client(RemoteWriteConfig.builder(URL).build());
    clock.now = pool.refreshDeadlineMillis();

    client.send(PAYLOAD);
    assertEquals(2, resolver.lookups);
    assertEquals(2, pool.generation());
    assertEquals(1, metrics.count("remote_write.pool.refresh"));

    client.send(PAYLOAD);
    assertEquals(2, resolver.lookups);
    assertEquals(2, factory.usedHandles.get(1).generation);
    assertEquals(1, factory.usedHandles.get(1).index);
  }

  @Test
  void refreshFailureAfterDeliveryPropagatesButStateStaysDelivered() {
    RemoteWriteDeliveryClient client = client(RemoteWriteConfig.builder(URL).build());
    clock.now = pool.refreshDeadlineMillis() + 10;
    resolver.fail = true;

    assertThrows(ResolutionException.class, () -> client.send(PAYLOAD));

    assertEquals(1, factory.requests.size());
    assertEquals(DeliveryState.DELIVERED, client.lastState());
    assertEquals(1, metrics.count("remote_write.deliver.success"));
    assertEquals(1, pool.generation());
  }
}
