package ocsphealth.services;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import ocsphealth.TestProperties;
import ocsphealth.model.Location;
import ocsphealth.model.ProbeRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.test.StepVerifier;

class LocalVantagePointAccessTest {

    private static final Location LOCAL = Location.builder()
        .id("local")
        .name("Local")
        .build();
    private static final byte[] REQUEST = "ocsp-request".getBytes(StandardCharsets.US_ASCII);

    private final AtomicReference<String> receivedContentType = new AtomicReference<>();
    private final LocalVantagePointAccess access = new LocalVantagePointAccess(WebClient.builder(),
        TestProperties.defaults());
    private DisposableServer server;

    @BeforeEach
    void startServer() {
        server = HttpServer.create()
            .host("127.0.0.1")
            .port(0)
            .route(routes -> routes
                .post("/unavailable", (request, response) -> response.status(503).send())
                .post("/silent", (request, response) -> Mono.never())
                .post("/echo", (request, response) -> {
                    receivedContentType.set(request.requestHeaders().get(HttpHeaders.CONTENT_TYPE));
                    return response
                        .header(HttpHeaders.CONTENT_TYPE, "application/ocsp-response")
                        .sendByteArray(request.receive().aggregate().asByteArray());
                })
            )
            .bindNow();
    }

    @AfterEach
    void stopServer() {
        server.disposeNow();
    }

    private URI url(String path) {
        return URI.create("http://127.0.0.1:%d%s".formatted(server.port(), path));
    }

    @Test
    void postsRequestAndTimesBothPhases() {
        StepVerifier.create(access.execute(LOCAL, new ProbeRequest(url("/echo"), REQUEST, Duration.ofSeconds(5))))
            .assertNext(exchange -> {
                assertThat(exchange.pingLatency()).isNotNull();
                assertThat(exchange.ocspLatency()).isNotNull();
                assertThat(exchange.httpStatus()).isEqualTo(200);
                assertThat(exchange.body()).isEqualTo(REQUEST);
            })
            .verifyComplete();

        assertThat(receivedContentType.get()).isEqualTo("application/ocsp-request");
    }

    @Test
    void serviceUnavailableKeepsStatus() {
        StepVerifier.create(access.execute(LOCAL,
                new ProbeRequest(url("/unavailable"), REQUEST, Duration.ofSeconds(5))))
            .assertNext(exchange -> {
                assertThat(exchange.pingLatency()).isNotNull();
                assertThat(exchange.httpStatus()).isEqualTo(503);
                assertThat(exchange.hasBody()).isFalse();
            })
            .verifyComplete();
    }

    @Test
    void silentResponderTimesOutAfterConnecting() {
        StepVerifier.create(access.execute(LOCAL, new ProbeRequest(url("/silent"), REQUEST, Duration.ofMillis(300))))
            .assertNext(exchange -> {
                assertThat(exchange.pingLatency()).isNotNull();
                assertThat(exchange.httpStatus()).isNull();
                assertThat(exchange.error()).startsWith("HTTP timed out");
            })
            .verifyComplete();
    }

    @Test
    void closedPortIsUnreachable() {
        final URI closed = url("/echo");
        server.disposeNow();

        StepVerifier.create(access.execute(LOCAL, new ProbeRequest(closed, REQUEST, Duration.ofSeconds(5))))
            .assertNext(exchange -> {
                assertThat(exchange.pingLatency()).isNull();
                assertThat(exchange.httpStatus()).isNull();
                assertThat(exchange.error()).startsWith("connect failed");
            })
            .verifyComplete();
    }

    @Test
    void defaultPorts() {
        assertThat(LocalVantagePointAccess.portOf(URI.create("http://ocsp.example.com"))).isEqualTo(80);
        assertThat(LocalVantagePointAccess.portOf(URI.create("https://ocsp.example.com"))).isEqualTo(443);
        assertThat(LocalVantagePointAccess.portOf(URI.create("http://ocsp.example.com:8080/x"))).isEqualTo(8080);
    }
}
