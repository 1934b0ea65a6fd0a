package ocsphealth.services;

import io.netty.channel.ChannelOption;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import ocsphealth.config.AppProperties;
import ocsphealth.model.Location;
import ocsphealth.model.ProbeExchange;
import ocsphealth.model.ProbeRequest;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.tcp.TcpClient;

/**
 * Probes directly from this host.
 */
@Component
@Slf4j
public class LocalVantagePointAccess implements VantagePointAccess {

    public static final MediaType OCSP_REQUEST = MediaType.parseMediaType("application/ocsp-request");
    public static final MediaType OCSP_RESPONSE = MediaType.parseMediaType("application/ocsp-response");

    private static final byte[] EMPTY = new byte[0];

    private final WebClient webClient;
    private final Duration connectTimeout;

    public LocalVantagePointAccess(WebClient.Builder webClientBuilder, AppProperties appProperties) {
        this.webClient = webClientBuilder.build();
        this.connectTimeout = appProperties.probe().connectTimeout();
    }

    @Override
    public Mono<ProbeExchange> execute(Location location, ProbeRequest request) {
        final URI url = request.responderUrl();
        return ping(url, min(connectTimeout, request.timeout()))
            .flatMap(pingLatency -> post(request, request.timeout().minus(pingLatency))
                .map(exchange -> ProbeExchange.builder()
                    .pingLatency(pingLatency)
                    .httpStatus(exchange.httpStatus())
                    .ocspLatency(exchange.ocspLatency())
                    .body(exchange.body())
                    .error(exchange.error())
                    .build()
                )
            )
            .onErrorResume(e -> {
                log.debug("Responder url={} is not reachable from location={}: {}", url, location.id(),
                    e.getMessage());
                return Mono.just(ProbeExchange.unreachable("connect failed: " + e.getMessage()));
            });
    }

    /**
     * @return time taken to establish a TCP connection with the responder host
     */
    Mono<Duration> ping(URI url, Duration timeout) {
        return Mono.defer(() -> {
            final long started = System.nanoTime();
            return TcpClient.newConnection()
                .host(url.getHost())
                .port(portOf(url))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
                .connect()
                .map(connection -> {
                    final Duration latency = Duration.ofNanos(System.nanoTime() - started);
                    connection.dispose();
                    return latency;
                });
        });
    }

    /**
     * @param budget what is left of the request's timeout once connected
     */
    private Mono<ProbeExchange> post(ProbeRequest request, Duration budget) {
        if (budget.isNegative() || budget.isZero()) {
            return Mono.just(ProbeExchange.builder()
                .error("timed out before sending request")
                .build());
        }
        return Mono.defer(() -> {
            final long started = System.nanoTime();
            return webClient.post()
                .uri(request.responderUrl())
                .contentType(OCSP_REQUEST)
                .accept(OCSP_RESPONSE)
                .bodyValue(request.ocspRequest())
                .exchangeToMono(response -> response.bodyToMono(byte[].class)
                    .defaultIfEmpty(EMPTY)
                    .map(body -> ProbeExchange.builder()
                        .httpStatus(response.statusCode().value())
                        .ocspLatency(Duration.ofNanos(System.nanoTime() - started))
                        .body(body)
                        .build()
                    )
                )
                .timeout(budget)
                .onErrorResume(TimeoutException.class, e -> {
                    log.debug("OCSP POST to url={} got no response within {}", request.responderUrl(), budget);
                    return Mono.just(ProbeExchange.builder()
                        .error("HTTP timed out after " + budget.toMillis() + "ms")
                        .build());
                })
                .onErrorResume(e -> {
                    log.debug("OCSP POST to url={} failed: {}", request.responderUrl(), e.toString());
                    return Mono.just(ProbeExchange.builder()
                        .error("request failed: " + e)
                        .build());
                });
        });
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    static int portOf(URI url) {
        if (url.getPort() != -1) {
            return url.getPort();
        }
        return "https".equalsIgnoreCase(url.getScheme()) ? 443 : 80;
    }
}
