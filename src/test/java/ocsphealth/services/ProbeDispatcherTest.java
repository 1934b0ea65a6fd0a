package ocsphealth.services;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import ocsphealth.TestPki;
import ocsphealth.TestPki.Issued;
import ocsphealth.TestProperties;
import ocsphealth.config.AppProperties;
import ocsphealth.model.Chain;
import ocsphealth.model.HealthStatus;
import ocsphealth.model.Location;
import ocsphealth.model.ProbeExchange;
import ocsphealth.model.Responder;
import ocsphealth.model.ResponderBinding;
import ocsphealth.model.Result;
import org.bouncycastle.cert.ocsp.CertificateStatus;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

class ProbeDispatcherTest {

    private static Issued root;
    private static Chain chain;

    private static final Location LOCAL = Location.builder()
        .id("local")
        .name("Local")
        .build();
    private static final Location DOWN = Location.builder()
        .id("down")
        .name("Down")
        .agentUrl(URI.create("http://agent.down.test"))
        .build();

    @BeforeAll
    static void createPki() {
        root = TestPki.root("Dispatch Root");
        chain = TestPki.chain(TestPki.intermediate(root, "Dispatch Intermediate", URI.create("http://ocsp.test")),
            root);
    }

    private static ProbeDispatcher dispatcher(AppProperties appProperties, VantagePointAccess access) {
        final OcspRequestFactory requestFactory = new OcspRequestFactory(appProperties);
        final OcspProber prober = new OcspProber(requestFactory, new OcspResponseParser(requestFactory), access,
            Clock.systemUTC(), appProperties);
        return new ProbeDispatcher(prober, new HealthClassifier(appProperties), Clock.systemUTC(), appProperties);
    }

    private static List<ResponderBinding> bindings(int count) {
        return IntStream.range(0, count)
            .mapToObj(i -> new ResponderBinding(
                Responder.builder()
                    .url(URI.create("http://ocsp%d.dispatch.test".formatted(i)))
                    .authorityKeyId("0d0e")
                    .discovered(Instant.now())
                    .build(),
                chain))
            .toList();
    }

    private static Mono<ProbeExchange> goodExchange(byte[] request) {
        return Mono.fromSupplier(() -> ProbeExchange.builder()
            .pingLatency(Duration.ofMillis(5))
            .httpStatus(200)
            .ocspLatency(Duration.ofMillis(10))
            .body(TestPki.ocspResponse(root, TestPki.requestedId(request), CertificateStatus.GOOD,
                Instant.now().minus(Duration.ofHours(1)), Instant.now().plus(Duration.ofDays(7))))
            .build());
    }

    @Test
    void unreachableLocationDoesNotAffectOthers() {
        final ProbeDispatcher dispatcher = dispatcher(TestProperties.defaults(), (location, request) ->
            location.id().equals("down") ?
                Mono.error(new VantagePointException(location.id(), "agent unreachable"))
                : goodExchange(request.ocspRequest())
        );

        final List<Result> results = dispatcher.dispatch(List.of(LOCAL, DOWN), bindings(3), Mono.never())
            .collectList()
            .block(Duration.ofSeconds(10));

        assertThat(results).hasSize(6);
        assertThat(results)
            .filteredOn(result -> result.locationId().equals("local"))
            .hasSize(3)
            .allSatisfy(result -> {
                assertThat(result.status()).isEqualTo(HealthStatus.GOOD);
                assertThat(result.chainId()).isEqualTo(chain.id());
            });
        assertThat(results)
            .filteredOn(result -> result.locationId().equals("down"))
            .hasSize(3)
            .allSatisfy(result -> {
                assertThat(result.status()).isEqualTo(HealthStatus.BAD);
                assertThat(result.reason()).contains("location unreachable");
                assertThat(result.pingLatency()).isNull();
            });
        assertThat(results)
            .extracting(result -> result.responder().url() + "@" + result.locationId())
            .doesNotHaveDuplicates();
    }

    @Test
    void cancellationAbandonsOutstandingProbes() {
        final AtomicBoolean hang = new AtomicBoolean(true);
        final ProbeDispatcher dispatcher = dispatcher(
            TestProperties.withDispatch(TestProperties.dispatch(1, 1, 1, Duration.ofMinutes(1))),
            (location, request) -> hang.get() ? Mono.never() : goodExchange(request.ocspRequest())
        );
        final Sinks.Empty<Void> cancellation = Sinks.empty();

        final Mono<List<Result>> results = dispatcher.dispatch(List.of(LOCAL, DOWN), bindings(2),
                cancellation.asMono())
            .collectList();
        Mono.delay(Duration.ofMillis(100)).subscribe(tick -> cancellation.tryEmitEmpty());

        assertThat(results.block(Duration.ofSeconds(10)))
            .hasSize(4)
            .allSatisfy(result -> {
                assertThat(result.status()).isEqualTo(HealthStatus.BAD);
                assertThat(result.reason()).isEqualTo(ProbeDispatcher.ABANDONED);
            });

        // permits were handed back, so the next dispatch is not starved
        hang.set(false);
        assertThat(dispatcher.dispatch(List.of(LOCAL), bindings(1), Mono.never())
            .collectList()
            .block(Duration.ofSeconds(5)))
            .singleElement()
            .extracting(Result::status)
            .isEqualTo(HealthStatus.GOOD);
    }

    @Test
    void respectsPerLocationLimit() {
        final AtomicInteger inFlight = new AtomicInteger();
        final AtomicInteger maxInFlight = new AtomicInteger();
        final ProbeDispatcher dispatcher = dispatcher(
            TestProperties.withDispatch(TestProperties.dispatch(1, 2, 16, Duration.ofSeconds(5))),
            (location, request) -> Mono.defer(() -> {
                    maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                    return goodExchange(request.ocspRequest());
                })
                .delayElement(Duration.ofMillis(30))
                .doOnTerminate(inFlight::decrementAndGet)
        );

        final List<Result> results = dispatcher.dispatch(List.of(LOCAL), bindings(4), Mono.never())
            .collectList()
            .block(Duration.ofSeconds(10));

        assertThat(results).hasSize(4);
        assertThat(maxInFlight).hasValue(1);
    }

    @Test
    void respectsGlobalLimit() {
        final AtomicInteger inFlight = new AtomicInteger();
        final AtomicInteger maxInFlight = new AtomicInteger();
        final Location other = Location.builder()
            .id("other")
            .name("Other")
            .build();
        final ProbeDispatcher dispatcher = dispatcher(
            TestProperties.withDispatch(TestProperties.dispatch(4, 2, 2, Duration.ofSeconds(5))),
            (location, request) -> Mono.defer(() -> {
                    maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                    return goodExchange(request.ocspRequest());
                })
                .delayElement(Duration.ofMillis(30))
                .doOnTerminate(inFlight::decrementAndGet)
        );

        final List<Result> results = dispatcher.dispatch(List.of(LOCAL, other), bindings(3), Mono.never())
            .collectList()
            .block(Duration.ofSeconds(10));

        assertThat(results).hasSize(6);
        assertThat(maxInFlight.get()).isBetween(1, 2);
    }

    @Test
    void nothingToDispatch() {
        assertThat(dispatcher(TestProperties.defaults(), (location, request) -> Mono.never())
            .dispatch(List.of(LOCAL), List.of(), Mono.never())
            .collectList()
            .block(Duration.ofSeconds(1)))
            .isEmpty();
    }
}
