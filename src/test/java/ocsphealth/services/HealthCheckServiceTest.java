package ocsphealth.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import ocsphealth.TestPki;
import ocsphealth.TestPki.Issued;
import ocsphealth.TestProperties;
import ocsphealth.config.AppProperties;
import ocsphealth.config.AppProperties.TrackedAuthority;
import ocsphealth.config.LocationProperties;
import ocsphealth.model.Authority;
import ocsphealth.model.CertificateRecord;
import ocsphealth.model.CertificateSearch;
import ocsphealth.model.CycleReport;
import ocsphealth.model.HealthStatus;
import ocsphealth.model.LatestResult;
import ocsphealth.model.Location;
import ocsphealth.model.ProbeExchange;
import ocsphealth.model.ProbeRequest;
import ocsphealth.model.Result;
import org.bouncycastle.cert.ocsp.CertificateStatus;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class HealthCheckServiceTest {

    private static final String KEY_ID = "a1b2";
    private static final URI GOOD_URL = URI.create("http://good.ocsp.test");
    private static final URI STALE_URL = URI.create("http://stale.ocsp.test");
    private static final URI UNAVAILABLE_URL = URI.create("http://unavailable.ocsp.test");
    private static final URI UNREACHABLE_URL = URI.create("http://unreachable.ocsp.test");

    private static Issued root;
    private static List<CertificateRecord> records;

    private final AtomicInteger searches = new AtomicInteger();
    private final AtomicBoolean hang = new AtomicBoolean();
    private InMemoryResultStore resultStore;
    private HealthCheckService healthCheckService;
    private HealthReportService healthReportService;

    @BeforeAll
    static void createPki() {
        root = TestPki.root("Cycle Root");
        records = List.of(
            CertificateRecord.of(TestPki.intermediate(root, "Good", GOOD_URL).encoded()),
            CertificateRecord.of(TestPki.intermediate(root, "Stale", STALE_URL).encoded()),
            CertificateRecord.of(TestPki.intermediate(root, "Unavailable", UNAVAILABLE_URL).encoded()),
            CertificateRecord.of(TestPki.intermediate(root, "Unreachable", UNREACHABLE_URL).encoded()),
            CertificateRecord.of(root.encoded())
        );
    }

    @BeforeEach
    void setUp() {
        createServices(List.of(new TrackedAuthority(KEY_ID, "Cycle Root")));
    }

    private void createServices(List<TrackedAuthority> trackedAuthorities) {
        final AppProperties appProperties = TestProperties.withAuthoritiesAndLocations(
            trackedAuthorities,
            Map.of("local", new LocationProperties("Local", null, null, null)),
            TestProperties.dispatch(4, 2, 16, Duration.ofSeconds(5))
        );
        final Clock clock = Clock.systemUTC();

        final CertificateIntelligenceClient client = new CertificateIntelligenceClient() {
            @Override
            public Mono<CertificateSearch> search(String authorityKeyId) {
                return Mono.fromSupplier(() -> {
                    searches.incrementAndGet();
                    return new CertificateSearch(records, 5000);
                });
            }

            @Override
            public Mono<List<Authority>> topAuthorities(int count) {
                return Mono.just(List.of(Authority.builder()
                    .keyId(KEY_ID)
                    .name("Ranked Root")
                    .cardinality(80000)
                    .build()));
            }
        };
        final AuthorityRegistry authorityRegistry = new AuthorityRegistry();
        final DiscoveryCacheService cacheService = new DiscoveryCacheService(
            new ResponderDiscoveryService(client, mock(IssuerCertificateFetcher.class)),
            authorityRegistry, appProperties, clock);
        final VantagePointRegistry vantagePointRegistry = new VantagePointRegistry(appProperties,
            new MockEnvironment());

        final OcspRequestFactory requestFactory = new OcspRequestFactory(appProperties);
        final OcspProber prober = new OcspProber(requestFactory, new OcspResponseParser(requestFactory),
            this::respond, clock, appProperties);
        final ProbeDispatcher dispatcher = new ProbeDispatcher(prober, new HealthClassifier(appProperties), clock,
            appProperties);

        resultStore = new InMemoryResultStore();
        healthCheckService = new HealthCheckService(appProperties, authorityRegistry,
            new AuthorityRankingService(client, authorityRegistry, appProperties, clock), cacheService,
            vantagePointRegistry, dispatcher, new ResultRecorder(resultStore, appProperties), clock);
        healthReportService = new HealthReportService(authorityRegistry, cacheService, vantagePointRegistry,
            resultStore);
    }

    private Mono<ProbeExchange> respond(Location location, ProbeRequest request) {
        if (hang.get()) {
            return Mono.never();
        }
        final URI url = request.responderUrl();
        final ProbeExchange.ProbeExchangeBuilder exchange = ProbeExchange.builder()
            .pingLatency(Duration.ofMillis(7))
            .ocspLatency(Duration.ofMillis(21))
            .httpStatus(200);

        if (url.equals(GOOD_URL)) {
            exchange.body(TestPki.ocspResponse(root, TestPki.requestedId(request.ocspRequest()),
                CertificateStatus.GOOD, Instant.now().minus(Duration.ofHours(1)),
                Instant.now().plus(Duration.ofDays(7))));
        } else if (url.equals(STALE_URL)) {
            exchange.body(TestPki.ocspResponse(root, TestPki.requestedId(request.ocspRequest()),
                CertificateStatus.GOOD, Instant.now().minus(Duration.ofDays(8)),
                Instant.now().minus(Duration.ofDays(1))));
        } else if (url.equals(UNAVAILABLE_URL)) {
            exchange.httpStatus(503).body(new byte[0]);
        } else {
            return Mono.just(ProbeExchange.unreachable("connect failed: Connection refused"));
        }
        return Mono.just(exchange.build());
    }

    private CycleReport runCycle() {
        final CycleReport report = healthCheckService.runCycle().block(Duration.ofSeconds(10));
        assertThat(report).isNotNull();
        return report;
    }

    private Result latest(URI url) {
        return healthReportService.latestResults(Set.of(KEY_ID)).stream()
            .filter(latestResult -> latestResult.responder().url().equals(url))
            .map(LatestResult::result)
            .findFirst()
            .orElseThrow();
    }

    @Test
    void classifiesEveryResponder() {
        final CycleReport report = runCycle();

        assertThat(report.total()).isEqualTo(4);
        assertThat(report.statusCounts())
            .containsEntry(HealthStatus.GOOD, 1L)
            .containsEntry(HealthStatus.QUESTIONABLE, 1L)
            .containsEntry(HealthStatus.BAD, 2L);
        assertThat(report.degradedAuthorities()).isEmpty();
        assertThat(report.cancelled()).isFalse();

        assertThat(latest(GOOD_URL).status()).isEqualTo(HealthStatus.GOOD);
        assertThat(latest(STALE_URL).status()).isEqualTo(HealthStatus.QUESTIONABLE);

        final Result unavailable = latest(UNAVAILABLE_URL);
        assertThat(unavailable.status()).isEqualTo(HealthStatus.BAD);
        assertThat(unavailable.pingLatency()).isNotNull();
        assertThat(unavailable.ocspLatency()).isNull();

        final Result unreachable = latest(UNREACHABLE_URL);
        assertThat(unreachable.status()).isEqualTo(HealthStatus.BAD);
        assertThat(unreachable.pingLatency()).isNull();
        assertThat(unreachable.ocspLatency()).isNull();
    }

    @Test
    void rankedAuthoritiesAreTrackedWhenNoneConfigured() {
        createServices(List.of());

        final CycleReport report = runCycle();

        assertThat(report.total()).isEqualTo(4);
        final List<LatestResult> latest = healthReportService.latestResults(Set.of(KEY_ID));
        assertThat(latest)
            .hasSize(4)
            .allSatisfy(latestResult -> {
                assertThat(latestResult.authority().name()).isEqualTo("Ranked Root");
                assertThat(latestResult.responder().current()).isTrue();
            });
    }

    @Test
    void freshDiscoveryIsReusedWhileProbingProceeds() {
        runCycle();
        final CycleReport second = runCycle();

        assertThat(searches).hasValue(1);
        assertThat(second.total()).isEqualTo(4);
        final Result good = latest(GOOD_URL);
        assertThat(resultStore.history(good.responder().key(), "local")).hasSize(2);
    }

    @Test
    void latestResultsOrderedByResponderUrl() {
        runCycle();

        final List<LatestResult> latest = healthReportService.latestResults(Set.of(KEY_ID));

        assertThat(latest)
            .extracting(latestResult -> latestResult.responder().url())
            .containsExactly(GOOD_URL, STALE_URL, UNAVAILABLE_URL, UNREACHABLE_URL);
        assertThat(latest)
            .allSatisfy(latestResult -> assertThat(latestResult.authority().cardinality()).isEqualTo(5000));
        assertThat(healthReportService.latestResults(Set.of("unknown"))).isEmpty();
    }

    @Test
    void closeAbandonsRunningCycle() {
        hang.set(true);
        final Mono<CycleReport> cycle = healthCheckService.runCycle();

        StepVerifier.create(cycle)
            .then(() -> Mono.delay(Duration.ofMillis(200)).subscribe(tick -> healthCheckService.close()))
            .assertNext(report -> {
                assertThat(report.cancelled()).isTrue();
                assertThat(report.statusCounts()).containsOnlyKeys(HealthStatus.BAD);
                assertThat(report.total()).isEqualTo(4);
            })
            .expectComplete()
            .verify(Duration.ofSeconds(10));

        StepVerifier.create(healthCheckService.runCycle())
            .expectError(IllegalStateException.class)
            .verify();
    }

    @Test
    void overlappingCycleIsSkipped() {
        hang.set(true);
        final Disposable running = healthCheckService.runCycle().subscribe();
        try {
            StepVerifier.create(healthCheckService.runCycle())
                .verifyComplete();
            assertThat(healthCheckService.isRunning()).isTrue();
        } finally {
            healthCheckService.cancel();
            running.dispose();
        }
    }
}
