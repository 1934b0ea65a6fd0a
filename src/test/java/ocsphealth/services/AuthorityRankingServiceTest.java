package ocsphealth.services;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import ocsphealth.MutableClock;
import ocsphealth.TestProperties;
import ocsphealth.model.Authority;
import ocsphealth.model.CertificateSearch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

class AuthorityRankingServiceTest {

    private final AtomicInteger rankings = new AtomicInteger();
    private final AtomicReference<Mono<List<Authority>>> nextRanking = new AtomicReference<>();
    private MutableClock clock;
    private AuthorityRegistry authorityRegistry;
    private AuthorityRankingService rankingService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.now());
        authorityRegistry = new AuthorityRegistry();
        final CertificateIntelligenceClient client = new CertificateIntelligenceClient() {
            @Override
            public Mono<CertificateSearch> search(String authorityKeyId) {
                return Mono.error(new IllegalStateException("not searched here"));
            }

            @Override
            public Mono<List<Authority>> topAuthorities(int count) {
                return Mono.defer(() -> {
                    rankings.incrementAndGet();
                    return nextRanking.get();
                });
            }
        };
        rankingService = new AuthorityRankingService(client, authorityRegistry, TestProperties.defaults(), clock);
    }

    private static Authority ranked(String keyId, String name, long cardinality) {
        return Authority.builder()
            .keyId(keyId)
            .name(name)
            .cardinality(cardinality)
            .build();
    }

    private List<Authority> topAuthorities() {
        final List<Authority> authorities = rankingService.topAuthorities().block(Duration.ofSeconds(5));
        assertThat(authorities).isNotNull();
        return authorities;
    }

    @Test
    void registersRankedAuthoritiesInOrder() {
        nextRanking.set(Mono.just(List.of(ranked("0a", "Big CA", 900), ranked("0b", "Small CA", 100))));

        assertThat(topAuthorities())
            .extracting(Authority::name)
            .containsExactly("Big CA", "Small CA");
        assertThat(authorityRegistry.find("0a")).get()
            .extracting(Authority::cardinality)
            .isEqualTo(900L);
    }

    @Test
    void knownCardinalityIsNotOverwritten() {
        authorityRegistry.ensure("0a", "Big CA");
        authorityRegistry.updateCardinality("0a", 42);
        nextRanking.set(Mono.just(List.of(ranked("0a", "Big CA", 900))));

        assertThat(topAuthorities())
            .extracting(Authority::cardinality)
            .containsExactly(42L);
    }

    @Test
    void rankingIsReusedUntilStale() {
        nextRanking.set(Mono.just(List.of(ranked("0a", "Big CA", 900))));
        topAuthorities();
        clock.advance(Duration.ofDays(6));
        topAuthorities();

        assertThat(rankings).hasValue(1);

        clock.advance(Duration.ofDays(2));
        nextRanking.set(Mono.just(List.of(ranked("0c", "Rising CA", 5000))));

        assertThat(topAuthorities())
            .extracting(Authority::keyId)
            .containsExactly("0c");
        assertThat(rankings).hasValue(2);
    }

    @Test
    void failedRankingKeepsPreviousOne() {
        nextRanking.set(Mono.just(List.of(ranked("0a", "Big CA", 900))));
        topAuthorities();

        clock.advance(Duration.ofDays(8));
        nextRanking.set(Mono.error(CertificateIntelligenceException.rateLimited("report", null)));

        assertThat(topAuthorities())
            .extracting(Authority::keyId)
            .containsExactly("0a");

        // still stale, so the next call ranks again
        topAuthorities();
        assertThat(rankings).hasValue(3);
    }

    @Test
    void failedFirstRankingFallsBackToRegisteredAuthorities() {
        authorityRegistry.ensure("01", "Small CA", 10);
        authorityRegistry.ensure("02", "Big CA", 1000);
        nextRanking.set(Mono.error(new IllegalStateException("boom")));

        assertThat(topAuthorities())
            .extracting(Authority::keyId)
            .containsExactly("02", "01");
    }

    @Test
    void emptyRankingFallsBackToRegisteredAuthorities() {
        authorityRegistry.ensure("01", "Small CA", 10);
        nextRanking.set(Mono.just(List.of()));

        assertThat(topAuthorities())
            .extracting(Authority::keyId)
            .containsExactly("01");
    }
}
