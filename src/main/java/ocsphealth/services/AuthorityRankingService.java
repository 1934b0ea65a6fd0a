package ocsphealth.services;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import ocsphealth.config.AppProperties;
import ocsphealth.model.Authority;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Picks the authorities to track when none are configured: the ones with the largest certificate population
 * according to the certificate intelligence source. The ranking is reused for the discovery TTL.
 */
@Service
@Slf4j
public class AuthorityRankingService {

    private final CertificateIntelligenceClient intelligenceClient;
    private final AuthorityRegistry authorityRegistry;
    private final Clock clock;
    private final Duration ttl;
    private final int count;

    private final AtomicReference<Ranking> latest = new AtomicReference<>();

    public AuthorityRankingService(CertificateIntelligenceClient intelligenceClient,
        AuthorityRegistry authorityRegistry,
        AppProperties appProperties,
        Clock clock
    ) {
        this.intelligenceClient = intelligenceClient;
        this.authorityRegistry = authorityRegistry;
        this.clock = clock;
        this.ttl = appProperties.discovery().ttl();
        this.count = appProperties.discovery().topAuthorities();
    }

    /**
     * @return registered authorities in ranking order. When ranking fails or ranks nothing, the previous ranking,
     * or else the largest authorities already registered.
     */
    public Mono<List<Authority>> topAuthorities() {
        return Mono.defer(() -> {
            final Ranking current = latest.get();
            if (current != null && current.rankedAt().plus(ttl).isAfter(clock.instant())) {
                return Mono.just(current.authorities());
            }

            log.info("Ranking top {} authorities", count);
            return intelligenceClient.topAuthorities(count)
                .flatMap(ranked -> {
                    if (ranked.isEmpty()) {
                        log.warn("Authority ranking returned nothing, keeping {} authorities", fallback().size());
                        return Mono.just(fallback());
                    }
                    final List<Authority> registered = ranked.stream()
                        .limit(count)
                        .map(authority -> authorityRegistry.ensure(authority.keyId(), authority.name(),
                            authority.cardinality()))
                        .toList();
                    latest.set(new Ranking(clock.instant(), registered));
                    log.info("Tracking ranked authorities={}", registered.stream().map(Authority::name).toList());
                    return Mono.just(registered);
                })
                .onErrorResume(e -> {
                    final List<Authority> fallback = fallback();
                    log.warn("Authority ranking failed, keeping {} authorities: {}", fallback.size(), e.getMessage());
                    return Mono.just(fallback);
                });
        });
    }

    private List<Authority> fallback() {
        final Ranking previous = latest.get();
        if (previous != null) {
            return previous.authorities();
        }
        return authorityRegistry.all().stream()
            .limit(count)
            .toList();
    }

    private record Ranking(
        Instant rankedAt,
        List<Authority> authorities
    ) {

    }
}
