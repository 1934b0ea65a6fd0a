package ocsphealth.services;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import ocsphealth.config.AppProperties;
import ocsphealth.model.Authority;
import ocsphealth.model.Chain;
import ocsphealth.model.DiscoveryResult;
import ocsphealth.model.DiscoveryResult.Endpoint;
import ocsphealth.model.DiscoverySnapshot;
import ocsphealth.model.Responder;
import ocsphealth.model.Responder.ResponderKey;
import ocsphealth.model.ResponderBinding;
import org.bouncycastle.cert.X509CertificateHolder;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Owns the freshness of responder discovery per authority. Fresh discovery is served without touching the search
 * API; stale discovery is refreshed at most once concurrently per authority and merged so that known responders are
 * never dropped.
 */
@Service
@Slf4j
public class DiscoveryCacheService {

    private final ResponderDiscoveryService discoveryService;
    private final AuthorityRegistry authorityRegistry;
    private final Clock clock;
    private final Duration ttl;

    private final Map<String/*authority keyId*/, CachedDiscovery> cache = new ConcurrentHashMap<>();
    private final Map<String/*authority keyId*/, Mono<DiscoverySnapshot>> inFlight = new ConcurrentHashMap<>();
    private final Map<String/*chain id*/, Chain> chains = new ConcurrentHashMap<>();

    public DiscoveryCacheService(ResponderDiscoveryService discoveryService,
        AuthorityRegistry authorityRegistry,
        AppProperties appProperties,
        Clock clock
    ) {
        this.discoveryService = discoveryService;
        this.authorityRegistry = authorityRegistry;
        this.clock = clock;
        this.ttl = appProperties.discovery().ttl();
    }

    public Mono<DiscoverySnapshot> getOrRefresh(Authority authority) {
        final String keyId = authority.keyId();
        final CachedDiscovery cached = cache.get(keyId);
        if (cached != null && isFresh(cached)) {
            log.debug("Serving cached discovery for authority={} refreshedAt={}", authority.name(),
                cached.refreshedAt());
            return Mono.just(cached.toSnapshot(keyId, false));
        }

        // late callers share the refresh already in flight
        return inFlight.computeIfAbsent(keyId, key -> refresh(authority)
            .doFinally(signalType -> inFlight.remove(key))
            .cache()
        );
    }

    /**
     * @return the bindings currently known for the authority, without refreshing anything
     */
    public List<ResponderBinding> knownBindings(String authorityKeyId) {
        final CachedDiscovery cached = cache.get(authorityKeyId);
        return cached != null ? List.copyOf(cached.bindings().values()) : List.of();
    }

    private Mono<DiscoverySnapshot> refresh(Authority authority) {
        final String keyId = authority.keyId();
        return Mono.defer(() -> {
            final CachedDiscovery current = cache.get(keyId);
            if (current != null && isFresh(current)) {
                return Mono.just(current.toSnapshot(keyId, false));
            }
            log.info("Refreshing discovery for authority={} lastRefreshed={}", authority.name(),
                current != null ? current.refreshedAt() : null
            );

            return discoveryService.discover(authority)
                .map(result -> {
                    final Instant now = clock.instant();
                    final CachedDiscovery updated = cache.compute(keyId,
                        (key, previous) -> merge(key, previous, result, now));
                    authorityRegistry.ensure(keyId, authority.name());
                    authorityRegistry.updateCardinality(keyId, result.certificateTotal());
                    log.info("Discovery of authority={} now tracks responders={}", authority.name(),
                        updated.bindings().size());
                    return updated.toSnapshot(keyId, false);
                })
                .onErrorResume(e -> {
                    final CachedDiscovery stale = cache.get(keyId);
                    log.warn("Discovery refresh failed for authority={}, serving {} cached responders: {}",
                        authority.name(), stale != null ? stale.bindings().size() : 0, e.getMessage()
                    );
                    return Mono.just(stale != null ? stale.toSnapshot(keyId, true)
                        : new DiscoverySnapshot(keyId, List.of(), null, true));
                });
        });
    }

    private boolean isFresh(CachedDiscovery cached) {
        return cached.refreshedAt().plus(ttl).isAfter(clock.instant());
    }

    private CachedDiscovery merge(String keyId, @Nullable CachedDiscovery previous, DiscoveryResult result,
        Instant now
    ) {
        final Map<ResponderKey, Chain> found = new HashMap<>();
        for (Endpoint endpoint : result.endpoints()) {
            found.merge(new ResponderKey(keyId, endpoint.url()), intern(endpoint.chain()),
                (a, b) -> preferred(a, b, now));
        }

        // responders missing from this discovery are kept but no longer current
        final Map<ResponderKey, ResponderBinding> merged = new LinkedHashMap<>();
        if (previous != null) {
            previous.bindings().forEach((key, binding) -> merged.put(key,
                new ResponderBinding(binding.responder().withCurrent(false), binding.chain())));
        }
        found.entrySet().stream()
            .sorted(Comparator.comparing(entry -> entry.getKey().url()))
            .forEach(entry -> {
                final ResponderKey key = entry.getKey();
                final Chain chain = entry.getValue();
                final boolean current = isValid(chain, now);
                final ResponderBinding existing = merged.get(key);
                if (existing == null) {
                    merged.put(key, new ResponderBinding(
                        Responder.builder()
                            .url(key.url())
                            .authorityKeyId(keyId)
                            .discovered(now)
                            .current(current)
                            .build(),
                        chain
                    ));
                } else {
                    final Responder responder = existing.responder().withCurrent(current);
                    merged.put(key, new ResponderBinding(responder,
                        current || !isValid(existing.chain(), now) ? chain : existing.chain()));
                }
            });

        return new CachedDiscovery(now, Map.copyOf(merged));
    }

    private Chain intern(Chain chain) {
        final Chain existing = chains.putIfAbsent(chain.id(), chain);
        return existing != null ? existing : chain;
    }

    /**
     * Prefers a chain whose subject is currently valid, then the one expiring last.
     */
    private static Chain preferred(Chain a, Chain b, Instant now) {
        final boolean aValid = isValid(a, now);
        if (aValid != isValid(b, now)) {
            return aValid ? a : b;
        }
        return notAfter(b).isAfter(notAfter(a)) ? b : a;
    }

    private static boolean isValid(Chain chain, Instant now) {
        final X509CertificateHolder subject = subjectOf(chain);
        return subject != null && Certificates.isValidAt(subject, now);
    }

    private static Instant notAfter(Chain chain) {
        final X509CertificateHolder subject = subjectOf(chain);
        return subject != null ? subject.getNotAfter().toInstant() : Instant.MIN;
    }

    @Nullable
    private static X509CertificateHolder subjectOf(Chain chain) {
        try {
            return Certificates.parse(chain.subject());
        } catch (IOException e) {
            return null;
        }
    }

    private record CachedDiscovery(
        Instant refreshedAt,
        Map<ResponderKey, ResponderBinding> bindings
    ) {

        DiscoverySnapshot toSnapshot(String keyId, boolean degraded) {
            return new DiscoverySnapshot(keyId,
                bindings.values().stream()
                    .sorted(Comparator.comparing(binding -> binding.responder().url()))
                    .toList(),
                refreshedAt, degraded
            );
        }
    }
}
