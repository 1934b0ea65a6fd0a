package ocsphealth.services;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import ocsphealth.model.Authority;
import org.springframework.stereotype.Service;

/**
 * Authorities seen so far. An authority is created on first sight and afterwards only its cardinality changes.
 */
@Service
@Slf4j
public class AuthorityRegistry {

    private final Map<String/*keyId*/, Authority> authorities = new ConcurrentHashMap<>();

    public Authority ensure(String keyId, String name) {
        return ensure(keyId, name, 0);
    }

    /**
     * @param cardinality initial cardinality, ignored when the authority is already known
     */
    public Authority ensure(String keyId, String name, long cardinality) {
        return authorities.computeIfAbsent(keyId, id -> {
            log.debug("Registering authority={} keyId={}", name, id);
            return Authority.builder()
                .keyId(id)
                .name(name)
                .cardinality(cardinality)
                .build();
        });
    }

    /**
     * @throws IllegalStateException if the authority was never registered
     */
    public Authority updateCardinality(String keyId, long cardinality) {
        final Authority updated = authorities.computeIfPresent(keyId,
            (id, authority) -> authority.withCardinality(cardinality));
        if (updated == null) {
            throw new IllegalStateException("Unknown authority " + keyId);
        }
        return updated;
    }

    public Optional<Authority> find(String keyId) {
        return Optional.ofNullable(authorities.get(keyId));
    }

    /**
     * @return all authorities, largest certificate population first
     */
    public List<Authority> all() {
        return authorities.values().stream()
            .sorted(Comparator.comparingLong(Authority::cardinality).reversed()
                .thenComparing(Authority::name))
            .toList();
    }
}
