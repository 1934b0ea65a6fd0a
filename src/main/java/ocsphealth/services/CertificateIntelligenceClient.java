package ocsphealth.services;

import java.util.List;
import ocsphealth.model.Authority;
import ocsphealth.model.CertificateSearch;
import reactor.core.publisher.Mono;

/**
 * Searches an external certificate intelligence source for certificates chaining to an authority.
 */
public interface CertificateIntelligenceClient {

    /**
     * @param authorityKeyId hex encoded key identifier of the authority
     * @return the certificates found; errors with {@link CertificateIntelligenceException} when the source is
     * unavailable or rate limits the caller
     */
    Mono<CertificateSearch> search(String authorityKeyId);

    /**
     * Ranks authorities by the number of valid certificates they issued. Sources without aggregate reports rank
     * nothing.
     *
     * @param count how many authorities to rank at most
     * @return authorities, largest certificate population first, with that population as cardinality
     */
    default Mono<List<Authority>> topAuthorities(int count) {
        return Mono.just(List.of());
    }
}
