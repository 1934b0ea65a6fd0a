package ocsphealth.services;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import ocsphealth.model.Authority;
import ocsphealth.model.CertificateRecord;
import ocsphealth.model.CertificateSearch;
import ocsphealth.model.Chain;
import ocsphealth.model.DiscoveryResult;
import ocsphealth.model.DiscoveryResult.Endpoint;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.cert.X509CertificateHolder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Turns the certificates found for an authority into the OCSP endpoints they advertise, each paired with the
 * minimal chain (intermediate and its issuer) needed to query that endpoint.
 */
@Service
@Slf4j
public class ResponderDiscoveryService {

    private final CertificateIntelligenceClient intelligenceClient;
    private final IssuerCertificateFetcher issuerFetcher;

    public ResponderDiscoveryService(CertificateIntelligenceClient intelligenceClient,
        IssuerCertificateFetcher issuerFetcher
    ) {
        this.intelligenceClient = intelligenceClient;
        this.issuerFetcher = issuerFetcher;
    }

    /**
     * @return the deduplicated endpoints, empty when the authority has no OCSP-bearing intermediates. Errors only when
     * the search itself fails.
     */
    public Mono<DiscoveryResult> discover(Authority authority) {
        log.debug("Discovering responders of authority={} keyId={}", authority.name(), authority.keyId());
        return intelligenceClient.search(authority.keyId())
            .flatMap(search -> extractEndpoints(authority, search));
    }

    private Mono<DiscoveryResult> extractEndpoints(Authority authority, CertificateSearch search) {
        final AtomicInteger malformed = new AtomicInteger();
        final AtomicInteger skipped = new AtomicInteger();

        final List<Candidate> candidates = new ArrayList<>();
        final Map<X500Name, List<X509CertificateHolder>> bySubject = new HashMap<>();
        for (CertificateRecord record : search.records()) {
            final X509CertificateHolder certificate;
            final boolean candidate;
            final List<URI> ocspUrls;
            final List<URI> caIssuerUrls;
            try {
                certificate = Certificates.parse(record.raw());
                // BouncyCastle reports garbled extension values as IllegalArgumentException
                candidate = Certificates.isCa(certificate) && !Certificates.isSelfIssued(certificate);
                ocspUrls = Certificates.ocspUrls(certificate);
                caIssuerUrls = Certificates.caIssuerUrls(certificate);
            } catch (IOException | IllegalArgumentException e) {
                log.debug("Skipping malformed certificate for authority={}: {}", authority.name(), e.getMessage());
                malformed.incrementAndGet();
                continue;
            }

            bySubject.computeIfAbsent(certificate.getSubject(), name -> new ArrayList<>()).add(certificate);
            if (candidate && !ocspUrls.isEmpty()) {
                candidates.add(new Candidate(record, certificate, ocspUrls, caIssuerUrls));
            } else {
                skipped.incrementAndGet();
            }
        }

        return Flux.fromIterable(candidates)
            .concatMap(candidate -> resolveIssuer(candidate, bySubject, malformed)
                .map(issuer -> toEndpoints(candidate, issuer))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.debug("Unable to resolve issuer of subject={} for authority={}",
                        candidate.certificate().getSubject(), authority.name());
                    skipped.incrementAndGet();
                    return List.<Endpoint>of();
                }))
            )
            .collect(() -> new LinkedHashSet<Endpoint>(), (endpoints, found) -> endpoints.addAll(found))
            .map(endpoints -> {
                final DiscoveryResult result = new DiscoveryResult(
                    endpoints, search.total(), malformed.get(), skipped.get());
                log.info("Discovered endpoints={} for authority={} from certificates={} (malformed={}, skipped={})",
                    endpoints.size(), authority.name(), search.records().size(), result.malformed(),
                    result.skipped()
                );
                return result;
            });
    }

    private Mono<X509CertificateHolder> resolveIssuer(Candidate candidate,
        Map<X500Name, List<X509CertificateHolder>> bySubject, AtomicInteger malformed
    ) {
        final X509CertificateHolder certificate = candidate.certificate();

        final byte[] suppliedIssuer = candidate.record().issuerRaw();
        if (suppliedIssuer != null) {
            try {
                final X509CertificateHolder issuer = Certificates.parse(suppliedIssuer);
                if (Certificates.isIssuedBy(certificate, issuer)) {
                    return Mono.just(issuer);
                }
            } catch (IOException e) {
                malformed.incrementAndGet();
            }
        }

        for (X509CertificateHolder sameName : bySubject.getOrDefault(certificate.getIssuer(), List.of())) {
            if (Certificates.isIssuedBy(certificate, sameName)) {
                return Mono.just(sameName);
            }
        }

        final Set<URI> issuerUrls = new LinkedHashSet<>(candidate.record().issuerUrls());
        issuerUrls.addAll(candidate.caIssuerUrls());
        if (issuerUrls.isEmpty()) {
            return Mono.empty();
        }
        return issuerFetcher.fetchIssuer(certificate, List.copyOf(issuerUrls));
    }

    private static List<Endpoint> toEndpoints(Candidate candidate, X509CertificateHolder issuer) {
        final Chain chain;
        try {
            chain = Chain.of(candidate.certificate().getEncoded(), issuer.getEncoded());
        } catch (IOException e) {
            throw new IllegalStateException("Unable to re-encode parsed certificate", e);
        }
        return candidate.ocspUrls().stream()
            .map(url -> new Endpoint(url, chain))
            .toList();
    }

    private record Candidate(
        CertificateRecord record,
        X509CertificateHolder certificate,
        List<URI> ocspUrls,
        List<URI> caIssuerUrls
    ) {

    }
}
