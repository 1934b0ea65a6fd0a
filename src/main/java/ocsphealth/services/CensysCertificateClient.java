package ocsphealth.services;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import java.net.URI;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import ocsphealth.config.AppProperties;
import ocsphealth.messages.CensysCertificateFields;
import ocsphealth.messages.CertificateReportRequest;
import ocsphealth.messages.CertificateReportResponse;
import ocsphealth.messages.CertificateSearchRequest;
import ocsphealth.messages.CertificateSearchResponse;
import ocsphealth.model.Authority;
import ocsphealth.model.CertificateRecord;
import ocsphealth.model.CertificateSearch;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Searches the Censys certificate index for CA certificates issued under an authority key and carrying an OCSP URL,
 * and ranks authorities through its aggregate reports.
 * Requests are issued one at a time and at most one per rate limiter period since the API quota is the scarcest
 * resource of discovery.
 */
@Service
@Slf4j
public class CensysCertificateClient implements CertificateIntelligenceClient {

    private static final List<String> FIELDS = List.of(
        CensysCertificateFields.RAW,
        CensysCertificateFields.ISSUER_URLS
    );

    private final WebClient webClient;
    private final AppProperties appProperties;
    private final RateLimiter rateLimiter;
    private final ConcurrencyLimiter callLimiter = new ConcurrencyLimiter("censys", 1);

    public CensysCertificateClient(WebClient.Builder webClientBuilder, AppProperties appProperties,
        RateLimiter censysRateLimiter
    ) {
        final AppProperties.Censys censys = appProperties.censys();
        this.webClient = webClientBuilder
            .baseUrl(censys.baseUrl().toString())
            .defaultHeaders(headers -> {
                if (censys.apiId() != null && censys.apiSecret() != null) {
                    headers.setBasicAuth(censys.apiId(), censys.apiSecret());
                }
            })
            .filter((request, next) -> {
                log.debug("Starting {} {}", request.method(), request.url());
                return next.exchange(request);
            })
            .build();
        this.appProperties = appProperties;
        this.rateLimiter = censysRateLimiter;
    }

    static String buildQuery(String authorityKeyId) {
        return "%s: %s AND %s: true AND %s: /.+/".formatted(
            CensysCertificateFields.AUTHORITY_KEY_ID, authorityKeyId.toLowerCase(),
            CensysCertificateFields.IS_CA,
            CensysCertificateFields.OCSP_URLS
        );
    }

    /**
     * CA certificates issued by an organization that carry an OCSP URL. Their authority key id names the
     * organization's root.
     */
    static String buildAuthorityKeyQuery(String organization) {
        return "%s: true AND %s: \"%s\" AND %s: true AND %s: /.+/".formatted(
            CensysCertificateFields.NSS_VALID,
            CensysCertificateFields.ISSUER_ORGANIZATION, organization.replace("\"", "\\\""),
            CensysCertificateFields.IS_CA,
            CensysCertificateFields.OCSP_URLS
        );
    }

    @Override
    public Mono<CertificateSearch> search(String authorityKeyId) {
        final String query = buildQuery(authorityKeyId);
        final String subject = "authority=" + authorityKeyId;
        log.debug("Searching certificates for authority={} with query={}", authorityKeyId, query);

        return fetchPage(subject, query, 1)
            .flatMap(first -> {
                final int lastPage = Math.min(appProperties.discovery().maxPages(),
                    first.metadata() != null ? first.metadata().pages() : 1
                );
                return Flux.range(2, Math.max(0, lastPage - 1))
                    .concatMap(page -> fetchPage(subject, query, page))
                    .startWith(first)
                    .collectList()
                    .map(pages -> toSearch(authorityKeyId, pages));
            })
            .doOnNext(search -> log.debug("Certificate search for authority={} returned {} of total={}",
                authorityKeyId, search.records().size(), search.total()
            ));
    }

    /**
     * Ranks issuing organizations by valid certificate count and then resolves each organization to the key id
     * of the root most of its OCSP bearing CA certificates chain to. Organizations without such certificates are
     * left out.
     */
    @Override
    public Mono<List<Authority>> topAuthorities(int count) {
        log.debug("Ranking top {} authorities", count);
        return report(CensysCertificateFields.NSS_VALID + ": true",
            CensysCertificateFields.ISSUER_ORGANIZATION, count
        )
            .flatMapMany(organizations -> Flux.fromIterable(sortedBuckets(organizations)))
            .filter(organization -> organization.key() != null && !organization.key().isBlank())
            .concatMap(organization ->
                report(buildAuthorityKeyQuery(organization.key()), CensysCertificateFields.AUTHORITY_KEY_ID, 1)
                    .flatMap(keys -> Mono.justOrEmpty(sortedBuckets(keys).stream()
                        .map(CertificateReportResponse.Bucket::key)
                        .filter(Objects::nonNull)
                        .findFirst()
                    ))
                    .map(keyId -> Authority.builder()
                        .keyId(keyId.toLowerCase())
                        .name(organization.key())
                        .cardinality(organization.docCount())
                        .build()
                    )
                    .switchIfEmpty(Mono.fromRunnable(() ->
                        log.debug("No OCSP bearing CA certificates for organization={}", organization.key())
                    ))
            )
            .distinct(Authority::keyId)
            .collectList()
            .doOnNext(authorities -> log.debug("Ranked authorities={}", authorities));
    }

    private static List<CertificateReportResponse.Bucket> sortedBuckets(CertificateReportResponse report) {
        if (report.results() == null) {
            return List.of();
        }
        return report.results().stream()
            .sorted(Comparator.comparingLong(CertificateReportResponse.Bucket::docCount).reversed())
            .toList();
    }

    private Mono<CertificateReportResponse> report(String query, String field, int buckets) {
        return call("/report/certificates",
            CertificateReportRequest.builder()
                .query(query)
                .field(field)
                .buckets(buckets)
                .build(),
            CertificateReportResponse.class,
            "report of " + field
        );
    }

    private Mono<CertificateSearchResponse> fetchPage(String subject, String query, int page) {
        return call("/search/certificates",
            CertificateSearchRequest.builder()
                .query(query)
                .page(page)
                .fields(FIELDS)
                .flatten(true)
                .build(),
            CertificateSearchResponse.class,
            subject
        );
    }

    private <T> Mono<T> call(String path, Object body, Class<T> responseType, String subject) {
        return callLimiter.withPermit(
            webClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, clientResponse ->
                    clientResponse.createException()
                        .map(e -> e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value() ?
                            CertificateIntelligenceException.rateLimited(subject, e)
                            : CertificateIntelligenceException.transientFailure(subject, e)
                        )
                )
                .bodyToMono(responseType)
                .timeout(appProperties.censys().responseTimeout())
                .transformDeferred(RateLimiterOperator.of(rateLimiter))
                .onErrorMap(RequestNotPermitted.class,
                    e -> CertificateIntelligenceException.rateLimited(subject, e))
                .onErrorMap(e -> !(e instanceof CertificateIntelligenceException),
                    e -> CertificateIntelligenceException.transientFailure(subject, e)
                )
        );
    }

    private CertificateSearch toSearch(String authorityKeyId, List<CertificateSearchResponse> pages) {
        final List<CertificateRecord> records = new ArrayList<>();
        long total = 0;
        for (CertificateSearchResponse response : pages) {
            if (response.metadata() != null) {
                total = Math.max(total, response.metadata().count());
            }
            if (response.results() == null) {
                continue;
            }
            for (CertificateSearchResponse.Hit hit : response.results()) {
                final CertificateRecord record = toRecord(authorityKeyId, hit);
                if (record != null) {
                    records.add(record);
                }
            }
        }
        return new CertificateSearch(records, total);
    }

    private CertificateRecord toRecord(String authorityKeyId, CertificateSearchResponse.Hit hit) {
        if (hit.raw() == null) {
            return null;
        }
        final byte[] raw;
        try {
            raw = Base64.getMimeDecoder().decode(hit.raw());
        } catch (IllegalArgumentException e) {
            log.debug("Skipping hit with undecodable raw certificate for authority={}", authorityKeyId);
            return null;
        }
        final List<URI> issuerUrls = hit.issuerUrls() == null ? List.of()
            : hit.issuerUrls().stream()
                .map(CensysCertificateClient::toUri)
                .filter(Objects::nonNull)
                .toList();
        return new CertificateRecord(raw, null, issuerUrls);
    }

    private static URI toUri(String value) {
        try {
            return URI.create(value.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
