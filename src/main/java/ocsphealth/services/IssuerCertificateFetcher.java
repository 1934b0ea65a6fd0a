package ocsphealth.services;

import java.io.IOException;
import java.io.StringReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import ocsphealth.config.AppProperties;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Downloads issuer certificates from the caIssuers locations that certificates advertise.
 */
@Service
@Slf4j
public class IssuerCertificateFetcher {

    private static final String PEM_PREFIX = "-----BEGIN";

    private final WebClient webClient;
    private final AppProperties appProperties;

    public IssuerCertificateFetcher(WebClient.Builder webClientBuilder, AppProperties appProperties) {
        this.webClient = webClientBuilder.build();
        this.appProperties = appProperties;
    }

    /**
     * Tries each URL in turn and emits the first certificate that actually issued {@code subject}.
     *
     * @return empty if none of the URLs yields the issuer
     */
    public Mono<X509CertificateHolder> fetchIssuer(X509CertificateHolder subject, List<URI> urls) {
        return Flux.fromIterable(urls)
            .concatMap(url -> download(url)
                .filter(candidate -> {
                    final boolean issued = Certificates.isIssuedBy(subject, candidate);
                    if (!issued) {
                        log.debug("Certificate from url={} did not issue subject={}", url, subject.getSubject());
                    }
                    return issued;
                })
            )
            .next();
    }

    private Mono<X509CertificateHolder> download(URI url) {
        log.debug("Downloading issuer certificate from url={}", url);
        return webClient.get()
            .uri(url)
            .retrieve()
            .bodyToMono(byte[].class)
            .timeout(appProperties.discovery().issuerFetchTimeout())
            .flatMap(body -> {
                try {
                    return Mono.just(decode(body));
                } catch (IOException e) {
                    log.warn("Issuer certificate from url={} could not be decoded: {}", url, e.getMessage());
                    return Mono.empty();
                }
            })
            .onErrorResume(e -> {
                log.warn("Failed to download issuer certificate from url={}: {}", url, e.getMessage());
                return Mono.empty();
            });
    }

    static X509CertificateHolder decode(byte[] body) throws IOException {
        final String text = new String(body, 0, Math.min(body.length, 64), StandardCharsets.US_ASCII);
        if (text.stripLeading().startsWith(PEM_PREFIX)) {
            try (PemReader pemReader = new PemReader(new StringReader(new String(body, StandardCharsets.US_ASCII)))) {
                final PemObject pemObject = pemReader.readPemObject();
                if (pemObject == null) {
                    throw new IOException("No PEM object found");
                }
                return Certificates.parse(pemObject.getContent());
            }
        }
        return Certificates.parse(body);
    }
}
