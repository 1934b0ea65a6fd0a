package ocsphealth.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSObject;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.ECDSAVerifier;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.RSAKey;
import java.io.IOException;
import java.net.URI;
import java.text.ParseException;
import java.time.Duration;
import java.util.Base64;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import ocsphealth.messages.AgentProbeReport;
import ocsphealth.messages.AgentProbeRequest;
import ocsphealth.model.Location;
import ocsphealth.model.ProbeExchange;
import ocsphealth.model.ProbeRequest;
import org.jetbrains.annotations.NotNull;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

/**
 * Delegates probes to a remote agent and only accepts reports signed with the location's key.
 */
@Component
@Slf4j
public class AgentVantagePointAccess implements VantagePointAccess {

    public static final MediaType JOSE = MediaType.parseMediaType("application/jose");

    // allowance for the round trip to the agent on top of the probe's own budget
    private static final Duration AGENT_OVERHEAD = Duration.ofSeconds(5);

    private final WebClient webClient;
    private final VantagePointRegistry vantagePointRegistry;
    private final ObjectMapper objectMapper;

    public AgentVantagePointAccess(WebClient.Builder webClientBuilder, VantagePointRegistry vantagePointRegistry,
        ObjectMapper objectMapper
    ) {
        this.webClient = webClientBuilder
            .filter((request, next) -> {
                log.debug("Starting {} {}", request.method(), request.url());
                return next.exchange(request);
            })
            .build();
        this.vantagePointRegistry = vantagePointRegistry;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<ProbeExchange> execute(Location location, ProbeRequest request) {
        if (location.agentUrl() == null || location.agentKey() == null) {
            return Mono.error(new VantagePointException(location.id(), "no agent configured"));
        }

        final URI probeUri = probeUri(location.agentUrl());

        return webClient.post()
            .uri(probeUri)
            .headers(headers -> vantagePointRegistry.credentialFor(location).ifPresent(headers::setBearerAuth))
            .contentType(MediaType.APPLICATION_JSON)
            .accept(JOSE, MediaType.TEXT_PLAIN)
            .bodyValue(AgentProbeRequest.builder()
                .url(request.responderUrl().toString())
                .request(Base64.getEncoder().encodeToString(request.ocspRequest()))
                .timeoutMillis(request.timeout().toMillis())
                .build()
            )
            .retrieve()
            .bodyToMono(String.class)
            .timeout(request.timeout().plus(overhead(location)))
            .onErrorMap(e -> new VantagePointException(location.id(),
                "agent at %s unreachable: %s".formatted(probeUri, e.getMessage()), e))
            .switchIfEmpty(Mono.error(() -> new VantagePointException(location.id(), "agent returned no report")))
            .map(compact -> verify(location, request, compact));
    }

    @Override
    public Duration overhead(Location location) {
        return AGENT_OVERHEAD;
    }

    @NotNull
    private static URI probeUri(URI agentUrl) {
        return UriComponentsBuilder.fromUri(agentUrl)
            .path("/probe")
            .build()
            .toUri();
    }

    ProbeExchange verify(Location location, ProbeRequest request, String compact) {
        final JWK agentKey = Objects.requireNonNull(location.agentKey());
        try {
            final JWSObject jws = JWSObject.parse(compact.trim());
            if (agentKey.getKeyID() != null && !agentKey.getKeyID().equals(jws.getHeader().getKeyID())) {
                throw new VantagePointException(location.id(),
                    "report signed with unexpected kid=%s".formatted(jws.getHeader().getKeyID()));
            }
            if (!jws.verify(verifierFor(agentKey))) {
                throw new VantagePointException(location.id(), "report signature does not verify");
            }

            final AgentProbeReport report = objectMapper.readValue(jws.getPayload().toBytes(),
                AgentProbeReport.class);
            if (!request.responderUrl().toString().equals(report.url())) {
                throw new VantagePointException(location.id(),
                    "report is for url=%s instead of %s".formatted(report.url(), request.responderUrl()));
            }
            log.debug("Verified report from location={} for url={} status={}", location.id(), report.url(),
                report.httpStatus());
            return report.toExchange();

        } catch (ParseException | JOSEException | IOException | IllegalArgumentException e) {
            throw new VantagePointException(location.id(), "unusable report: " + e.getMessage(), e);
        }
    }

    private static JWSVerifier verifierFor(JWK key) throws JOSEException {
        if (key instanceof ECKey ecKey) {
            return new ECDSAVerifier(ecKey);
        } else if (key instanceof RSAKey rsaKey) {
            return new RSASSAVerifier(rsaKey);
        }
        throw new JOSEException("Unsupported agent key type " + key.getKeyType());
    }
}
