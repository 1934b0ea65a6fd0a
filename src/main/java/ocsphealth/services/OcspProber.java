package ocsphealth.services;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import ocsphealth.config.AppProperties;
import ocsphealth.model.Chain;
import ocsphealth.model.Location;
import ocsphealth.model.ProbeExchange;
import ocsphealth.model.ProbeOutcome;
import ocsphealth.model.ProbeOutcome.FailureLayer;
import ocsphealth.model.ProbeOutcome.ProbeOutcomeBuilder;
import ocsphealth.model.ProbeRequest;
import ocsphealth.model.Responder;
import ocsphealth.services.OcspRequestFactory.PreparedRequest;
import org.bouncycastle.cert.ocsp.OCSPException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Performs one live OCSP query of a responder from a location. Never errors: every failure is described by the
 * emitted outcome.
 */
@Service
@Slf4j
public class OcspProber {

    // the vantage point bounds the exchange itself, this only covers one that never answers
    private static final Duration UNANSWERED_GRACE = Duration.ofSeconds(1);

    private final OcspRequestFactory requestFactory;
    private final OcspResponseParser responseParser;
    private final VantagePointAccess vantagePointAccess;
    private final Clock clock;
    private final Duration probeTimeout;

    public OcspProber(OcspRequestFactory requestFactory,
        OcspResponseParser responseParser,
        VantagePointAccess vantagePointAccess,
        Clock clock,
        AppProperties appProperties
    ) {
        this.requestFactory = requestFactory;
        this.responseParser = responseParser;
        this.vantagePointAccess = vantagePointAccess;
        this.clock = clock;
        this.probeTimeout = appProperties.dispatch().probeTimeout();
    }

    public Mono<ProbeOutcome> probe(Location location, Responder responder, Chain chain) {
        return Mono.defer(() -> {
            final Instant retrieved = clock.instant();

            final PreparedRequest prepared;
            try {
                prepared = requestFactory.build(chain);
            } catch (OCSPException e) {
                log.debug("Unable to build request for responder={} from chain={}", responder.url(), chain.id(), e);
                return Mono.just(ProbeOutcome.failed(retrieved, FailureLayer.PROTOCOL,
                    "unable to build request: " + e.getMessage()));
            }

            log.debug("Probing responder={} from location={} with chain={}", responder.url(), location.id(),
                chain.id());
            return vantagePointAccess.execute(location,
                    new ProbeRequest(responder.url(), prepared.encoded(), probeTimeout)
                )
                .map(exchange -> interpret(retrieved, exchange, prepared))
                .timeout(probeTimeout.plus(vantagePointAccess.overhead(location)).plus(UNANSWERED_GRACE),
                    Mono.fromSupplier(() -> ProbeOutcome.failed(retrieved, FailureLayer.NETWORK, "timed out")))
                .onErrorResume(VantagePointException.class, e -> {
                    log.debug("Location={} could not probe responder={}: {}", location.id(), responder.url(),
                        e.getMessage());
                    return Mono.just(ProbeOutcome.failed(retrieved, FailureLayer.NETWORK,
                        "location unreachable: " + e.getMessage()));
                });
        });
    }

    private ProbeOutcome interpret(Instant retrieved, ProbeExchange exchange, PreparedRequest prepared) {
        if (exchange.pingLatency() == null) {
            return ProbeOutcome.failed(retrieved, FailureLayer.NETWORK,
                exchange.error() != null ? exchange.error() : "unreachable");
        }

        final ProbeOutcomeBuilder outcome = ProbeOutcome.builder()
            .retrieved(retrieved)
            .pingLatency(exchange.pingLatency())
            .httpStatus(exchange.httpStatus());

        final Integer status = exchange.httpStatus();
        if (status == null) {
            return outcome
                .failure(FailureLayer.HTTP)
                .detail(exchange.error() != null ? exchange.error() : "no HTTP response")
                .build();
        }
        if (status < 200 || status >= 300) {
            return outcome
                .failure(FailureLayer.HTTP)
                .detail("HTTP status " + status)
                .build();
        }
        if (!exchange.hasBody()) {
            return outcome
                .failure(FailureLayer.HTTP)
                .detail("empty body")
                .build();
        }

        return responseParser.parse(outcome.ocspLatency(exchange.ocspLatency()), exchange.body(), prepared);
    }
}
