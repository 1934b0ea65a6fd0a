package ocsphealth.services;

import java.time.Duration;
import ocsphealth.model.Location;
import ocsphealth.model.ProbeExchange;
import ocsphealth.model.ProbeRequest;
import reactor.core.publisher.Mono;

/**
 * Executes the reachability check and OCSP POST from a vantage point.
 */
public interface VantagePointAccess {

    /**
     * @return the observed exchange; failures of the responder are described in the exchange while failures of the
     * vantage point itself error with {@link VantagePointException}
     */
    Mono<ProbeExchange> execute(Location location, ProbeRequest request);

    /**
     * @return time the vantage point may take beyond the request's own timeout before answering, such as the round
     * trip to a remote agent
     */
    default Duration overhead(Location location) {
        return Duration.ZERO;
    }
}
