package ocsphealth.services;

import java.time.Duration;
import ocsphealth.model.Location;
import ocsphealth.model.ProbeExchange;
import ocsphealth.model.ProbeRequest;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Runs probes locally or through the location's agent, depending on how the location is configured.
 */
@Component
@Primary
public class RoutingVantagePointAccess implements VantagePointAccess {

    private final LocalVantagePointAccess localAccess;
    private final AgentVantagePointAccess agentAccess;

    public RoutingVantagePointAccess(LocalVantagePointAccess localAccess, AgentVantagePointAccess agentAccess) {
        this.localAccess = localAccess;
        this.agentAccess = agentAccess;
    }

    @Override
    public Mono<ProbeExchange> execute(Location location, ProbeRequest request) {
        return location.isLocal() ? localAccess.execute(location, request) : agentAccess.execute(location, request);
    }

    @Override
    public Duration overhead(Location location) {
        return location.isLocal() ? localAccess.overhead(location) : agentAccess.overhead(location);
    }
}
