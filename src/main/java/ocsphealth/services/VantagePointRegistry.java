package ocsphealth.services;

import com.nimbusds.jose.jwk.JWK;
import java.text.ParseException;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import ocsphealth.config.AppProperties;
import ocsphealth.config.LocationProperties;
import ocsphealth.model.Location;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

/**
 * The operator-managed vantage points probes are executed from.
 */
@Service
@Slf4j
public class VantagePointRegistry {

    private final Environment environment;
    private final Map<String/*location id*/, Location> locations;

    public VantagePointRegistry(AppProperties appProperties, Environment environment) {
        this.environment = environment;
        this.locations = new LinkedHashMap<>();
        appProperties.locations().forEach((id, properties) -> locations.put(id, toLocation(id, properties)));
        log.info("Loaded locations={}", locations.values());
    }

    private static Location toLocation(String id, LocationProperties properties) {
        final JWK agentKey;
        if (properties.publicJwk() != null && !properties.publicJwk().isBlank()) {
            try {
                agentKey = JWK.parse(properties.publicJwk());
            } catch (ParseException e) {
                throw new IllegalStateException("Public JWK of location %s is not valid".formatted(id), e);
            }
            if (agentKey.isPrivate()) {
                throw new IllegalStateException("Location %s must be configured with a public JWK only".formatted(id));
            }
        } else {
            agentKey = null;
        }

        return Location.builder()
            .id(id)
            .name(properties.name())
            .agentUrl(properties.agentUrl())
            .credentialRef(properties.credentialRef())
            .agentKey(agentKey)
            .build();
    }

    public Optional<Location> find(String id) {
        return Optional.ofNullable(locations.get(id));
    }

    /**
     * @return all locations ordered by name
     */
    public List<Location> all() {
        return locations.values().stream()
            .sorted(Comparator.comparing(Location::name).thenComparing(Location::id))
            .toList();
    }

    /**
     * @return the bearer token referenced by the location, empty when it has none or the reference does not resolve
     */
    public Optional<String> credentialFor(Location location) {
        if (location.credentialRef() == null) {
            return Optional.empty();
        }
        final String credential = environment.getProperty(location.credentialRef());
        if (credential == null) {
            log.warn("Credential reference={} of location={} does not resolve", location.credentialRef(),
                location.id());
        }
        return Optional.ofNullable(credential);
    }
}
