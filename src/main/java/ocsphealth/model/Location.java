package ocsphealth.model;

import com.nimbusds.jose.jwk.JWK;
import java.net.URI;
import lombok.Builder;
import org.springframework.lang.Nullable;

/**
 * @param id            stable identifier of the vantage point
 * @param name          display name
 * @param agentUrl      remote agent executing the probes, null when probes run from this host
 * @param credentialRef reference to the agent's bearer token
 * @param agentKey      public key verifying the agent's signed reports
 */
@Builder
public record Location(
    String id,
    String name,
    @Nullable
    URI agentUrl,
    @Nullable
    String credentialRef,
    @Nullable
    JWK agentKey
) {

    public boolean isLocal() {
        return agentUrl == null;
    }

    @Override
    public String toString() {
        return "Location[id=%s, name=%s, agentUrl=%s]".formatted(id, name, agentUrl);
    }
}
