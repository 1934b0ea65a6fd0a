package ocsphealth.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import java.net.URI;

/**
 * @param name          display name of the vantage point
 * @param agentUrl      base URL of the remote probing agent; absent means probes run from this host
 * @param credentialRef name of the property or environment variable holding the agent's bearer token
 * @param publicJwk     JSON encoded public JWK the agent signs its reports with
 */
public record LocationProperties(
    @NotBlank
    String name,

    URI agentUrl,

    String credentialRef,

    String publicJwk
) {

    @AssertTrue(message = "remote locations need a public JWK to verify agent reports")
    public boolean isAgentVerifiable() {
        return agentUrl == null || (publicJwk != null && !publicJwk.isBlank());
    }
}
