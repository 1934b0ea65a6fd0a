package ocsphealth.messages;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import lombok.Builder;

/**
 * Job handed to a remote probing agent.
 *
 * @param url           the OCSP endpoint the agent should query
 * @param request       base64 encoded DER OCSP request to POST
 * @param timeoutMillis budget the agent has for the whole exchange
 */
@Builder
@JsonInclude(Include.NON_NULL)
public record AgentProbeRequest(
    String url,
    String request,
    long timeoutMillis
) {

}
