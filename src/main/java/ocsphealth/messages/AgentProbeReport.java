package ocsphealth.messages;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;
import java.util.Base64;
import ocsphealth.model.ProbeExchange;

/**
 * Payload of the signed report a remote agent returns for a {@link AgentProbeRequest}.
 *
 * @param url        echo of the queried endpoint
 * @param pingMillis TCP connect latency, absent when the responder was unreachable
 * @param httpStatus status of the OCSP POST, absent when no response arrived
 * @param ocspMillis latency of the OCSP POST
 * @param body       base64 encoded response body
 * @param error      what went wrong, when the exchange did not complete
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentProbeReport(
    String url,
    Long pingMillis,
    Integer httpStatus,
    Long ocspMillis,
    String body,
    String error
) {

    /**
     * @throws IllegalArgumentException if the body is not valid base64
     */
    public ProbeExchange toExchange() {
        return ProbeExchange.builder()
            .pingLatency(pingMillis != null ? Duration.ofMillis(pingMillis) : null)
            .httpStatus(httpStatus)
            .ocspLatency(ocspMillis != null ? Duration.ofMillis(ocspMillis) : null)
            .body(body != null ? Base64.getDecoder().decode(body) : null)
            .error(error)
            .build();
    }
}
