package ocsphealth.model;

import java.time.Duration;
import lombok.Builder;
import org.springframework.lang.Nullable;

/**
 * What a vantage point observed while querying a responder, before any OCSP interpretation.
 *
 * @param pingLatency time to establish a TCP connection to the responder, null when it could not be reached
 * @param httpStatus  status of the OCSP POST, null when no HTTP response arrived
 * @param ocspLatency duration of the OCSP POST until the body was read
 * @param body        response body, possibly empty
 * @param error       what went wrong when the exchange did not complete
 */
@Builder
public record ProbeExchange(
    @Nullable
    Duration pingLatency,
    @Nullable
    Integer httpStatus,
    @Nullable
    Duration ocspLatency,
    @Nullable
    byte[] body,
    @Nullable
    String error
) {

    public static ProbeExchange unreachable(String error) {
        return ProbeExchange.builder()
            .error(error)
            .build();
    }

    public boolean hasBody() {
        return body != null && body.length > 0;
    }
}
