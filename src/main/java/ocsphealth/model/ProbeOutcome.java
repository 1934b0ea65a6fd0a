package ocsphealth.model;

import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import org.springframework.lang.Nullable;

/**
 * The raw result of probing one responder from one location, before classification.
 *
 * @param retrieved          when the probe was started
 * @param failure            the layer the probe failed at, {@link FailureLayer#NONE} when a signed response was parsed
 * @param pingLatency        bare network round trip, null when the responder host was not reachable
 * @param ocspLatency        full OCSP request/response cycle, null when no response body was received
 * @param httpStatus         status code of the OCSP exchange, when one completed
 * @param certStatus         certificate status asserted by the responder
 * @param signatureValid     whether the response signature verifies against the issuer or an embedded certificate
 *                           that the issuer signed
 * @param responderMatches   whether the signing responder is the expected issuer or authorized by it
 * @param thisUpdate         thisUpdate of the matching single response
 * @param nextUpdate         nextUpdate of the matching single response, absent when the responder always has newer
 *                           information
 * @param detail             diagnostic sub-reason of a failure
 */
@Builder(toBuilder = true)
public record ProbeOutcome(
    Instant retrieved,
    FailureLayer failure,
    @Nullable
    Duration pingLatency,
    @Nullable
    Duration ocspLatency,
    @Nullable
    Integer httpStatus,
    @Nullable
    CertStatus certStatus,
    boolean signatureValid,
    boolean responderMatches,
    @Nullable
    Instant thisUpdate,
    @Nullable
    Instant nextUpdate,
    @Nullable
    String detail
) {

    public enum FailureLayer {
        NONE,
        /**
         * Responder host or the vantage point itself could not be reached
         */
        NETWORK,
        /**
         * Non-2xx status, HTTP timeout or missing body
         */
        HTTP,
        /**
         * A response arrived but is not a usable OCSP structure or its signature does not verify
         */
        PROTOCOL
    }

    public enum CertStatus {
        GOOD,
        REVOKED,
        UNKNOWN
    }

    public static ProbeOutcome failed(Instant retrieved, FailureLayer layer, String detail) {
        return ProbeOutcome.builder()
            .retrieved(retrieved)
            .failure(layer)
            .detail(detail)
            .build();
    }

    public boolean reachable() {
        return pingLatency != null;
    }
}
