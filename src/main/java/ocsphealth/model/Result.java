package ocsphealth.model;

import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import org.springframework.lang.Nullable;

/**
 * Immutable outcome of testing one responder from one location at one point in time.
 *
 * @param responder   the responder tested
 * @param locationId  the location the test ran from
 * @param chainId     the chain the OCSP request was built from
 * @param pingLatency network-only round trip, null when unreachable
 * @param ocspLatency OCSP request/response round trip, null when the exchange did not complete
 * @param retrieved   when the test ran
 * @param status      classified health
 * @param reason      diagnostic reason behind the status
 */
@Builder
public record Result(
    Responder responder,
    String locationId,
    String chainId,
    @Nullable
    Duration pingLatency,
    @Nullable
    Duration ocspLatency,
    Instant retrieved,
    HealthStatus status,
    String reason
) {

}
