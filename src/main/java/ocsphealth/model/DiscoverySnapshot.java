package ocsphealth.model;

import java.time.Instant;
import java.util.List;
import org.springframework.lang.Nullable;

/**
 * @param authorityKeyId the authority the bindings belong to
 * @param bindings       every responder known for the authority with the chain to test it with
 * @param refreshedAt    when discovery last succeeded, null if it never did
 * @param degraded       true when the latest refresh attempt failed and possibly stale data is served
 */
public record DiscoverySnapshot(
    String authorityKeyId,
    List<ResponderBinding> bindings,
    @Nullable
    Instant refreshedAt,
    boolean degraded
) {

}
