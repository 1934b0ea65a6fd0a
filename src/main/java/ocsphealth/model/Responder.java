package ocsphealth.model;

import java.net.URI;
import java.time.Instant;
import lombok.Builder;

/**
 * @param url            the OCSP endpoint
 * @param authorityKeyId the authority owning this endpoint
 * @param discovered     when the endpoint was first seen
 * @param current        whether a currently valid certificate found by the latest discovery advertises the endpoint
 */
@Builder(toBuilder = true)
public record Responder(
    URI url,
    String authorityKeyId,
    Instant discovered,
    boolean current
) {

    public Responder withCurrent(boolean current) {
        return current == this.current ? this : toBuilder().current(current).build();
    }

    public ResponderKey key() {
        return new ResponderKey(authorityKeyId, url);
    }

    public record ResponderKey(
        String authorityKeyId,
        URI url
    ) {

    }
}
