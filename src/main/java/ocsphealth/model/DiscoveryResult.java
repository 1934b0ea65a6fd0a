package ocsphealth.model;

import java.net.URI;
import java.util.Set;

/**
 * @param endpoints        responder URLs with the chains that revealed them, unique by (url, chain id)
 * @param certificateTotal number of certificates the search reported for the authority
 * @param malformed        certificates that could not be parsed
 * @param skipped          certificates that parsed but could not contribute an endpoint
 */
public record DiscoveryResult(
    Set<Endpoint> endpoints,
    long certificateTotal,
    int malformed,
    int skipped
) {

    public record Endpoint(
        URI url,
        Chain chain
    ) {

    }
}
