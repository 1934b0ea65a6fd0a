package ocsphealth.model;

import java.net.URI;
import java.time.Duration;

/**
 * @param responderUrl the OCSP endpoint to query
 * @param ocspRequest  DER encoded OCSP request
 * @param timeout      budget for the whole exchange
 */
public record ProbeRequest(
    URI responderUrl,
    byte[] ocspRequest,
    Duration timeout
) {

}
