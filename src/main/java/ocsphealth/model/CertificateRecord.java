package ocsphealth.model;

import java.net.URI;
import java.util.List;
import org.springframework.lang.Nullable;

/**
 * A certificate as returned by the certificate search API.
 *
 * @param raw        DER encoding of the certificate
 * @param issuerRaw  DER encoding of its issuer, when the API supplied it
 * @param issuerUrls caIssuers URLs from the certificate's Authority Information Access extension
 */
public record CertificateRecord(
    byte[] raw,
    @Nullable
    byte[] issuerRaw,
    List<URI> issuerUrls
) {

    public static CertificateRecord of(byte[] raw) {
        return new CertificateRecord(raw, null, List.of());
    }
}
