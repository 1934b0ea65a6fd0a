package ocsphealth.messages;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CertificateSearchResponse(
    String status,
    List<Hit> results,
    Metadata metadata
) {

    /**
     * @param raw        base64 DER of the certificate
     * @param issuerUrls caIssuers URLs of the certificate
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Hit(
        String raw,
        @JsonProperty(CensysCertificateFields.ISSUER_URLS)
        List<String> issuerUrls
    ) {

    }

    /**
     * @param count total number of matching certificates
     * @param page  the page these results belong to
     * @param pages number of pages available
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Metadata(
        long count,
        int page,
        int pages
    ) {

    }
}
