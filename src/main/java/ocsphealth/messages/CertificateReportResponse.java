package ocsphealth.messages;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CertificateReportResponse(
    String status,
    List<Bucket> results
) {

    /**
     * @param key      a value of the reported field
     * @param docCount number of matching certificates carrying that value
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Bucket(
        String key,
        @JsonProperty("doc_count")
        long docCount
    ) {

    }
}
