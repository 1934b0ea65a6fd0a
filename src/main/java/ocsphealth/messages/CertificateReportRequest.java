package ocsphealth.messages;

import lombok.Builder;

/**
 * @param field   the certificate field whose values are counted
 * @param buckets number of most frequent values to return
 */
@Builder
public record CertificateReportRequest(
    String query,
    String field,
    int buckets
) {

}
