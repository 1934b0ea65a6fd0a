package ocsphealth.model;

import java.util.List;

/**
 * @param records certificates of the retrieved pages
 * @param total   total number of certificates matching the query, across all pages
 */
public record CertificateSearch(
    List<CertificateRecord> records,
    long total
) {

}
