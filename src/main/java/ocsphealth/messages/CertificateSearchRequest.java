package ocsphealth.messages;

import java.util.List;
import lombok.Builder;

/**
 * @param flatten return field values keyed by their dotted path
 */
@Builder
public record CertificateSearchRequest(
    String query,
    int page,
    List<String> fields,
    boolean flatten
) {

}
