package ocsphealth.model;

import lombok.Builder;

/**
 * @param keyId       hex encoded authority key identifier, stable across renames
 * @param name        display name
 * @param cardinality estimated number of certificates chaining to this authority, as last reported by the search API
 */
@Builder(toBuilder = true)
public record Authority(
    String keyId,
    String name,
    long cardinality
) {

    public Authority withCardinality(long cardinality) {
        return toBuilder().cardinality(cardinality).build();
    }
}
