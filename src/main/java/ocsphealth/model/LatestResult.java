package ocsphealth.model;

import org.springframework.lang.Nullable;

/**
 * @param result most recent result of the pair, null if never tested
 */
public record LatestResult(
    Authority authority,
    Responder responder,
    Location location,
    @Nullable
    Result result
) {

}
