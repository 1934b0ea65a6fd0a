package ocsphealth.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * @param authorities root authorities whose OCSP responders are tracked, ranked through the search API when empty
 * @param locations   vantage points keyed by location id
 * @param discovery   freshness and paging of responder discovery
 * @param censys      access to the certificate search API used for discovery
 * @param dispatch    concurrency ceilings and scheduling of probe cycles
 * @param probe       settings of a single OCSP probe
 * @param classifier  tolerances applied when classifying a signed response
 * @param sink        retry policy when appending results
 */
@ConfigurationProperties("ocsp-health")
@Validated
public record AppProperties(
    @DefaultValue
    List<@Valid TrackedAuthority> authorities,

    @DefaultValue
    Map<String, @Valid LocationProperties> locations,

    @DefaultValue
    Discovery discovery,

    @DefaultValue
    Censys censys,

    @DefaultValue
    Dispatch dispatch,

    @DefaultValue
    Probe probe,

    @DefaultValue
    Classifier classifier,

    @DefaultValue
    Sink sink
) {

    /**
     * @param keyId hex encoded authority key identifier of the root
     * @param name  display name
     */
    public record TrackedAuthority(
        @NotBlank
        String keyId,

        @NotBlank
        String name
    ) {

    }

    /**
     * @param ttl                discovery older than this is re-validated against the search API
     * @param maxPages           upper bound of result pages requested per search
     * @param issuerFetchTimeout allowed time to download an issuer certificate from its AIA URL
     * @param topAuthorities     how many authorities are ranked and tracked when none are configured
     */
    public record Discovery(
        @DefaultValue("7d") @NotNull
        Duration ttl,

        @DefaultValue("2") @Min(1)
        int maxPages,

        @DefaultValue("10s") @NotNull
        Duration issuerFetchTimeout,

        @DefaultValue("10") @Min(1)
        int topAuthorities
    ) {

    }

    /**
     * @param minInterval rate limiter period, each period allows one call into the search API
     */
    public record Censys(
        @DefaultValue("https://search.censys.io/api/v1") @NotNull
        URI baseUrl,

        String apiId,

        String apiSecret,

        @DefaultValue("5s") @NotNull
        Duration minInterval,

        @DefaultValue("30s") @NotNull
        Duration responseTimeout
    ) {

    }

    /**
     * @param schedulingEnabled whether cycles are triggered periodically, otherwise only on demand
     */
    public record Dispatch(
        @DefaultValue("4") @Min(1)
        int perLocationConcurrency,

        @DefaultValue("2") @Min(1)
        int perResponderConcurrency,

        @DefaultValue("16") @Min(1)
        int globalConcurrency,

        @DefaultValue("20s") @NotNull
        Duration probeTimeout,

        @DefaultValue("1h") @NotNull
        Duration cycleInterval,

        @DefaultValue("30s") @NotNull
        Duration initialDelay,

        @DefaultValue("true")
        boolean schedulingEnabled
    ) {

    }

    /**
     * @param connectTimeout allowed time for the bare TCP reachability check
     * @param includeNonce   adds a nonce extension to requests, which some responders reject
     */
    public record Probe(
        @DefaultValue("5s") @NotNull
        Duration connectTimeout,

        @DefaultValue("false")
        boolean includeNonce,

        @DefaultValue("ocsp-health/0.1") @NotBlank
        String userAgent
    ) {

    }

    /**
     * @param nextUpdateGrace how far past its nextUpdate a response may be before it is considered stale
     * @param clockSkew       how far in the future a thisUpdate may be before it is considered suspicious
     */
    public record Classifier(
        @DefaultValue("0s") @NotNull
        Duration nextUpdateGrace,

        @DefaultValue("5m") @NotNull
        Duration clockSkew
    ) {

    }

    /**
     * @param maxAttempts appends tried per result, including the first one
     */
    public record Sink(
        @DefaultValue("5") @Min(1)
        long maxAttempts,

        @DefaultValue("500ms") @NotNull
        Duration backoff
    ) {

    }
}
