package ocsphealth.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * @param degradedAuthorities authorities whose discovery could not be refreshed during the cycle
 * @param cancelled           whether the cycle was cancelled before all probes completed
 */
@Builder
public record CycleReport(
    Instant started,
    Instant finished,
    Map<HealthStatus, Long> statusCounts,
    List<String> degradedAuthorities,
    boolean cancelled
) {

    public long total() {
        return statusCounts.values().stream().mapToLong(Long::longValue).sum();
    }
}
