package ocsphealth.services;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import ocsphealth.model.Authority;
import ocsphealth.model.LatestResult;
import ocsphealth.model.Location;
import ocsphealth.model.ResponderBinding;
import org.springframework.stereotype.Service;

/**
 * Read side consumed by dashboards: the latest state of every (responder, location) pair.
 */
@Service
public class HealthReportService {

    private final AuthorityRegistry authorityRegistry;
    private final DiscoveryCacheService discoveryCacheService;
    private final VantagePointRegistry vantagePointRegistry;
    private final ResultHistory resultHistory;

    public HealthReportService(AuthorityRegistry authorityRegistry,
        DiscoveryCacheService discoveryCacheService,
        VantagePointRegistry vantagePointRegistry,
        ResultHistory resultHistory
    ) {
        this.authorityRegistry = authorityRegistry;
        this.discoveryCacheService = discoveryCacheService;
        this.vantagePointRegistry = vantagePointRegistry;
        this.resultHistory = resultHistory;
    }

    /**
     * @param authorityKeyIds authorities to report on, unknown ones are ignored
     * @return one entry per known responder and location, with a null result for pairs never tested. Ordered by
     * authority cardinality (largest first), authority name, responder URL and location name.
     */
    public List<LatestResult> latestResults(Set<String> authorityKeyIds) {
        final List<Location> locations = vantagePointRegistry.all();
        final List<LatestResult> latest = new ArrayList<>();

        for (Authority authority : authorityRegistry.all()) {
            if (!authorityKeyIds.contains(authority.keyId())) {
                continue;
            }
            final List<ResponderBinding> bindings = discoveryCacheService.knownBindings(authority.keyId()).stream()
                .sorted(Comparator.comparing(binding -> binding.responder().url()))
                .toList();
            for (ResponderBinding binding : bindings) {
                for (Location location : locations) {
                    latest.add(new LatestResult(authority, binding.responder(), location,
                        resultHistory.latest(binding.responder().key(), location.id()).orElse(null)
                    ));
                }
            }
        }
        return latest;
    }
}
