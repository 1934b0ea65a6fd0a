package ocsphealth.services;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import ocsphealth.config.AppProperties;
import ocsphealth.model.Classification;
import ocsphealth.model.HealthStatus;
import ocsphealth.model.Location;
import ocsphealth.model.ProbeOutcome;
import ocsphealth.model.Responder.ResponderKey;
import ocsphealth.model.ResponderBinding;
import ocsphealth.model.Result;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Fans probes out over every (responder, location) pair. Each pair yields exactly one result, no matter how its probe
 * ends.
 */
@Service
@Slf4j
public class ProbeDispatcher {

    static final String ABANDONED = "abandoned";

    private final OcspProber prober;
    private final HealthClassifier classifier;
    private final Clock clock;
    private final AppProperties.Dispatch dispatchProperties;

    private final ConcurrencyLimiter globalLimiter;
    private final Map<String/*location id*/, ConcurrencyLimiter> locationLimiters = new ConcurrentHashMap<>();
    private final Map<ResponderKey, ConcurrencyLimiter> responderLimiters = new ConcurrentHashMap<>();

    public ProbeDispatcher(OcspProber prober, HealthClassifier classifier, Clock clock, AppProperties appProperties) {
        this.prober = prober;
        this.classifier = classifier;
        this.clock = clock;
        this.dispatchProperties = appProperties.dispatch();
        this.globalLimiter = new ConcurrencyLimiter("global", dispatchProperties.globalConcurrency());
    }

    /**
     * @param cancellation completes when outstanding probes should be abandoned
     */
    public Flux<Result> dispatch(List<Location> locations, List<ResponderBinding> bindings, Mono<Void> cancellation) {
        final List<Job> jobs = new ArrayList<>(locations.size() * bindings.size());
        for (ResponderBinding binding : bindings) {
            for (Location location : locations) {
                jobs.add(new Job(location, binding));
            }
        }
        if (jobs.isEmpty()) {
            return Flux.empty();
        }
        log.debug("Dispatching probes={} over responders={} and locations={}", jobs.size(), bindings.size(),
            locations.size());

        final Mono<Void> cancelled = cancellation.onErrorResume(e -> Mono.empty());
        return Flux.fromIterable(jobs)
            // the limiters bound actual concurrency, every job needs to be in flight to be abandonable
            .flatMap(job -> run(job)
                    .or(cancelled.then(Mono.fromSupplier(() -> abandoned(job)))),
                jobs.size()
            );
    }

    private Mono<Result> run(Job job) {
        final ResponderBinding binding = job.binding();
        final Mono<Result> probe = prober.probe(job.location(), binding.responder(), binding.chain())
            .map(outcome -> toResult(job, outcome, classifier.classify(outcome)));

        return locationLimiter(job.location().id()).withPermit(
                responderLimiter(binding.responder().key()).withPermit(
                    globalLimiter.withPermit(probe)
                )
            )
            .onErrorResume(e -> {
                log.warn("Probe of responder={} from location={} failed unexpectedly",
                    binding.responder().url(), job.location().id(), e);
                return Mono.fromSupplier(() -> failed(job, "error: " + e.getMessage()));
            });
    }

    private ConcurrencyLimiter locationLimiter(String locationId) {
        return locationLimiters.computeIfAbsent(locationId,
            id -> new ConcurrencyLimiter("location " + id, dispatchProperties.perLocationConcurrency()));
    }

    private ConcurrencyLimiter responderLimiter(ResponderKey key) {
        return responderLimiters.computeIfAbsent(key,
            k -> new ConcurrencyLimiter("responder " + k.url(), dispatchProperties.perResponderConcurrency()));
    }

    private static Result toResult(Job job, ProbeOutcome outcome, Classification classification) {
        return Result.builder()
            .responder(job.binding().responder())
            .locationId(job.location().id())
            .chainId(job.binding().chain().id())
            .pingLatency(outcome.pingLatency())
            .ocspLatency(outcome.ocspLatency())
            .retrieved(outcome.retrieved())
            .status(classification.status())
            .reason(classification.reason())
            .build();
    }

    private Result abandoned(Job job) {
        log.debug("Abandoning probe of responder={} from location={}", job.binding().responder().url(),
            job.location().id());
        return failed(job, ABANDONED);
    }

    private Result failed(Job job, String reason) {
        return Result.builder()
            .responder(job.binding().responder())
            .locationId(job.location().id())
            .chainId(job.binding().chain().id())
            .retrieved(clock.instant())
            .status(HealthStatus.BAD)
            .reason(reason)
            .build();
    }

    private record Job(
        Location location,
        ResponderBinding binding
    ) {

    }
}
