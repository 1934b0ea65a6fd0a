package ocsphealth.services;

import java.io.Closeable;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import ocsphealth.config.AppProperties;
import ocsphealth.model.Authority;
import ocsphealth.model.CycleReport;
import ocsphealth.model.DiscoverySnapshot;
import ocsphealth.model.HealthStatus;
import ocsphealth.model.Location;
import ocsphealth.model.ResponderBinding;
import ocsphealth.model.Result;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Runs health check cycles: discovery of every tracked authority (configured, or else ranked), probing of every responder from every location and
 * recording of the results.
 */
@Service
@Slf4j
public class HealthCheckService implements Closeable {

    private final AppProperties appProperties;
    private final AuthorityRegistry authorityRegistry;
    private final AuthorityRankingService authorityRankingService;
    private final DiscoveryCacheService discoveryCacheService;
    private final VantagePointRegistry vantagePointRegistry;
    private final ProbeDispatcher probeDispatcher;
    private final ResultRecorder resultRecorder;
    private final Clock clock;

    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicReference<Sinks.Empty<Void>> activeCycle = new AtomicReference<>();

    public HealthCheckService(AppProperties appProperties,
        AuthorityRegistry authorityRegistry,
        AuthorityRankingService authorityRankingService,
        DiscoveryCacheService discoveryCacheService,
        VantagePointRegistry vantagePointRegistry,
        ProbeDispatcher probeDispatcher,
        ResultRecorder resultRecorder,
        Clock clock
    ) {
        this.appProperties = appProperties;
        this.authorityRegistry = authorityRegistry;
        this.authorityRankingService = authorityRankingService;
        this.discoveryCacheService = discoveryCacheService;
        this.vantagePointRegistry = vantagePointRegistry;
        this.probeDispatcher = probeDispatcher;
        this.resultRecorder = resultRecorder;
        this.clock = clock;
    }

    /**
     * @return the report of the cycle, or empty if a cycle is already running
     */
    public Mono<CycleReport> runCycle() {
        return Mono.defer(() -> {
            if (closed.get()) {
                return Mono.error(new IllegalStateException("Health checks have been shut down"));
            }
            final Sinks.Empty<Void> cancellation = Sinks.empty();
            if (!activeCycle.compareAndSet(null, cancellation)) {
                log.info("Skipping health check cycle since one is still running");
                return Mono.empty();
            }

            final Instant started = clock.instant();
            final AtomicBoolean cancelled = new AtomicBoolean();
            log.info("Starting health check cycle");

            return resultRecorder.redeliverBacklog()
                .then(trackedAuthorities())
                .flatMapMany(Flux::fromIterable)
                .concatMap(discoveryCacheService::getOrRefresh)
                .collectList()
                .flatMap(snapshots -> probe(snapshots, cancellation, cancelled)
                    .map(statusCounts -> CycleReport.builder()
                        .started(started)
                        .finished(clock.instant())
                        .statusCounts(statusCounts)
                        .degradedAuthorities(snapshots.stream()
                            .filter(DiscoverySnapshot::degraded)
                            .map(DiscoverySnapshot::authorityKeyId)
                            .toList())
                        .cancelled(cancelled.get())
                        .build()
                    )
                )
                .doOnNext(report -> log.info("Finished health check cycle total={} statusCounts={} degraded={}"
                        + " cancelled={}", report.total(), report.statusCounts(), report.degradedAuthorities(),
                    report.cancelled()
                ))
                .doFinally(signalType -> activeCycle.compareAndSet(cancellation, null));
        });
    }

    private Mono<Map<HealthStatus, Long>> probe(List<DiscoverySnapshot> snapshots, Sinks.Empty<Void> cancellation,
        AtomicBoolean cancelled
    ) {
        final List<ResponderBinding> bindings = snapshots.stream()
            .flatMap(snapshot -> snapshot.bindings().stream())
            .toList();
        final List<Location> locations = vantagePointRegistry.all();

        return probeDispatcher.dispatch(locations, bindings,
                cancellation.asMono().doOnSuccess(unused -> cancelled.set(true))
            )
            .concatMap(result -> resultRecorder.record(result).thenReturn(result))
            .collect(() -> new EnumMap<>(HealthStatus.class),
                (Map<HealthStatus, Long> counts, Result result) -> counts.merge(result.status(), 1L, Long::sum));
    }

    private Mono<List<Authority>> trackedAuthorities() {
        if (appProperties.authorities().isEmpty()) {
            return authorityRankingService.topAuthorities();
        }
        return Mono.fromSupplier(() -> appProperties.authorities().stream()
            .map(tracked -> authorityRegistry.ensure(tracked.keyId(), tracked.name()))
            .toList()
        );
    }

    public boolean isRunning() {
        return activeCycle.get() != null;
    }

    /**
     * Abandons the probes of the running cycle, if any.
     */
    public void cancel() {
        final Sinks.Empty<Void> cancellation = activeCycle.get();
        if (cancellation != null) {
            log.info("Cancelling running health check cycle");
            cancellation.tryEmitEmpty();
        }
    }

    @Override
    public void close() {
        closed.set(true);
        cancel();
    }
}
