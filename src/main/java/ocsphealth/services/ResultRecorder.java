package ocsphealth.services;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import lombok.extern.slf4j.Slf4j;
import ocsphealth.config.AppProperties;
import ocsphealth.model.Result;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Appends results to the sink with retries. Results that still cannot be appended are kept and offered again by
 * {@link #redeliverBacklog()}.
 */
@Service
@Slf4j
public class ResultRecorder {

    private final ResultSink resultSink;
    private final AppProperties.Sink sinkProperties;
    private final Queue<Result> backlog = new ConcurrentLinkedQueue<>();

    public ResultRecorder(ResultSink resultSink, AppProperties appProperties) {
        this.resultSink = resultSink;
        this.sinkProperties = appProperties.sink();
    }

    /**
     * @return true if the result was appended, false if it went to the backlog
     */
    public Mono<Boolean> record(Result result) {
        return Mono.defer(() -> resultSink.append(result))
            .retryWhen(Retry.backoff(sinkProperties.maxAttempts() - 1, sinkProperties.backoff())
                .doBeforeRetry(signal ->
                    log.warn("Retrying append of result for responder={} location={} attempt={}: {}",
                        result.responder().url(), result.locationId(), signal.totalRetries() + 2,
                        signal.failure().getMessage()
                    ))
            )
            .thenReturn(true)
            .onErrorResume(e -> {
                final ResultPersistenceException alert = new ResultPersistenceException(result, e);
                log.error("ALERT result sink unavailable, keeping result for redelivery", alert);
                backlog.add(result);
                return Mono.just(false);
            });
    }

    /**
     * @return the number of backlogged results that were appended this time
     */
    public Mono<Long> redeliverBacklog() {
        return Mono.defer(() -> {
            final List<Result> pending = new ArrayList<>();
            Result next;
            while ((next = backlog.poll()) != null) {
                pending.add(next);
            }
            if (pending.isEmpty()) {
                return Mono.just(0L);
            }
            log.info("Redelivering backlogged results={}", pending.size());
            return Flux.fromIterable(pending)
                .concatMap(this::record)
                .filter(Boolean::booleanValue)
                .count();
        });
    }

    public int backlogSize() {
        return backlog.size();
    }
}
