package ocsphealth.services;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import ocsphealth.TestProperties;
import ocsphealth.config.AppProperties.Sink;
import ocsphealth.model.HealthStatus;
import ocsphealth.model.Responder;
import ocsphealth.model.Result;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class ResultRecorderTest {

    private static final Result RESULT = Result.builder()
        .responder(Responder.builder()
            .url(URI.create("http://ocsp.recorder.test"))
            .authorityKeyId("0f")
            .discovered(Instant.parse("2024-01-01T00:00:00Z"))
            .build())
        .locationId("local")
        .chainId("c0ffee")
        .retrieved(Instant.parse("2024-01-02T00:00:00Z"))
        .status(HealthStatus.GOOD)
        .reason("ok")
        .build();

    @Test
    void retriesTransientFailures() {
        final AtomicInteger attempts = new AtomicInteger();
        final InMemoryResultStore store = new InMemoryResultStore();
        final ResultSink flakySink = result -> Mono.defer(() -> attempts.incrementAndGet() < 3 ?
            Mono.<Void>error(new IllegalStateException("database busy")) : store.append(result));
        final ResultRecorder recorder = new ResultRecorder(flakySink,
            TestProperties.withSink(new Sink(5, Duration.ofMillis(1))));

        StepVerifier.create(recorder.record(RESULT))
            .expectNext(true)
            .verifyComplete();

        assertThat(attempts).hasValue(3);
        assertThat(store.latest(RESULT.responder().key(), "local")).contains(RESULT);
        assertThat(recorder.backlogSize()).isZero();
    }

    @Test
    void keepsResultWhenRetriesAreExhausted() {
        final AtomicBoolean available = new AtomicBoolean(false);
        final AtomicInteger attempts = new AtomicInteger();
        final InMemoryResultStore store = new InMemoryResultStore();
        final ResultSink sink = result -> Mono.defer(() -> {
            attempts.incrementAndGet();
            return available.get() ? store.append(result) : Mono.<Void>error(
                new IllegalStateException("database down"));
        });
        final ResultRecorder recorder = new ResultRecorder(sink,
            TestProperties.withSink(new Sink(2, Duration.ofMillis(1))));

        StepVerifier.create(recorder.record(RESULT))
            .expectNext(false)
            .verifyComplete();
        assertThat(attempts).hasValue(2);
        assertThat(recorder.backlogSize()).isEqualTo(1);

        available.set(true);
        StepVerifier.create(recorder.redeliverBacklog())
            .expectNext(1L)
            .verifyComplete();

        assertThat(recorder.backlogSize()).isZero();
        assertThat(store.history(RESULT.responder().key(), "local")).containsExactly(RESULT);
    }

    @Test
    void emptyBacklogIsNoop() {
        final ResultRecorder recorder = new ResultRecorder(new InMemoryResultStore(), TestProperties.defaults());

        StepVerifier.create(recorder.redeliverBacklog())
            .expectNext(0L)
            .verifyComplete();
    }
}
