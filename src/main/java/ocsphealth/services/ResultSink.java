package ocsphealth.services;

import ocsphealth.model.Result;
import reactor.core.publisher.Mono;

/**
 * Append-only destination of results.
 */
public interface ResultSink {

    Mono<Void> append(Result result);
}
