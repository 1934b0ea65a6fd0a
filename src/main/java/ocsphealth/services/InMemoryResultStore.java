package ocsphealth.services;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import ocsphealth.model.Responder.ResponderKey;
import ocsphealth.model.Result;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
public class InMemoryResultStore implements ResultSink, ResultHistory {

    private static final Comparator<Result> BY_RETRIEVED = Comparator.comparing(Result::retrieved);

    private final Map<PairKey, List<Result>> results = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> append(Result result) {
        return Mono.fromRunnable(() ->
            results.compute(new PairKey(result.responder().key(), result.locationId()), (key, existing) -> {
                final List<Result> updated = existing != null ? new ArrayList<>(existing) : new ArrayList<>();
                // results can arrive out of order, keep the list sorted by retrieval
                int index = updated.size();
                while (index > 0 && BY_RETRIEVED.compare(updated.get(index - 1), result) > 0) {
                    index--;
                }
                updated.add(index, result);
                return List.copyOf(updated);
            })
        );
    }

    @Override
    public Optional<Result> latest(ResponderKey responder, String locationId) {
        final List<Result> pairResults = results.get(new PairKey(responder, locationId));
        return pairResults == null || pairResults.isEmpty() ?
            Optional.empty() : Optional.of(pairResults.get(pairResults.size() - 1));
    }

    @Override
    public List<Result> history(ResponderKey responder, String locationId) {
        return results.getOrDefault(new PairKey(responder, locationId), List.of());
    }

    private record PairKey(
        ResponderKey responder,
        String locationId
    ) {

    }
}
