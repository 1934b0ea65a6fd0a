package ocsphealth.services;

import lombok.Getter;
import ocsphealth.model.Result;

@Getter
public class ResultPersistenceException extends RuntimeException {

    private final Result result;

    public ResultPersistenceException(Result result, Throwable cause) {
        super("Unable to persist result of responder=%s location=%s retrieved=%s".formatted(
            result.responder().url(), result.locationId(), result.retrieved()), cause);
        this.result = result;
    }
}
