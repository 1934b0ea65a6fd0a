package ocsphealth.services;

import java.util.List;
import java.util.Optional;
import ocsphealth.model.Responder.ResponderKey;
import ocsphealth.model.Result;

public interface ResultHistory {

    Optional<Result> latest(ResponderKey responder, String locationId);

    /**
     * @return results of the pair ordered by retrieval time, oldest first
     */
    List<Result> history(ResponderKey responder, String locationId);
}
