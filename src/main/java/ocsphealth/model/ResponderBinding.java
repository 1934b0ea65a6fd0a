package ocsphealth.model;

/**
 * A responder together with the chain it is currently tested with.
 */
public record ResponderBinding(
    Responder responder,
    Chain chain
) {

}
