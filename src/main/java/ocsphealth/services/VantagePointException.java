package ocsphealth.services;

import lombok.Getter;

/**
 * The vantage point itself could not execute a probe or its report could not be trusted.
 */
@Getter
public class VantagePointException extends RuntimeException {

    private final String locationId;

    public VantagePointException(String locationId, String message) {
        super("Location %s: %s".formatted(locationId, message));
        this.locationId = locationId;
    }

    public VantagePointException(String locationId, String message, Throwable cause) {
        super("Location %s: %s".formatted(locationId, message), cause);
        this.locationId = locationId;
    }
}
