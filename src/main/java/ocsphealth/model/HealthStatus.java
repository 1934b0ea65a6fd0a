package ocsphealth.model;

public enum HealthStatus {
    GOOD,
    QUESTIONABLE,
    BAD
}
