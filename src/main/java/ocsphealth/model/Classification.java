package ocsphealth.model;

public record Classification(
    HealthStatus status,
    String reason
) {

    public static Classification good() {
        return new Classification(HealthStatus.GOOD, "ok");
    }

    public static Classification questionable(String reason) {
        return new Classification(HealthStatus.QUESTIONABLE, reason);
    }

    public static Classification bad(String reason) {
        return new Classification(HealthStatus.BAD, reason);
    }
}
