package ocsphealth.services;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import ocsphealth.config.AppProperties;
import ocsphealth.model.Classification;
import ocsphealth.model.ProbeOutcome;
import ocsphealth.model.ProbeOutcome.CertStatus;
import ocsphealth.model.ProbeOutcome.FailureLayer;
import org.springframework.stereotype.Component;

/**
 * Reduces a probe outcome to a health status. The first matching rule wins and BAD rules are checked first, so an
 * outcome is never classified better than its worst observation.
 */
@Component
public class HealthClassifier {

    private final Duration nextUpdateGrace;
    private final Duration clockSkew;

    public HealthClassifier(AppProperties appProperties) {
        this.nextUpdateGrace = appProperties.classifier().nextUpdateGrace();
        this.clockSkew = appProperties.classifier().clockSkew();
    }

    public Classification classify(ProbeOutcome outcome) {
        final FailureLayer failure = outcome.failure() != null ? outcome.failure() : FailureLayer.PROTOCOL;
        if (failure != FailureLayer.NONE) {
            return Classification.bad("%s: %s".formatted(failure.name().toLowerCase(Locale.ROOT),
                outcome.detail() != null ? outcome.detail() : "failed"));
        }
        if (!outcome.signatureValid()) {
            return Classification.bad("protocol: signature does not verify");
        }
        if (outcome.certStatus() == null) {
            return Classification.bad("protocol: no certificate status");
        }
        if (outcome.certStatus() == CertStatus.REVOKED) {
            return Classification.bad("certificate reported revoked");
        }
        if (outcome.certStatus() == CertStatus.UNKNOWN) {
            return Classification.bad("certificate reported unknown");
        }

        final Instant retrieved = outcome.retrieved();
        if (retrieved == null) {
            return Classification.bad("protocol: retrieval time missing");
        }
        if (outcome.nextUpdate() != null && outcome.nextUpdate().plus(nextUpdateGrace).isBefore(retrieved)) {
            return Classification.questionable("stale: nextUpdate %s passed".formatted(outcome.nextUpdate()));
        }
        if (outcome.thisUpdate() != null && outcome.thisUpdate().isAfter(retrieved.plus(clockSkew))) {
            return Classification.questionable("thisUpdate %s is in the future".formatted(outcome.thisUpdate()));
        }
        if (!outcome.responderMatches()) {
            return Classification.questionable("responder not authorized by issuer");
        }
        return Classification.good();
    }
}
