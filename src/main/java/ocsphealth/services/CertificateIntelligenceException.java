package ocsphealth.services;

import lombok.Getter;

@Getter
public class CertificateIntelligenceException extends RuntimeException {

    private final boolean rateLimited;

    public CertificateIntelligenceException(String message, boolean rateLimited, Throwable cause) {
        super(message, cause);
        this.rateLimited = rateLimited;
    }

    /**
     * @param subject what the call was about, such as an authority key id or a report field
     */
    public static CertificateIntelligenceException rateLimited(String subject, Throwable cause) {
        return new CertificateIntelligenceException(
            "Certificate intelligence call was rate limited for %s".formatted(subject), true, cause);
    }

    public static CertificateIntelligenceException transientFailure(String subject, Throwable cause) {
        return new CertificateIntelligenceException(
            "Certificate intelligence call failed for %s: %s".formatted(subject, cause.getMessage()), false,
            cause);
    }
}
