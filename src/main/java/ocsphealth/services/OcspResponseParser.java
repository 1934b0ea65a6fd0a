package ocsphealth.services;

import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import ocsphealth.model.ProbeOutcome;
import ocsphealth.model.ProbeOutcome.CertStatus;
import ocsphealth.model.ProbeOutcome.FailureLayer;
import ocsphealth.model.ProbeOutcome.ProbeOutcomeBuilder;
import ocsphealth.services.OcspRequestFactory.PreparedRequest;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.ocsp.BasicOCSPResp;
import org.bouncycastle.cert.ocsp.CertificateStatus;
import org.bouncycastle.cert.ocsp.OCSPException;
import org.bouncycastle.cert.ocsp.OCSPResp;
import org.bouncycastle.cert.ocsp.RespID;
import org.bouncycastle.cert.ocsp.RevokedStatus;
import org.bouncycastle.cert.ocsp.SingleResp;
import org.bouncycastle.operator.OperatorCreationException;
import org.springframework.stereotype.Component;

/**
 * Reads an OCSP response body and checks who signed it.
 */
@Component
@Slf4j
public class OcspResponseParser {

    private final OcspRequestFactory requestFactory;

    public OcspResponseParser(OcspRequestFactory requestFactory) {
        this.requestFactory = requestFactory;
    }

    /**
     * @param outcome pre-populated with what is known about the exchange
     * @return the completed outcome, with {@link FailureLayer#PROTOCOL} when the body is unusable
     */
    public ProbeOutcome parse(ProbeOutcomeBuilder outcome, byte[] body, PreparedRequest request) {
        final OCSPResp response;
        try {
            response = new OCSPResp(body);
        } catch (IOException | IllegalArgumentException | ClassCastException e) {
            return protocolFailure(outcome, "not an OCSP response");
        }

        if (response.getStatus() != OCSPResp.SUCCESSFUL) {
            return protocolFailure(outcome, "response status " + statusName(response.getStatus()));
        }

        final BasicOCSPResp basic;
        try {
            if (!(response.getResponseObject() instanceof BasicOCSPResp basicResponse)) {
                return protocolFailure(outcome, "no basic response");
            }
            basic = basicResponse;
        } catch (OCSPException | IllegalArgumentException e) {
            return protocolFailure(outcome, "unreadable basic response");
        }

        SingleResp single = null;
        for (SingleResp candidate : basic.getResponses()) {
            if (request.certificateId().equals(candidate.getCertID())) {
                single = candidate;
                break;
            }
        }
        if (single == null) {
            return protocolFailure(outcome, "no response for requested certificate");
        }

        outcome
            .certStatus(certStatus(single.getCertStatus()))
            .thisUpdate(single.getThisUpdate().toInstant())
            .nextUpdate(single.getNextUpdate() != null ? single.getNextUpdate().toInstant() : null);

        final X509CertificateHolder issuer = request.issuer();
        if (verifies(basic, issuer)) {
            return outcome
                .failure(FailureLayer.NONE)
                .signatureValid(true)
                .responderMatches(responderIdMatches(basic.getResponderId(), issuer))
                .detail("signed by issuer")
                .build();
        }

        for (X509CertificateHolder embedded : basic.getCerts()) {
            // only a certificate the issuer signed can speak for it
            if (!Certificates.isIssuedBy(embedded, issuer) || !verifies(basic, embedded)) {
                continue;
            }
            final boolean authorized = Certificates.isOcspSigner(embedded)
                && responderIdMatches(basic.getResponderId(), embedded);
            log.debug("Response signed by delegate subject={} authorized={}", embedded.getSubject(), authorized);
            return outcome
                .failure(FailureLayer.NONE)
                .signatureValid(true)
                .responderMatches(authorized)
                .detail(authorized ? "signed by delegated responder" : "signed by unauthorized delegate")
                .build();
        }

        boolean foreignSigner = false;
        for (X509CertificateHolder embedded : basic.getCerts()) {
            if (verifies(basic, embedded)) {
                log.debug("Response signed by subject={} which the issuer did not certify", embedded.getSubject());
                foreignSigner = true;
                break;
            }
        }
        return outcome
            .failure(FailureLayer.PROTOCOL)
            .signatureValid(false)
            .responderMatches(false)
            .detail(foreignSigner ? "signed by certificate outside the issuer's hierarchy"
                : "signature does not verify")
            .build();
    }

    private boolean responderIdMatches(RespID responderId, X509CertificateHolder signer) {
        if (responderId.equals(new RespID(signer.getSubject()))) {
            return true;
        }
        try {
            return responderId.equals(new RespID(signer.getSubjectPublicKeyInfo(), requestFactory.sha1()));
        } catch (OCSPException e) {
            log.debug("Unable to derive key based responder id of subject={}", signer.getSubject(), e);
            return false;
        }
    }

    private static boolean verifies(BasicOCSPResp response, X509CertificateHolder signer) {
        try {
            return response.isSignatureValid(Certificates.verifierFor(signer));
        } catch (OCSPException | OperatorCreationException e) {
            // key type does not fit the signature algorithm
            return false;
        }
    }

    private static CertStatus certStatus(CertificateStatus status) {
        if (status == CertificateStatus.GOOD) {
            return CertStatus.GOOD;
        }
        return status instanceof RevokedStatus ? CertStatus.REVOKED : CertStatus.UNKNOWN;
    }

    private static ProbeOutcome protocolFailure(ProbeOutcomeBuilder outcome, String detail) {
        return outcome
            .failure(FailureLayer.PROTOCOL)
            .detail(detail)
            .build();
    }

    static String statusName(int status) {
        return switch (status) {
            case OCSPResp.MALFORMED_REQUEST -> "malformedRequest";
            case OCSPResp.INTERNAL_ERROR -> "internalError";
            case OCSPResp.TRY_LATER -> "tryLater";
            case OCSPResp.SIG_REQUIRED -> "sigRequired";
            case OCSPResp.UNAUTHORIZED -> "unauthorized";
            default -> "code " + status;
        };
    }
}
