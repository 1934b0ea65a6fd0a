package ocsphealth.services;

import java.io.IOException;
import java.security.SecureRandom;
import lombok.extern.slf4j.Slf4j;
import ocsphealth.config.AppProperties;
import ocsphealth.model.Chain;
import org.bouncycastle.asn1.DEROctetString;
import org.bouncycastle.asn1.ocsp.OCSPObjectIdentifiers;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.Extensions;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.ocsp.CertificateID;
import org.bouncycastle.cert.ocsp.OCSPException;
import org.bouncycastle.cert.ocsp.OCSPReqBuilder;
import org.bouncycastle.operator.DigestCalculator;
import org.bouncycastle.operator.DigestCalculatorProvider;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaDigestCalculatorProviderBuilder;
import org.springframework.stereotype.Component;

/**
 * Builds the OCSP request asking about the subject certificate of a chain.
 */
@Component
@Slf4j
public class OcspRequestFactory {

    private static final int NONCE_LENGTH = 16;

    private final boolean includeNonce;
    private final DigestCalculatorProvider digestCalculatorProvider;
    private final SecureRandom random = new SecureRandom();

    public OcspRequestFactory(AppProperties appProperties) {
        this.includeNonce = appProperties.probe().includeNonce();
        try {
            this.digestCalculatorProvider = new JcaDigestCalculatorProviderBuilder().build();
        } catch (OperatorCreationException e) {
            throw new IllegalStateException("Unable to set up digest calculators", e);
        }
    }

    /**
     * @throws OCSPException if the chain's certificates cannot be read or identified
     */
    public PreparedRequest build(Chain chain) throws OCSPException {
        final X509CertificateHolder subject;
        final X509CertificateHolder issuer;
        try {
            subject = Certificates.parse(chain.subject());
            issuer = Certificates.parse(chain.issuer());
        } catch (IOException e) {
            throw new OCSPException("Chain %s does not hold readable certificates".formatted(chain.id()), e);
        }

        final CertificateID certificateId = new CertificateID(sha1(), issuer, subject.getSerialNumber());
        final OCSPReqBuilder builder = new OCSPReqBuilder()
            .addRequest(certificateId);
        if (includeNonce) {
            final byte[] nonce = new byte[NONCE_LENGTH];
            random.nextBytes(nonce);
            builder.setRequestExtensions(new Extensions(
                new Extension(OCSPObjectIdentifiers.id_pkix_ocsp_nonce, false, new DEROctetString(nonce))
            ));
        }

        try {
            return new PreparedRequest(certificateId, issuer, builder.build().getEncoded());
        } catch (IOException e) {
            throw new OCSPException("Unable to encode request for chain %s".formatted(chain.id()), e);
        }
    }

    DigestCalculator sha1() throws OCSPException {
        try {
            return digestCalculatorProvider.get(CertificateID.HASH_SHA1);
        } catch (OperatorCreationException e) {
            throw new OCSPException("SHA-1 digest is not available", e);
        }
    }

    /**
     * @param certificateId identifies the certificate asked about, used to find the matching single response
     * @param issuer        expected signer of the response, directly or through a delegate
     * @param encoded       DER encoded request
     */
    public record PreparedRequest(
        CertificateID certificateId,
        X509CertificateHolder issuer,
        byte[] encoded
    ) {

    }
}
