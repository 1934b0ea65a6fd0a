package ocsphealth.services;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x509.AccessDescription;
import org.bouncycastle.asn1.x509.AuthorityInformationAccess;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.cert.CertException;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.operator.ContentVerifierProvider;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentVerifierProviderBuilder;

/**
 * Helpers reading the parts of X.509 certificates that discovery and probing rely on.
 */
@Slf4j
public final class Certificates {

    private Certificates() {}

    /**
     * @throws IOException if the bytes are not a DER encoded certificate
     */
    public static X509CertificateHolder parse(byte[] der) throws IOException {
        if (der == null || der.length == 0) {
            throw new IOException("Empty certificate encoding");
        }
        try {
            return new X509CertificateHolder(der);
        } catch (IllegalArgumentException | ClassCastException e) {
            // BouncyCastle reports some structural problems as runtime exceptions
            throw new IOException("Malformed certificate: " + e.getMessage(), e);
        }
    }

    public static List<URI> ocspUrls(X509CertificateHolder certificate) {
        return accessLocations(certificate, AccessDescription.id_ad_ocsp);
    }

    public static List<URI> caIssuerUrls(X509CertificateHolder certificate) {
        return accessLocations(certificate, AccessDescription.id_ad_caIssuers);
    }

    private static List<URI> accessLocations(X509CertificateHolder certificate, ASN1ObjectIdentifier method) {
        final AuthorityInformationAccess aia = AuthorityInformationAccess.fromExtensions(certificate.getExtensions());
        if (aia == null) {
            return List.of();
        }
        final List<URI> urls = new ArrayList<>();
        for (AccessDescription description : aia.getAccessDescriptions()) {
            final GeneralName location = description.getAccessLocation();
            if (description.getAccessMethod().equals(method)
                && location.getTagNo() == GeneralName.uniformResourceIdentifier) {
                final String value = location.getName().toString().trim();
                try {
                    final URI uri = new URI(value);
                    if ("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme())) {
                        urls.add(uri);
                    }
                } catch (URISyntaxException e) {
                    log.debug("Ignoring unparseable access location={} in certificate subject={}",
                        value, certificate.getSubject());
                }
            }
        }
        return urls;
    }

    public static boolean isCa(X509CertificateHolder certificate) {
        final BasicConstraints constraints = BasicConstraints.fromExtensions(certificate.getExtensions());
        return constraints != null && constraints.isCA();
    }

    public static boolean isSelfIssued(X509CertificateHolder certificate) {
        return certificate.getSubject().equals(certificate.getIssuer());
    }

    public static boolean isValidAt(X509CertificateHolder certificate, Instant instant) {
        return certificate.isValidOn(Date.from(instant));
    }

    public static boolean isOcspSigner(X509CertificateHolder certificate) {
        final ExtendedKeyUsage usage = ExtendedKeyUsage.fromExtensions(certificate.getExtensions());
        return usage != null && usage.hasKeyPurposeId(KeyPurposeId.id_kp_OCSPSigning);
    }

    /**
     * @return true if {@code issuer} is named as the issuer of {@code subject} and its key verifies the subject's
     * signature
     */
    public static boolean isIssuedBy(X509CertificateHolder subject, X509CertificateHolder issuer) {
        if (!subject.getIssuer().equals(issuer.getSubject())) {
            return false;
        }
        try {
            return subject.isSignatureValid(verifierFor(issuer));
        } catch (CertException | OperatorCreationException e) {
            log.debug("Unable to verify subject={} against issuer={}: {}",
                subject.getSubject(), issuer.getSubject(), e.getMessage());
            return false;
        }
    }

    public static ContentVerifierProvider verifierFor(X509CertificateHolder certificate)
        throws OperatorCreationException {
        try {
            return new JcaContentVerifierProviderBuilder().build(certificate);
        } catch (java.security.cert.CertificateException e) {
            throw new OperatorCreationException("Unable to read public key of " + certificate.getSubject(), e);
        }
    }
}
