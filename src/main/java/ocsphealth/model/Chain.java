package ocsphealth.model;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.bouncycastle.util.encoders.Hex;

/**
 * An ordered sequence of DER encoded certificates, subject first and its issuer second, identified by the hash of
 * its content. Two chains with byte-identical certificates always carry the same {@link #id()}.
 */
public final class Chain {

    private final String id;
    private final List<byte[]> certificates;

    private Chain(String id, List<byte[]> certificates) {
        this.id = id;
        this.certificates = certificates;
    }

    public static Chain of(byte[] subject, byte[] issuer) {
        return of(List.of(subject, issuer));
    }

    /**
     * @throws IllegalArgumentException if fewer than a subject and its issuer are given
     */
    public static Chain of(List<byte[]> certificates) {
        if (certificates.size() < 2) {
            throw new IllegalArgumentException("A chain needs at least a subject and its issuer");
        }
        final List<byte[]> copies = new ArrayList<>(certificates.size());
        for (byte[] certificate : certificates) {
            copies.add(certificate.clone());
        }
        return new Chain(contentId(copies), Collections.unmodifiableList(copies));
    }

    /**
     * Hex SHA-256 over each certificate prefixed with its length, so that the boundaries between certificates are
     * part of the identity.
     */
    static String contentId(List<byte[]> certificates) {
        final MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
        for (byte[] certificate : certificates) {
            digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(certificate.length).array());
            digest.update(certificate);
        }
        return Hex.toHexString(digest.digest());
    }

    public String id() {
        return id;
    }

    public byte[] subject() {
        return certificates.get(0).clone();
    }

    public byte[] issuer() {
        return certificates.get(1).clone();
    }

    public int size() {
        return certificates.size();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Chain other && id.equals(other.id));
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Chain[id=%s, size=%d]".formatted(id, certificates.size());
    }
}
