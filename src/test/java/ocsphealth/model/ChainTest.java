package ocsphealth.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChainTest {

    private static final byte[] SUBJECT = "subject".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] ISSUER = "issuer".getBytes(StandardCharsets.US_ASCII);

    @Test
    void identicalContentHasSameId() {
        final Chain first = Chain.of(SUBJECT, ISSUER);
        final Chain second = Chain.of(SUBJECT.clone(), ISSUER.clone());

        assertThat(first.id()).isEqualTo(second.id());
        assertThat(first).isEqualTo(second);
        assertThat(first.id()).hasSize(64);
    }

    @Test
    void orderIsPartOfIdentity() {
        assertThat(Chain.of(SUBJECT, ISSUER).id())
            .isNotEqualTo(Chain.of(ISSUER, SUBJECT).id());
    }

    @Test
    void certificateBoundariesArePartOfIdentity() {
        // same concatenated bytes, split differently
        final Chain first = Chain.of(List.of("ab".getBytes(StandardCharsets.US_ASCII),
            "c".getBytes(StandardCharsets.US_ASCII)));
        final Chain second = Chain.of(List.of("a".getBytes(StandardCharsets.US_ASCII),
            "bc".getBytes(StandardCharsets.US_ASCII)));

        assertThat(first.id()).isNotEqualTo(second.id());
    }

    @Test
    void contentIsCopied() {
        final byte[] subject = SUBJECT.clone();
        final Chain chain = Chain.of(subject, ISSUER);
        subject[0] = 'X';

        assertThat(chain.subject()).isEqualTo(SUBJECT);
        assertThat(chain.id()).isEqualTo(Chain.contentId(List.of(SUBJECT, ISSUER)));
    }

    @Test
    void needsSubjectAndIssuer() {
        assertThatThrownBy(() -> Chain.of(List.of(SUBJECT)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
