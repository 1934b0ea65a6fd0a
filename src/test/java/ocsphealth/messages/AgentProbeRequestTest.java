package ocsphealth.messages;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.skyscreamer.jsonassert.JSONCompareMode;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.json.JsonTest;
import org.springframework.boot.test.json.JacksonTester;

@JsonTest
class AgentProbeRequestTest {

    @Autowired
    private JacksonTester<AgentProbeRequest> json;

    @Test
    void serialize() throws IOException {
        final AgentProbeRequest request = AgentProbeRequest.builder()
            .url("http://ocsp.example.com")
            .request("MEIwQDA+MDwwOjAJBgUrDgMCGgUABBQ=")
            .timeoutMillis(20000)
            .build();

        assertThat(json.write(request))
            .isEqualToJson("""
                {
                    "url": "http://ocsp.example.com",
                    "request": "MEIwQDA+MDwwOjAJBgUrDgMCGgUABBQ=",
                    "timeoutMillis": 20000
                }
                """, JSONCompareMode.STRICT);
    }
}
