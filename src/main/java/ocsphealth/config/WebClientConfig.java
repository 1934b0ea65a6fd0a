package ocsphealth.config;

import io.netty.channel.ChannelOption;
import java.time.Clock;
import org.springframework.boot.web.reactive.function.client.WebClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import reactor.netty.http.client.HttpClient;

@Configuration
public class WebClientConfig {

    // OCSP responses carrying full responder chains can exceed the default codec buffer
    private static final int MAX_IN_MEMORY_SIZE = 1024 * 1024;

    private final AppProperties appProperties;

    public WebClientConfig(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    @Bean
    public WebClientCustomizer webClientCustomizer() {
        return webClientBuilder -> webClientBuilder
            .clientConnector(
                new ReactorClientHttpConnector(
                    HttpClient.create()
                        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                            (int) appProperties.probe().connectTimeout().toMillis())
                        .responseTimeout(appProperties.dispatch().probeTimeout())
                )
            )
            .defaultHeader(HttpHeaders.USER_AGENT, appProperties.probe().userAgent())
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
