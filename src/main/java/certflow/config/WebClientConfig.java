package certflow.config;

import certflow.services.JwsMessageWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.reactive.function.client.WebClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.Http11SslContextSpec;
import reactor.netty.http.client.HttpClient;

@Configuration
public class WebClientConfig {

    public static final String VERIFICATION_CLIENT = "verificationWebClient";

    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    public WebClientConfig(ObjectMapper objectMapper,
        AppProperties appProperties
    ) {
        this.objectMapper = objectMapper;
        this.appProperties = appProperties;
    }

    @Bean
    public WebClientCustomizer webClientCustomizer() {
        return webClientBuilder -> webClientBuilder
            .clientConnector(
                new ReactorClientHttpConnector(
                    HttpClient.create()
                        .responseTimeout(appProperties.responseTimeout())
                )
            )
            .exchangeStrategies(
                ExchangeStrategies.builder()
                    .codecs(clientCodecConfigurer -> {
                        clientCodecConfigurer.customCodecs().register(
                            new JwsMessageWriter(objectMapper)
                        );
                    })
                    .build()
            );
    }

    /**
     * Observes published HTTP proofs the way a validation server would: follows redirects, including to HTTPS, and
     * doesn't care whether the site's current certificate is trusted or even valid.
     */
    @Bean
    @Qualifier(VERIFICATION_CLIENT)
    public WebClient verificationWebClient(WebClient.Builder webClientBuilder) {
        return webClientBuilder.clone()
            .clientConnector(
                new ReactorClientHttpConnector(
                    HttpClient.create()
                        .followRedirect(true)
                        .responseTimeout(appProperties.responseTimeout())
                        .secure(spec -> spec.sslContext(
                            Http11SslContextSpec.forClient()
                                .configure(builder -> builder.trustManager(InsecureTrustManagerFactory.INSTANCE))
                        ))
                )
            )
            .build();
    }
}
