package omni.sync.app.config;

import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.HttpTransport;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Clock;

@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Transport shared by the Google API clients.
     */
    @Bean
    public HttpTransport googleHttpTransport() throws GeneralSecurityException, IOException {
        return GoogleNetHttpTransport.newTrustedTransport();
    }

    /**
     * Client for the OAuth token endpoint, bounded by the vault's timeouts.
     */
    @Bean
    public RestTemplate oauthRestTemplate(RestTemplateBuilder builder, VaultProperties vaultProperties) {
        return builder
                .setConnectTimeout(vaultProperties.getHttpConnectTimeout())
                .setReadTimeout(vaultProperties.getHttpReadTimeout())
                .build();
    }
}
