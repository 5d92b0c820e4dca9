package jobtrack.gmail.config;

import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import jobtrack.gmail.service.RetryPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;

/**
 * Shared, thread-safe clients for talking to Google.
 * Gmail API stubs themselves are built per call with the caller's access token.
 */
@Configuration
@EnableConfigurationProperties(GmailProperties.class)
public class GmailClientConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public NetHttpTransport googleHttpTransport() throws GeneralSecurityException, IOException {
        return GoogleNetHttpTransport.newTrustedTransport();
    }

    @Bean
    public RestTemplate oauthRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    public RetryPolicy gmailRetryPolicy(GmailProperties properties) {
        GmailProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(retry.getMaxAttempts(), retry.getInitialBackoff(),
                retry.getMultiplier(), retry.getMaxBackoff());
    }
}
