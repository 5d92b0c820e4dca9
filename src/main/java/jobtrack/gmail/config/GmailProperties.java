package jobtrack.gmail.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Gmail integration settings, bound from the {@code gmail.*} properties.
 */
@Data
@ConfigurationProperties(prefix = "gmail")
public class GmailProperties {

    /** OAuth client registered in the Google Cloud console. */
    private String clientId;
    private String clientSecret;
    private String redirectUri;

    private List<String> scopes = new ArrayList<>(List.of(
            "https://www.googleapis.com/auth/gmail.readonly",
            "https://www.googleapis.com/auth/userinfo.email"));

    private String authUrl = "https://accounts.google.com/o/oauth2/v2/auth";
    private String tokenUrl = "https://oauth2.googleapis.com/token";
    private String revokeUrl = "https://oauth2.googleapis.com/revoke";

    /** HMAC key for the OAuth state parameter. */
    private String stateSecret;

    /** How long a connect attempt may take before its state value is rejected. */
    private Duration stateTtl = Duration.ofMinutes(10);

    /** Access tokens expiring within this margin are refreshed before use. */
    private Duration tokenSafetyMargin = Duration.ofMinutes(5);

    private Sync sync = new Sync();
    private Retry retry = new Retry();

    /**
     * Defaults and bounds for a single ingestion pass.
     */
    @Data
    public static class Sync {
        private int defaultDaysSince = 30;
        private int defaultMaxEmails = 100;

        /** Message refs requested per list call (Gmail caps this at 500). */
        private int pageSize = 100;

        /** Skipped messages listed on a run; failures are always listed. */
        private int maxRecordedSkips = 50;

        private Duration runTimeout = Duration.ofMinutes(10);

        /** An in-progress run older than this is treated as abandoned. */
        private Duration staleClaimAfter = Duration.ofMinutes(30);

        private int recentRunsLimit = 10;
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(8);
    }

    public boolean isConfigured() {
        return clientId != null && !clientId.isBlank()
                && clientSecret != null && !clientSecret.isBlank();
    }
}
