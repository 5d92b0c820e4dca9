package jobtrack.gmail.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jobtrack.gmail.config.GmailProperties;
import jobtrack.gmail.dto.OAuthState;
import jobtrack.gmail.exception.GmailSyncException;
import jobtrack.gmail.exception.InvalidOAuthStateException;
import jobtrack.gmail.exception.SyncErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

/**
 * Signed OAuth {@code state} values: {@code base64url(json) + "." + base64url(hmacSha256(json))}.
 * The payload binds the initiating user and the issue time so the callback can reject forged,
 * replayed-late or cross-user states.
 */
@Slf4j
@Service
public class OAuthStateService {
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final GmailProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public OAuthStateService(GmailProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public String issue(String userId) {
        byte[] nonce = new byte[16];
        random.nextBytes(nonce);
        OAuthState state = new OAuthState(userId, clock.millis(), ENCODER.encodeToString(nonce));

        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(state);
        } catch (JsonProcessingException e) {
            throw new GmailSyncException(SyncErrorCode.INTERNAL_ERROR, "Could not serialize OAuth state", e);
        }
        return ENCODER.encodeToString(payload) + "." + ENCODER.encodeToString(sign(payload));
    }

    /**
     * @return the verified payload
     * @throws InvalidOAuthStateException if the value is malformed, its signature does not match,
     *                                    it is older than the configured TTL, or it was issued to another user
     */
    public OAuthState verify(String value, String currentUserId) {
        if (value == null || value.isBlank()) {
            throw new InvalidOAuthStateException("Missing state parameter");
        }
        int dot = value.indexOf('.');
        if (dot <= 0 || dot == value.length() - 1) {
            throw new InvalidOAuthStateException("Malformed state parameter");
        }

        byte[] payload;
        byte[] signature;
        try {
            payload = DECODER.decode(value.substring(0, dot));
            signature = DECODER.decode(value.substring(dot + 1));
        } catch (IllegalArgumentException e) {
            throw new InvalidOAuthStateException("Malformed state parameter", e);
        }

        if (!MessageDigest.isEqual(sign(payload), signature)) {
            throw new InvalidOAuthStateException("State signature mismatch");
        }

        OAuthState state;
        try {
            state = objectMapper.readValue(payload, OAuthState.class);
        } catch (IOException e) {
            throw new InvalidOAuthStateException("Unreadable state payload", e);
        }

        Duration age = Duration.between(Instant.ofEpochMilli(state.getIssuedAt()), clock.instant());
        if (age.isNegative() || age.compareTo(properties.getStateTtl()) > 0) {
            throw new InvalidOAuthStateException("State expired");
        }
        if (currentUserId == null || !currentUserId.equals(state.getUserId())) {
            log.warn("OAuth callback state was issued to a different user");
            throw new InvalidOAuthStateException("State was issued to a different user");
        }
        return state;
    }

    private byte[] sign(byte[] payload) {
        String secret = properties.getStateSecret();
        if (secret == null || secret.isEmpty()) {
            throw new GmailSyncException(SyncErrorCode.NOT_CONFIGURED,
                    "Gmail OAuth state secret is not configured. Please set gmail.state-secret");
        }
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal(payload);
        } catch (GeneralSecurityException e) {
            throw new GmailSyncException(SyncErrorCode.INTERNAL_ERROR, "Could not sign OAuth state", e);
        }
    }
}
