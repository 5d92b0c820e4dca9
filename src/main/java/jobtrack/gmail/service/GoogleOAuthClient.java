package jobtrack.gmail.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jobtrack.gmail.config.GmailProperties;
import jobtrack.gmail.dto.TokenResponse;
import jobtrack.gmail.exception.AuthExpiredException;
import jobtrack.gmail.exception.GmailApiException;
import jobtrack.gmail.exception.GmailSyncException;
import jobtrack.gmail.exception.OAuthExchangeException;
import jobtrack.gmail.exception.ProviderUnavailableException;
import jobtrack.gmail.exception.RevokeFailedException;
import jobtrack.gmail.exception.SyncErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Google's OAuth2 endpoints: authorization URL, code exchange, refresh and revocation.
 * <p>
 * Failures are classified here so callers only ever see the sync error taxonomy:
 * a rejected refresh token becomes {@link AuthExpiredException}, network errors,
 * 429 and 5xx become {@link ProviderUnavailableException}.
 */
@Slf4j
@Service
public class GoogleOAuthClient {
    private final GmailProperties properties;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public GoogleOAuthClient(GmailProperties properties, RestTemplate oauthRestTemplate, ObjectMapper objectMapper) {
        this.properties = properties;
        this.restTemplate = oauthRestTemplate;
        this.objectMapper = objectMapper;
    }

    private void validateClientCredentials() {
        if (!properties.isConfigured()) {
            throw new GmailSyncException(SyncErrorCode.NOT_CONFIGURED,
                    "Gmail OAuth client is not configured. Please set gmail.client-id and gmail.client-secret");
        }
    }

    /**
     * Consent screen URL. {@code access_type=offline} and {@code prompt=consent} make Google issue
     * a refresh token even when the user granted access before.
     */
    public String buildAuthorizationUrl(String state) {
        validateClientCredentials();
        return UriComponentsBuilder.fromHttpUrl(properties.getAuthUrl())
                .queryParam("client_id", properties.getClientId())
                .queryParam("redirect_uri", properties.getRedirectUri())
                .queryParam("response_type", "code")
                .queryParam("scope", String.join(" ", properties.getScopes()))
                .queryParam("access_type", "offline")
                .queryParam("prompt", "consent")
                .queryParam("state", state)
                .encode()
                .build()
                .toUriString();
    }

    public TokenResponse exchangeCode(String code) {
        validateClientCredentials();

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("code", code);
        body.add("client_id", properties.getClientId());
        body.add("client_secret", properties.getClientSecret());
        body.add("redirect_uri", properties.getRedirectUri());
        body.add("grant_type", "authorization_code");

        try {
            return postTokenRequest(body);
        } catch (HttpClientErrorException e) {
            throw new OAuthExchangeException(SyncErrorCode.OAUTH_EXCHANGE_FAILED,
                    "Failed to exchange code for tokens: " + e.getStatusCode() + " " + describeError(e), e);
        } catch (RestClientException e) {
            throw new ProviderUnavailableException("Token endpoint unavailable during code exchange: " + e.getMessage(), e);
        }
    }

    public TokenResponse refresh(String refreshToken) {
        validateClientCredentials();

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", properties.getClientId());
        body.add("client_secret", properties.getClientSecret());
        body.add("refresh_token", refreshToken);
        body.add("grant_type", "refresh_token");

        try {
            return postTokenRequest(body);
        } catch (HttpClientErrorException e) {
            int status = e.getStatusCode().value();
            String error = describeError(e);
            if (status == 429) {
                throw new ProviderUnavailableException("Token endpoint rate limited the refresh", e);
            }
            if ("invalid_grant".equals(error) || status == 401) {
                throw new AuthExpiredException("Refresh token was rejected (" + error + ")", e);
            }
            throw new GmailApiException(status, "Token refresh failed: " + status + " " + error, e);
        } catch (RestClientException e) {
            throw new ProviderUnavailableException("Token endpoint unavailable during refresh: " + e.getMessage(), e);
        }
    }

    public void revoke(String token) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("token", token);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    properties.getRevokeUrl(), new HttpEntity<>(body, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new RevokeFailedException("Token revocation returned " + response.getStatusCode());
            }
        } catch (RestClientException e) {
            throw new RevokeFailedException("Failed to revoke token: " + e.getMessage(), e);
        }
    }

    private TokenResponse postTokenRequest(MultiValueMap<String, String> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        ResponseEntity<String> response = restTemplate.postForEntity(
                properties.getTokenUrl(), new HttpEntity<>(body, headers), String.class);

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new ProviderUnavailableException("Token endpoint returned " + response.getStatusCode() + " without a body");
        }

        TokenResponse tokens;
        try {
            tokens = objectMapper.readValue(response.getBody(), TokenResponse.class);
        } catch (JsonProcessingException e) {
            throw new ProviderUnavailableException("Token endpoint returned an unreadable body", e);
        }
        if (tokens.getAccessToken() == null || tokens.getAccessToken().isEmpty()) {
            throw new ProviderUnavailableException("Token response missing access_token");
        }
        return tokens;
    }

    /**
     * The OAuth {@code error} field of an error response, or the raw status text if the body is not JSON.
     */
    private String describeError(HttpClientErrorException e) {
        String body = e.getResponseBodyAsString();
        if (body != null && !body.isEmpty()) {
            try {
                JsonNode json = objectMapper.readTree(body);
                if (json.hasNonNull("error")) {
                    return json.get("error").asText();
                }
            } catch (JsonProcessingException notJson) {
                log.debug("Token endpoint error body is not JSON: {}", notJson.getOriginalMessage());
            }
        }
        return e.getStatusText();
    }
}
