package jobtrack.gmail.service;

import jobtrack.gmail.config.GmailProperties;
import jobtrack.gmail.dto.AccessToken;
import jobtrack.gmail.dto.TokenResponse;
import jobtrack.gmail.entity.GmailConnection;
import jobtrack.gmail.entity.OAuthToken;
import jobtrack.gmail.exception.AuthExpiredException;
import jobtrack.gmail.exception.ProviderUnavailableException;
import jobtrack.gmail.repository.GmailConnectionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TokenRefreshServiceTest {
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private GmailConnectionRepository connectionRepository;

    @Mock
    private GoogleOAuthClient oauthClient;

    private TokenRefreshService tokenRefreshService;

    private GmailConnection testConnection;
    private OAuthToken testToken;

    @BeforeEach
    void setUp() {
        tokenRefreshService = new TokenRefreshService(connectionRepository, oauthClient, new GmailProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));

        testToken = new OAuthToken();
        testToken.setAccessToken("old_access_token");
        testToken.setRefreshToken("refresh_token_123");
        testToken.setExpiry(NOW.minusSeconds(3600));

        testConnection = new GmailConnection();
        testConnection.setId("conn123");
        testConnection.setUserId("user123");
        testConnection.setEmailAddress("jane@example.com");
        testConnection.setActive(true);
        testConnection.setToken(testToken);

        lenient().when(connectionRepository.updateToken(anyString(), anyString(), any(), any(), any(), any(), any()))
                .thenReturn(1);
        lenient().when(connectionRepository.deactivate(anyString(), any())).thenReturn(1);
    }

    @Test
    void ensureFreshToken_WithValidToken_ShouldReturnStoredToken() {
        // Given
        testToken.setExpiry(NOW.plusSeconds(3600));

        // When
        AccessToken result = tokenRefreshService.ensureFreshToken(testConnection);

        // Then
        assertEquals("old_access_token", result.getValue());
        verifyNoInteractions(oauthClient, connectionRepository);
    }

    @Test
    void ensureFreshToken_WithinSafetyMargin_ShouldRefresh() {
        // Given: expires in 4 minutes, margin is 5
        testToken.setExpiry(NOW.plusSeconds(240));
        when(oauthClient.refresh("refresh_token_123")).thenReturn(TokenResponse.builder()
                .accessToken("new_access_token").expiresIn(3600L).build());

        // When
        AccessToken result = tokenRefreshService.ensureFreshToken(testConnection);

        // Then
        assertEquals("new_access_token", result.getValue());
        assertEquals(NOW.plusSeconds(3600), result.getExpiry());
    }

    @Test
    void ensureFreshToken_WithExpiredToken_ShouldRefreshExactlyOnceAndPersist() {
        // Given
        when(oauthClient.refresh("refresh_token_123")).thenReturn(TokenResponse.builder()
                .accessToken("new_access_token").expiresIn(1800L).build());

        // When
        AccessToken result = tokenRefreshService.ensureFreshToken(testConnection);

        // Then
        verify(oauthClient, times(1)).refresh(anyString());
        verify(connectionRepository).updateToken("conn123", "refresh_token_123", "new_access_token",
                "refresh_token_123", NOW.plusSeconds(1800), null, NOW);
        verify(connectionRepository, never()).save(any());
        assertEquals("new_access_token", testConnection.getToken().getAccessToken());
        assertEquals("new_access_token", result.getValue());
    }

    @Test
    void ensureFreshToken_WithRotatedRefreshToken_ShouldStoreNewRefreshToken() {
        // Given
        when(oauthClient.refresh("refresh_token_123")).thenReturn(TokenResponse.builder()
                .accessToken("new_access_token").refreshToken("rotated").build());

        // When
        AccessToken result = tokenRefreshService.ensureFreshToken(testConnection);

        // Then
        assertEquals("rotated", testConnection.getToken().getRefreshToken());
        assertEquals(NOW.plusSeconds(3600), result.getExpiry());
        verify(connectionRepository).updateToken(eq("conn123"), eq("refresh_token_123"), eq("new_access_token"),
                eq("rotated"), eq(NOW.plusSeconds(3600)), isNull(), eq(NOW));
    }

    @Test
    void ensureFreshToken_WithNullExpiry_ShouldTreatAsExpired() {
        // Given
        testToken.setExpiry(null);
        when(oauthClient.refresh("refresh_token_123")).thenReturn(TokenResponse.builder()
                .accessToken("new_access_token").expiresIn(3600L).build());

        // When
        tokenRefreshService.ensureFreshToken(testConnection);

        // Then
        verify(oauthClient).refresh("refresh_token_123");
    }

    @Test
    void ensureFreshToken_WithNoRefreshToken_ShouldMarkInactiveAndThrow() {
        // Given
        testToken.setRefreshToken(null);

        // When & Then
        AuthExpiredException exception = assertThrows(AuthExpiredException.class, () ->
                tokenRefreshService.ensureFreshToken(testConnection));

        assertTrue(exception.getMessage().contains("no refresh token"));
        assertFalse(testConnection.isActive());
        verify(connectionRepository).deactivate("conn123", NOW);
        verifyNoInteractions(oauthClient);
    }

    @Test
    void ensureFreshToken_WithRevokedRefreshToken_ShouldMarkInactiveAndThrow() {
        // Given
        when(oauthClient.refresh("refresh_token_123"))
                .thenThrow(new AuthExpiredException("Refresh token was rejected (invalid_grant)"));

        // When & Then
        assertThrows(AuthExpiredException.class, () -> tokenRefreshService.ensureFreshToken(testConnection));

        assertFalse(testConnection.isActive());
        verify(connectionRepository).deactivate("conn123", NOW);
        verify(connectionRepository, never()).save(any());
    }

    @Test
    void ensureFreshToken_WithTransientFailure_ShouldKeepConnectionActive() {
        // Given
        when(oauthClient.refresh("refresh_token_123"))
                .thenThrow(new ProviderUnavailableException("Token endpoint unavailable"));

        // When & Then
        assertThrows(ProviderUnavailableException.class, () -> tokenRefreshService.ensureFreshToken(testConnection));

        assertTrue(testConnection.isActive());
        verify(connectionRepository, never()).deactivate(anyString(), any());
        verify(connectionRepository, never()).updateToken(anyString(), anyString(), any(), any(), any(), any(), any());
    }

    @Test
    void forceRefresh_WithValidToken_ShouldRefreshAnyway() {
        // Given
        testToken.setExpiry(NOW.plusSeconds(3600));
        when(oauthClient.refresh("refresh_token_123")).thenReturn(TokenResponse.builder()
                .accessToken("new_access_token").expiresIn(3600L).build());

        // When
        AccessToken result = tokenRefreshService.forceRefresh(testConnection);

        // Then
        assertEquals("new_access_token", result.getValue());
        verify(connectionRepository).updateToken(eq("conn123"), eq("refresh_token_123"), eq("new_access_token"),
                any(), any(), any(), any());
    }

    @Test
    void ensureFreshToken_WithoutStoredCredentials_ShouldThrowAuthExpired() {
        // Given
        testConnection.setToken(null);

        // When & Then
        assertThrows(AuthExpiredException.class, () -> tokenRefreshService.ensureFreshToken(testConnection));
        assertFalse(testConnection.isActive());
    }

    @Test
    void ensureFreshToken_WhenConnectionChangedMeanwhile_ShouldUseTokenWithoutOverwritingRow() {
        // Given: the stored row no longer holds the refresh token this run started with
        when(oauthClient.refresh("refresh_token_123")).thenReturn(TokenResponse.builder()
                .accessToken("new_access_token").expiresIn(3600L).build());
        when(connectionRepository.updateToken(anyString(), anyString(), any(), any(), any(), any(), any()))
                .thenReturn(0);

        // When
        AccessToken result = tokenRefreshService.ensureFreshToken(testConnection);

        // Then
        assertEquals("new_access_token", result.getValue());
        verify(connectionRepository, never()).save(any());
        verify(connectionRepository, never()).saveAndFlush(any());
    }

    @Test
    void markAuthExpired_WhenConnectionAlreadyDeleted_ShouldNotRecreateIt() {
        // Given
        when(connectionRepository.deactivate("conn123", NOW)).thenReturn(0);

        // When
        tokenRefreshService.markAuthExpired(testConnection, "invalid_grant");

        // Then
        assertFalse(testConnection.isActive());
        verify(connectionRepository, never()).save(any());
        verify(connectionRepository, never()).saveAndFlush(any());
    }
}
