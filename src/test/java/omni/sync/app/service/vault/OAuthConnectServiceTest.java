package omni.sync.app.service.vault;

import omni.sync.app.entity.IntegrationCredential;
import omni.sync.app.entity.Provider;
import omni.sync.app.exception.InvalidOAuthStateException;
import omni.sync.app.service.sync.SyncStateService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.oauth2.client.OAuth2AuthorizedClient;
import org.springframework.security.oauth2.client.OAuth2AuthorizedClientService;
import org.springframework.security.oauth2.client.registration.ClientRegistration;
import org.springframework.security.oauth2.core.AuthorizationGrantType;
import org.springframework.security.oauth2.core.OAuth2AccessToken;
import org.springframework.security.oauth2.core.OAuth2RefreshToken;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OAuthConnectServiceTest {
    private static final Instant NOW = Instant.parse("2026-01-10T12:00:00Z");

    @Mock
    private OAuth2AuthorizedClientService authorizedClientService;

    @Mock
    private TokenVault tokenVault;

    @Mock
    private SyncStateService syncStateService;

    private OAuthConnectService connectService;

    @BeforeEach
    void setUp() {
        connectService = new OAuthConnectService(authorizedClientService, tokenVault, syncStateService,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static OAuth2AuthorizedClient authorizedClient(String registrationId, Instant expiresAt,
                                                           OAuth2RefreshToken refreshToken, Set<String> scopes) {
        ClientRegistration registration = ClientRegistration.withRegistrationId(registrationId)
                .clientId("test_client_id")
                .authorizationGrantType(AuthorizationGrantType.AUTHORIZATION_CODE)
                .redirectUri("{baseUrl}/api/integrations/{registrationId}/callback")
                .authorizationUri("https://accounts.google.com/o/oauth2/v2/auth")
                .tokenUri("https://oauth2.googleapis.com/token")
                .build();
        OAuth2AccessToken accessToken = new OAuth2AccessToken(OAuth2AccessToken.TokenType.BEARER,
                "access-1", NOW.minusSeconds(1), expiresAt, scopes);
        return new OAuth2AuthorizedClient(registration, "user123", accessToken, refreshToken);
    }

    @Test
    void completeConnection_ShouldMoveAuthorizedClientIntoVault() {
        // Given
        OAuth2AuthorizedClient client = authorizedClient("mail", NOW.plusSeconds(1800),
                new OAuth2RefreshToken("refresh-1", NOW), Set.of("https://www.googleapis.com/auth/gmail.readonly"));
        IntegrationCredential stored = new IntegrationCredential();
        when(authorizedClientService.loadAuthorizedClient("mail", "user123")).thenReturn(client);
        when(tokenVault.storeCredential(eq("user123"), eq(Provider.MAIL), any())).thenReturn(stored);

        // When
        IntegrationCredential result = connectService.completeConnection("user123", Provider.MAIL);

        // Then
        assertSame(stored, result);
        ArgumentCaptor<TokenResponse> tokens = ArgumentCaptor.forClass(TokenResponse.class);
        verify(tokenVault).storeCredential(eq("user123"), eq(Provider.MAIL), tokens.capture());
        assertEquals("access-1", tokens.getValue().accessToken());
        assertEquals("refresh-1", tokens.getValue().refreshToken());
        assertEquals(1800, tokens.getValue().expiresInSeconds());
        assertEquals("https://www.googleapis.com/auth/gmail.readonly", tokens.getValue().scope());
        verify(syncStateService).clearError("user123", Provider.MAIL);
        verify(authorizedClientService).removeAuthorizedClient("mail", "user123");
    }

    @Test
    void completeConnection_WithoutExpiryOrRefreshToken_ShouldUseDefaults() {
        // Given
        OAuth2AuthorizedClient client = authorizedClient("calendar", null, null, Set.of());
        when(authorizedClientService.loadAuthorizedClient("calendar", "user123")).thenReturn(client);

        // When
        connectService.completeConnection("user123", Provider.CALENDAR);

        // Then
        ArgumentCaptor<TokenResponse> tokens = ArgumentCaptor.forClass(TokenResponse.class);
        verify(tokenVault).storeCredential(eq("user123"), eq(Provider.CALENDAR), tokens.capture());
        assertNull(tokens.getValue().refreshToken());
        assertEquals(3600, tokens.getValue().expiresInSeconds());
        assertNull(tokens.getValue().scope());
    }

    @Test
    void completeConnection_WithoutAuthorizedClient_ShouldNotStoreAnything() {
        // Given
        when(authorizedClientService.loadAuthorizedClient("mail", "user123")).thenReturn(null);

        // When & Then
        assertThrows(InvalidOAuthStateException.class,
                () -> connectService.completeConnection("user123", Provider.MAIL));
        verifyNoInteractions(tokenVault, syncStateService);
        verify(authorizedClientService, never()).removeAuthorizedClient(anyString(), anyString());
    }
}
