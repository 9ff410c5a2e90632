package omni.sync.app.service.vault;

import lombok.extern.slf4j.Slf4j;
import omni.sync.app.entity.IntegrationCredential;
import omni.sync.app.entity.Provider;
import omni.sync.app.exception.InvalidOAuthStateException;
import omni.sync.app.service.sync.SyncStateService;
import org.springframework.security.oauth2.client.OAuth2AuthorizedClient;
import org.springframework.security.oauth2.client.OAuth2AuthorizedClientService;
import org.springframework.security.oauth2.core.OAuth2AccessToken;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Finishes the provider connect flow. Spring Security has already checked the state and
 * exchanged the code; the authorized client it saved is moved into the token vault.
 */
@Slf4j
@Service
public class OAuthConnectService {
    private static final long DEFAULT_EXPIRES_IN = 3600;

    private final OAuth2AuthorizedClientService authorizedClientService;
    private final TokenVault tokenVault;
    private final SyncStateService syncStateService;
    private final Clock clock;

    public OAuthConnectService(OAuth2AuthorizedClientService authorizedClientService,
                               TokenVault tokenVault,
                               SyncStateService syncStateService,
                               Clock clock) {
        this.authorizedClientService = authorizedClientService;
        this.tokenVault = tokenVault;
        this.syncStateService = syncStateService;
        this.clock = clock;
    }

    /**
     * Stores the tokens of the just-authorized client as the user's credential for the provider.
     * Nothing is written unless the code exchange completed for this user.
     */
    public IntegrationCredential completeConnection(String userId, Provider provider) {
        String registrationId = provider.getWireName();
        OAuth2AuthorizedClient client = authorizedClientService.loadAuthorizedClient(registrationId, userId);
        if (client == null || client.getAccessToken() == null) {
            throw new InvalidOAuthStateException("No completed authorization for " + registrationId);
        }

        IntegrationCredential credential = tokenVault.storeCredential(userId, provider, toTokenResponse(client));
        syncStateService.clearError(userId, provider);
        // The vault owns the tokens from here on
        authorizedClientService.removeAuthorizedClient(registrationId, userId);
        log.info("Connected {} for user {}", provider, userId);
        return credential;
    }

    TokenResponse toTokenResponse(OAuth2AuthorizedClient client) {
        OAuth2AccessToken accessToken = client.getAccessToken();
        long expiresIn = DEFAULT_EXPIRES_IN;
        Instant expiresAt = accessToken.getExpiresAt();
        if (expiresAt != null) {
            expiresIn = Math.max(0, Duration.between(clock.instant(), expiresAt).getSeconds());
        }
        String refreshToken = client.getRefreshToken() != null ? client.getRefreshToken().getTokenValue() : null;
        String scope = accessToken.getScopes().isEmpty() ? null : String.join(" ", accessToken.getScopes());
        return new TokenResponse(accessToken.getTokenValue(), refreshToken, expiresIn, scope);
    }
}
