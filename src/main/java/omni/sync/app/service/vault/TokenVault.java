package omni.sync.app.service.vault;

import lombok.extern.slf4j.Slf4j;
import omni.sync.app.config.VaultProperties;
import omni.sync.app.entity.CredentialStatus;
import omni.sync.app.entity.IntegrationCredential;
import omni.sync.app.entity.OAuthToken;
import omni.sync.app.entity.Provider;
import omni.sync.app.exception.AuthException;
import omni.sync.app.exception.InvalidGrantException;
import omni.sync.app.exception.ProviderException;
import omni.sync.app.repository.IntegrationCredentialRepository;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the OAuth credentials of every (user, provider) pair. Plaintext tokens never leave
 * this class except as the return value of {@link #getValidToken}.
 * <p>
 * Refreshes for one key are serialized in-process with a lock per key; across processes the
 * {@code @Version} column makes the write conditional and the loser re-reads the winner's token.
 */
@Slf4j
@Service
public class TokenVault {
    private final IntegrationCredentialRepository credentialRepository;
    private final TokenEndpointClient tokenEndpointClient;
    private final TokenCipher cipher;
    private final VaultProperties properties;
    private final Clock clock;
    private final ConcurrentMap<String, ReentrantLock> refreshLocks = new ConcurrentHashMap<>();

    public TokenVault(IntegrationCredentialRepository credentialRepository,
                      TokenEndpointClient tokenEndpointClient,
                      TokenCipher cipher,
                      VaultProperties properties,
                      Clock clock) {
        this.credentialRepository = credentialRepository;
        this.tokenEndpointClient = tokenEndpointClient;
        this.cipher = cipher;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Returns a plaintext access token that stays valid for at least the refresh margin,
     * refreshing it first when needed.
     *
     * @throws AuthException if the credential is missing, invalid or the refresh grant was rejected
     * @throws ProviderException if the token endpoint failed transiently
     */
    public String getValidToken(String userId, Provider provider) {
        IntegrationCredential credential = loadUsable(userId, provider);
        if (!needsRefresh(credential)) {
            return cipher.decrypt(credential.getToken().getAccessToken());
        }

        ReentrantLock lock = lockFor(userId, provider);
        lock.lock();
        try {
            // Another caller may have refreshed while we waited
            credential = loadUsable(userId, provider);
            if (!needsRefresh(credential)) {
                return cipher.decrypt(credential.getToken().getAccessToken());
            }
            return refresh(credential);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Called after the provider answered 401 for {@code rejectedToken}. Refreshes unless a
     * newer token has been stored in the meantime.
     */
    public String refreshAfterUnauthorized(String userId, Provider provider, String rejectedToken) {
        ReentrantLock lock = lockFor(userId, provider);
        lock.lock();
        try {
            IntegrationCredential credential = loadUsable(userId, provider);
            String current = cipher.decrypt(credential.getToken().getAccessToken());
            if (!Objects.equals(current, rejectedToken) && !needsRefresh(credential)) {
                return current;
            }
            log.info("Received 401 for user {} provider {}, refreshing access token", userId, provider);
            return refresh(credential);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the credential invalid; the user has to reconnect.
     */
    public void invalidate(String userId, Provider provider, String reason) {
        credentialRepository.findByUserIdAndProvider(userId, provider)
                .ifPresent(credential -> markInvalid(credential, reason));
    }

    /**
     * Single writer of credentials, used by the OAuth callback after a successful code exchange.
     * Keeps the existing refresh token when the provider did not send a new one.
     */
    @Transactional
    public IntegrationCredential storeCredential(String userId, Provider provider, TokenResponse tokens) {
        Instant now = clock.instant();
        IntegrationCredential credential = credentialRepository.findByUserIdAndProvider(userId, provider)
                .orElseGet(() -> {
                    IntegrationCredential created = new IntegrationCredential();
                    created.setUserId(userId);
                    created.setProvider(provider);
                    created.setCreatedAt(now);
                    return created;
                });

        OAuthToken token = credential.getToken() != null ? credential.getToken() : new OAuthToken();
        token.setAccessToken(cipher.encrypt(tokens.accessToken()));
        if (tokens.refreshToken() != null) {
            token.setRefreshToken(cipher.encrypt(tokens.refreshToken()));
        }
        token.setExpiry(now.plusSeconds(tokens.expiresInSeconds()));
        token.setScopes(tokens.scope() != null ? tokens.scope() : provider.getScope());

        credential.setToken(token);
        credential.setStatus(CredentialStatus.ACTIVE);
        credential.setUpdatedAt(now);
        if (token.getRefreshToken() == null) {
            log.warn("No refresh token stored for user {} provider {}; the user will have to reconnect at expiry",
                    userId, provider);
        }
        return credentialRepository.save(credential);
    }

    private String refresh(IntegrationCredential credential) {
        String userId = credential.getUserId();
        Provider provider = credential.getProvider();
        String refreshToken = cipher.decrypt(credential.getToken().getRefreshToken());
        if (refreshToken == null || refreshToken.isEmpty()) {
            markInvalid(credential, "no refresh token");
            throw new AuthException(userId, provider,
                    "Access token expired and no refresh token available. Please reconnect " + provider.getWireName());
        }

        TokenResponse response;
        try {
            response = tokenEndpointClient.refresh(refreshToken);
        } catch (InvalidGrantException e) {
            markInvalid(credential, e.getMessage());
            throw new AuthException(userId, provider, "Refresh token rejected. Please reconnect " + provider.getWireName(), e);
        }

        Instant now = clock.instant();
        OAuthToken token = credential.getToken();
        token.setAccessToken(cipher.encrypt(response.accessToken()));
        token.setExpiry(now.plusSeconds(response.expiresInSeconds()));
        if (response.refreshToken() != null) {
            token.setRefreshToken(cipher.encrypt(response.refreshToken()));
        }
        credential.setUpdatedAt(now);

        try {
            credentialRepository.save(credential);
        } catch (OptimisticLockingFailureException e) {
            // Another process refreshed first; its token is as good as ours
            log.info("Concurrent refresh detected for user {} provider {}, using stored token", userId, provider);
            IntegrationCredential winner = loadUsable(userId, provider);
            return cipher.decrypt(winner.getToken().getAccessToken());
        }
        log.info("Token refreshed for user {} provider {}, expires at {}", userId, provider, token.getExpiry());
        return response.accessToken();
    }

    private void markInvalid(IntegrationCredential credential, String reason) {
        log.warn("Marking credential invalid for user {} provider {}: {}",
                credential.getUserId(), credential.getProvider(), reason);
        credential.setStatus(CredentialStatus.INVALID);
        credential.setUpdatedAt(clock.instant());
        try {
            credentialRepository.save(credential);
        } catch (OptimisticLockingFailureException e) {
            log.warn("Credential for user {} provider {} changed while being invalidated, keeping the newer row",
                    credential.getUserId(), credential.getProvider());
        }
    }

    private IntegrationCredential loadUsable(String userId, Provider provider) {
        IntegrationCredential credential = credentialRepository.findByUserIdAndProvider(userId, provider)
                .orElseThrow(() -> new AuthException(userId, provider,
                        "No " + provider.getWireName() + " credential. Please connect the account"));
        if (!credential.isUsable()) {
            throw new AuthException(userId, provider, "Reconnect required for " + provider.getWireName());
        }
        return credential;
    }

    private boolean needsRefresh(IntegrationCredential credential) {
        Instant expiry = credential.getToken().getExpiry();
        return expiry == null || expiry.isBefore(clock.instant().plus(properties.getRefreshMargin()));
    }

    private ReentrantLock lockFor(String userId, Provider provider) {
        return refreshLocks.computeIfAbsent(userId + ":" + provider.name(), key -> new ReentrantLock());
    }
}
