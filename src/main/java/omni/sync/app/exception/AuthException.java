package omni.sync.app.exception;

import omni.sync.app.entity.Provider;

/**
 * The credential for a user and provider is missing, revoked or cannot be refreshed.
 * The user has to reconnect; retrying does not help.
 */
public class AuthException extends RuntimeException {
    private final String userId;
    private final Provider provider;

    public AuthException(String userId, Provider provider, String message) {
        this(userId, provider, message, null);
    }

    public AuthException(String userId, Provider provider, String message, Throwable cause) {
        super(message, cause);
        this.userId = userId;
        this.provider = provider;
    }

    public String getUserId() {
        return userId;
    }

    public Provider getProvider() {
        return provider;
    }
}
