package omni.sync.app.exception;

/**
 * The token endpoint rejected the grant (revoked or expired refresh token, reused code).
 */
public class InvalidGrantException extends RuntimeException {
    public InvalidGrantException(String message) {
        super(message);
    }
}
