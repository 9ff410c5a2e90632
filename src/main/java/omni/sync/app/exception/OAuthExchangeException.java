package omni.sync.app.exception;

public class OAuthExchangeException extends RuntimeException {
    public OAuthExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
