package omni.sync.app.exception;

/**
 * Failure talking to a provider or its token endpoint.
 */
public class ProviderException extends RuntimeException {
    private final int statusCode;
    private final boolean retryable;

    public ProviderException(String message, int statusCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public static ProviderException transientFailure(String message, Throwable cause) {
        return new ProviderException(message, 0, true, cause);
    }

    public static ProviderException forStatus(int statusCode, String message, Throwable cause) {
        return new ProviderException(message, statusCode, isRetryableStatus(statusCode), cause);
    }

    public static boolean isRetryableStatus(int statusCode) {
        return statusCode == 429 || statusCode == 408 || statusCode >= 500;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean isUnauthorized() {
        return statusCode == 401;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
