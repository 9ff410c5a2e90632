package omni.sync.app.exception;

public class JobPayloadException extends RuntimeException {
    public JobPayloadException(String message) {
        super(message);
    }

    public JobPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
