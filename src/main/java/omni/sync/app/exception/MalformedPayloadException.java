package omni.sync.app.exception;

/**
 * A single provider item could not be interpreted. The item is skipped, the batch continues.
 */
public class MalformedPayloadException extends RuntimeException {
    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
