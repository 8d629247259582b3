package livyrunner.batch.error;

/**
 * Base type for failures of a single stage of a batch lifecycle
 * (transport, response shape, polling, verification).
 */
public class BatchException extends RuntimeException {

    public BatchException(String message) {
        super(message);
    }

    public BatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
