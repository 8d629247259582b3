package livyrunner.batch.error;

/**
 * The remote call itself could not be completed: I/O failure, interruption
 * or a non-2xx HTTP status.
 */
public class TransportException extends BatchException {

    private final int statusCode;

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public TransportException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /** HTTP status of the failed exchange, or -1 when no response was received. */
    public int statusCode() {
        return statusCode;
    }
}
