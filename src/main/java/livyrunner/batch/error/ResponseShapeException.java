package livyrunner.batch.error;

/**
 * A response arrived but a required field was missing or had the wrong shape.
 * The message always carries the attempted path and a rendering of the body.
 */
public class ResponseShapeException extends BatchException {

    private final String path;
    private final String renderedBody;

    public ResponseShapeException(String message, String path, String renderedBody, Throwable cause) {
        super(message, cause);
        this.path = path;
        this.renderedBody = renderedBody;
    }

    /** JSON path that was looked up, e.g. {@code $.app.finalStatus}. */
    public String path() {
        return path;
    }

    public String renderedBody() {
        return renderedBody;
    }
}
