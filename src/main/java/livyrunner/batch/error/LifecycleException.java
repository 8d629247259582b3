package livyrunner.batch.error;

/**
 * The single failure surfaced by a batch lifecycle, raised after logs were
 * spilled and the batch was closed. The cause is always the original stage failure.
 */
public class LifecycleException extends RuntimeException {

    private final String batchId;

    public LifecycleException(String batchId, Throwable cause) {
        super(describe(batchId, cause), cause);
        this.batchId = batchId;
    }

    /** Batch id, or null when the batch was never submitted. */
    public String batchId() {
        return batchId;
    }

    private static String describe(String batchId, Throwable cause) {
        String prefix = batchId == null
                ? "Batch submission failed"
                : "Batch " + batchId + " lifecycle failed";
        return prefix + ": " + cause.getMessage();
    }
}
