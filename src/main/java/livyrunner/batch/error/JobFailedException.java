package livyrunner.batch.error;

/**
 * Livy reported a terminal state other than {@code success}.
 */
public class JobFailedException extends BatchException {

    private final String batchId;
    private final String state;

    public JobFailedException(String batchId, String state) {
        super("Batch " + batchId + " failed with state '" + state + "'");
        this.batchId = batchId;
        this.state = state;
    }

    public String batchId() {
        return batchId;
    }

    /** The literal state string reported by Livy. */
    public String state() {
        return state;
    }
}
