package livyrunner.batch.error;

import java.time.Duration;

/**
 * Polling ran out of its wall-clock budget before the batch reached a terminal state.
 */
public class PollTimeoutException extends BatchException {

    private final String batchId;
    private final Duration timeout;

    public PollTimeoutException(String batchId, Duration timeout, String lastState) {
        super("Batch " + batchId + " did not finish within " + timeout.toSeconds()
                + "s (last state '" + lastState + "')");
        this.batchId = batchId;
        this.timeout = timeout;
    }

    public String batchId() {
        return batchId;
    }

    public Duration timeout() {
        return timeout;
    }
}
