package livyrunner.batch.model;

import java.util.Set;

/**
 * Classification of the raw Livy batch state as seen by the poller.
 */
public enum BatchState {
    /** Not finished yet, keep polling */
    PENDING,
    /** Terminal: Livy reported {@code success} */
    SUCCEEDED,
    /** Terminal: any other state */
    FAILED;

    private static final Set<String> PENDING_STATES = Set.of("not_started", "starting", "recovering", "running");
    private static final String SUCCESS_STATE = "success";

    /**
     * Classify a raw state string. Unknown values are terminal failures.
     */
    public static BatchState classify(String rawState) {
        if (rawState == null) {
            return FAILED;
        }
        if (PENDING_STATES.contains(rawState)) {
            return PENDING;
        }
        return SUCCESS_STATE.equals(rawState) ? SUCCEEDED : FAILED;
    }
}
