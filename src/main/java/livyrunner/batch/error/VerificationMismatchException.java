package livyrunner.batch.error;

/**
 * A secondary status source disagreed with the expected final status.
 */
public class VerificationMismatchException extends BatchException {

    private final String subjectId;
    private final String actualStatus;
    private final String expectedStatus;

    public VerificationMismatchException(String message, String subjectId,
            String actualStatus, String expectedStatus) {
        super(message);
        this.subjectId = subjectId;
        this.actualStatus = actualStatus;
        this.expectedStatus = expectedStatus;
    }

    /** Spark job id or YARN application id that carried the wrong status. */
    public String subjectId() {
        return subjectId;
    }

    public String actualStatus() {
        return actualStatus;
    }

    public String expectedStatus() {
        return expectedStatus;
    }
}
