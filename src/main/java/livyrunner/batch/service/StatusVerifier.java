package livyrunner.batch.service;

import com.fasterxml.jackson.databind.JsonNode;
import livyrunner.batch.client.RemoteEndpointClient;
import livyrunner.batch.client.RemoteRequest;
import livyrunner.batch.client.RemoteResponse;
import livyrunner.batch.client.RemoteService;
import livyrunner.batch.client.ResponseParser;
import livyrunner.batch.error.VerificationMismatchException;
import livyrunner.batch.model.SparkJob;
import livyrunner.batch.model.VerificationBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Double-checks an application's outcome against Spark or YARN.
 *
 * Livy in YARN mode reports {@code success} even when the Spark application
 * failed, so a run can opt in to one of these secondary sources.
 */
public class StatusVerifier {

    private static final Logger log = LoggerFactory.getLogger(StatusVerifier.class);

    public static final String EXPECTED_STATUS = "SUCCEEDED";
    /** Reported as the actual status when Spark lists no jobs and that is not allowed. */
    public static final String NO_JOBS = "NO_JOBS";

    static final String SPARK_APPLICATIONS = "api/v1/applications";
    static final String YARN_APPS = "ws/v1/cluster/apps";

    private final RemoteEndpointClient client;
    private final ResponseParser parser;
    private final boolean allowEmptySparkJobs;

    public StatusVerifier(RemoteEndpointClient client, ResponseParser parser, boolean allowEmptySparkJobs) {
        this.client = client;
        this.parser = parser;
        this.allowEmptySparkJobs = allowEmptySparkJobs;
    }

    /**
     * @throws VerificationMismatchException if the backend reports anything but {@value #EXPECTED_STATUS}
     */
    public void verify(VerificationBackend backend, String applicationId) {
        switch (backend) {
            case NONE -> log.debug("No verification requested for app '{}'", applicationId);
            case SPARK -> checkSparkJobs(applicationId);
            case YARN -> checkYarnApp(applicationId);
        }
    }

    private void checkSparkJobs(String appId) {
        log.info("Getting app status (id={}) from Spark REST API...", appId);
        List<SparkJob> jobs = sparkJobs(appId);

        if (jobs.isEmpty()) {
            if (!allowEmptySparkJobs) {
                throw new VerificationMismatchException("Application '" + appId + "' has no Spark jobs, expected status is '"
                        + EXPECTED_STATUS + "'", appId, NO_JOBS, EXPECTED_STATUS);
            }
            log.warn("Application '{}' reports no Spark jobs, treating it as successful", appId);
            return;
        }

        for (SparkJob job : jobs) {
            log.info("Job id {} associated with application '{}' is '{}'", job.jobId(), appId, job.status());
            if (!EXPECTED_STATUS.equals(job.status())) {
                throw new VerificationMismatchException("Job id '" + job.jobId() + "' associated with application '"
                        + appId + "' is '" + job.status() + "', expected status is '" + EXPECTED_STATUS + "'",
                        job.jobId(), job.status(), EXPECTED_STATUS);
            }
        }
    }

    private List<SparkJob> sparkJobs(String appId) {
        RemoteResponse response = client.exchange(
                RemoteRequest.get(RemoteService.SPARK, SPARK_APPLICATIONS + "/" + appId + "/jobs"));
        JsonNode array = parser.array(response, parser.readTree(response, "", null), "", null);
        List<SparkJob> jobs = new ArrayList<>(array.size());
        for (JsonNode job : array) {
            jobs.add(new SparkJob(
                    parser.text(response, job, "jobId", null),
                    parser.text(response, job, "status", null)));
        }
        return jobs;
    }

    private void checkYarnApp(String appId) {
        log.info("Getting app status (id={}) from YARN RM REST API...", appId);
        RemoteResponse response = client.exchange(RemoteRequest.get(RemoteService.YARN, YARN_APPS + "/" + appId));
        String status = parser.text(response, "app.finalStatus");
        if (!EXPECTED_STATUS.equals(status)) {
            throw new VerificationMismatchException("YARN app " + appId + " is '" + status
                    + "', expected status is '" + EXPECTED_STATUS + "'", appId, status, EXPECTED_STATUS);
        }
        log.info("YARN app {} finished with status '{}'", appId, status);
    }
}
