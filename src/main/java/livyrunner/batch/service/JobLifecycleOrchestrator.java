package livyrunner.batch.service;

import livyrunner.batch.client.LivyClient;
import livyrunner.batch.error.LifecycleException;
import livyrunner.batch.model.JobSubmission;
import livyrunner.batch.model.LogPolicy;
import livyrunner.batch.model.VerificationBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one Livy batch from submission to cleanup.
 *
 * <ol>
 * <li>Submit the batch.</li>
 * <li>Poll Livy until it is finished.</li>
 * <li>If a verification backend is selected, look up the Spark application and
 * check it there; its verdict overrides Livy's success.</li>
 * <li>Spill the batch log according to the {@link LogPolicy}, then close the batch.</li>
 * </ol>
 *
 * Once a batch id exists, step 4 runs on every exit path and the batch is closed
 * exactly once, also when the thread was interrupted; the interrupt flag is
 * cleared for cleanup and restored before returning. Any failure is rethrown as a single {@link LifecycleException}
 * after cleanup, with the first failure as its cause and later cleanup failures
 * attached as suppressed exceptions. Nothing is retried here.
 */
public class JobLifecycleOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(JobLifecycleOrchestrator.class);

    private final LivyClient livy;
    private final BatchPoller poller;
    private final StatusVerifier verifier;
    private final LogPager logPager;
    private final LogSink logSink;
    private final VerificationBackend defaultBackend;
    private final LogPolicy logPolicy;

    public JobLifecycleOrchestrator(LivyClient livy,
            BatchPoller poller,
            StatusVerifier verifier,
            LogPager logPager,
            LogSink logSink,
            VerificationBackend defaultBackend,
            LogPolicy logPolicy) {
        this.livy = livy;
        this.poller = poller;
        this.verifier = verifier;
        this.logPager = logPager;
        this.logSink = logSink;
        this.defaultBackend = defaultBackend;
        this.logPolicy = logPolicy;
    }

    /**
     * Run with the verification backend chosen at construction.
     *
     * @return id of the batch, which is closed by the time this returns
     */
    public String run(JobSubmission submission) {
        return run(submission, defaultBackend);
    }

    /**
     * @param backend verification backend for this run only
     * @return id of the batch, which is closed by the time this returns
     * @throws LifecycleException if any stage failed
     */
    public String run(JobSubmission submission, VerificationBackend backend) {
        String batchId;
        try {
            batchId = livy.submit(submission);
        } catch (RuntimeException e) {
            log.error("Batch submission failed: {}", e.getMessage());
            throw new LifecycleException(null, e);
        }
        log.info("Batch successfully submitted with id = {}.", batchId);

        RuntimeException failure = null;
        try {
            observe(batchId, backend);
        } catch (RuntimeException e) {
            log.error("Batch {} failed: {}", batchId, e.getMessage());
            failure = e;
        } finally {
            // HTTP calls fail fast on an interrupted thread
            boolean interrupted = Thread.interrupted();
            failure = release(batchId, failure);
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        if (failure != null) {
            throw new LifecycleException(batchId, failure);
        }
        return batchId;
    }

    private void observe(String batchId, VerificationBackend backend) {
        poller.awaitCompletion(batchId);
        if (!backend.isEnabled()) {
            return;
        }

        log.info("Additionally verifying status for batch id {} via {}...", batchId, backend);
        String appId = livy.applicationId(batchId);
        log.info("Found app id '{}' for batch id {}.", appId, batchId);
        verifier.verify(backend, appId);
        log.info("App '{}' associated with batch {} completed!", appId, batchId);
    }

    /**
     * Spill logs if the policy asks for it, then close the batch. Returns the
     * failure to report: the primary one if any, otherwise the first cleanup failure.
     */
    private RuntimeException release(String batchId, RuntimeException failure) {
        if (logPolicy.shouldSpill(failure != null)) {
            try {
                logPager.drainTo(batchId, logSink);
            } catch (RuntimeException e) {
                log.warn("Could not retrieve full log for batch {}: {}", batchId, e.getMessage());
                failure = merge(failure, e);
            }
        }

        try {
            livy.close(batchId);
        } catch (RuntimeException e) {
            log.error("Failed to close batch {}: {}", batchId, e.getMessage());
            failure = merge(failure, e);
        }
        return failure;
    }

    private static RuntimeException merge(RuntimeException primary, RuntimeException secondary) {
        if (primary == null) {
            return secondary;
        }
        primary.addSuppressed(secondary);
        return primary;
    }
}
