package livyrunner.batch.service;

import livyrunner.batch.client.LivyClient;
import livyrunner.batch.error.BatchException;
import livyrunner.batch.error.JobFailedException;
import livyrunner.batch.error.PollTimeoutException;
import livyrunner.batch.model.BatchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Polls Livy until a batch reaches a terminal state.
 *
 * The timeout is wall-clock from the first poll and is checked after each
 * non-terminal poll; a request already in flight is never cancelled.
 * Neither transport nor parse failures are retried.
 */
public class BatchPoller {

    private static final Logger log = LoggerFactory.getLogger(BatchPoller.class);

    private final LivyClient livy;
    private final Duration pollInterval;
    private final Duration timeout;
    private final Clock clock;
    private final Sleeper sleeper;

    public BatchPoller(LivyClient livy, Duration pollInterval, Duration timeout) {
        this(livy, pollInterval, timeout, Clock.systemUTC(), Sleeper.THREAD);
    }

    public BatchPoller(LivyClient livy, Duration pollInterval, Duration timeout, Clock clock, Sleeper sleeper) {
        this.livy = livy;
        this.pollInterval = pollInterval;
        this.timeout = timeout;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Block until the batch succeeds.
     *
     * @return number of polls it took
     * @throws JobFailedException   if Livy reports any terminal state other than success
     * @throws PollTimeoutException if the batch is still pending after the timeout
     */
    public int awaitCompletion(String batchId) {
        Instant start = clock.instant();
        int polls = 0;

        while (true) {
            polls++;
            log.info("Getting batch {} status...", batchId);
            String state = livy.state(batchId);

            switch (BatchState.classify(state)) {
                case SUCCEEDED -> {
                    log.info("Batch {} has finished successfully!", batchId);
                    return polls;
                }
                case FAILED -> throw new JobFailedException(batchId, state);
                case PENDING -> log.info("Batch {} has not finished yet (state is '{}')", batchId, state);
            }

            Duration elapsed = Duration.between(start, clock.instant());
            if (elapsed.compareTo(timeout) > 0) {
                throw new PollTimeoutException(batchId, timeout, state);
            }

            try {
                sleeper.sleep(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BatchException("Interrupted while waiting for batch " + batchId, e);
            }
        }
    }
}
