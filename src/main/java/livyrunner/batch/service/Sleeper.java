package livyrunner.batch.service;

import java.time.Duration;

/**
 * Blocks the calling thread between polls.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
