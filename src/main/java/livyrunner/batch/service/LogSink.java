package livyrunner.batch.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives the lines of a batch's remote log, in order.
 */
@FunctionalInterface
public interface LogSink {

    void accept(String line);

    /** Sink writing each line at INFO to the {@code livyrunner.batch.log} logger. */
    static LogSink slf4j() {
        return toLogger(LoggerFactory.getLogger("livyrunner.batch.log"));
    }

    static LogSink toLogger(Logger logger) {
        return line -> logger.info("{}", line);
    }
}
