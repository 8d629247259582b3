package livyrunner.batch.service;

import livyrunner.batch.client.LivyClient;
import livyrunner.batch.model.LogPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Reads the complete log of a batch, {@value #PAGE_LINES} lines per request.
 */
public class LogPager {

    private static final Logger log = LoggerFactory.getLogger(LogPager.class);

    public static final int PAGE_LINES = 100;
    private static final String DASHES = "-".repeat(50);

    private final LivyClient livy;

    public LogPager(LivyClient livy) {
        this.livy = livy;
    }

    /**
     * Lazy stream of the batch's log lines in original order. Pages are fetched
     * as the stream is consumed; the stream can be consumed only once.
     * A malformed page aborts the stream with a ResponseShapeException.
     */
    public Stream<String> lines(String batchId) {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(new PageIterator(batchId),
                        Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    /**
     * Write the full log to {@code sink}, framed by header and footer lines.
     *
     * @return number of log lines written, frame excluded
     */
    public int drainTo(String batchId, LogSink sink) {
        sink.accept(DASHES + "Full log for batch " + batchId + DASHES);
        int[] count = {0};
        try (Stream<String> lines = lines(batchId)) {
            lines.forEach(line -> {
                sink.accept(line);
                count[0]++;
            });
        }
        sink.accept(DASHES + "End of full log for batch " + batchId + DASHES);
        return count[0];
    }

    /** Livy escapes newlines inside a line; render them as real line breaks. */
    static String unescape(String line) {
        return line.replace("\\n", "\n");
    }

    private final class PageIterator implements Iterator<String> {
        private final String batchId;
        private final Deque<String> buffered = new ArrayDeque<>();
        private int nextOffset = 0;
        private boolean exhausted = false;

        PageIterator(String batchId) {
            this.batchId = batchId;
        }

        @Override
        public boolean hasNext() {
            while (buffered.isEmpty() && !exhausted) {
                fetch();
            }
            return !buffered.isEmpty();
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more log lines for batch " + batchId);
            }
            return buffered.removeFirst();
        }

        private void fetch() {
            LogPage page = livy.logPage(batchId, nextOffset, PAGE_LINES);
            for (String line : page.lines()) {
                buffered.addLast(unescape(line));
            }
            if (page.isLast()) {
                exhausted = true;
            } else if (page.lines().isEmpty()) {
                log.warn("Batch {} log stopped at line {} of {}: server returned an empty page",
                        batchId, page.from(), page.total());
                exhausted = true;
            } else {
                nextOffset = page.nextOffset();
            }
        }
    }
}
