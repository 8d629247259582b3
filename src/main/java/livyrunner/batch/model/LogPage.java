package livyrunner.batch.model;

import java.util.List;

/**
 * One window of batch log output as returned by {@code GET /batches/{id}/log}.
 *
 * @param from  offset of the first returned line
 * @param total total number of lines the server knows about
 * @param lines raw log lines, in order
 */
public record LogPage(int from, int total, List<String> lines) {

    public LogPage {
        lines = List.copyOf(lines);
    }

    /** Offset to request next. */
    public int nextOffset() {
        return from + lines.size();
    }

    public boolean isLast() {
        return nextOffset() >= total;
    }
}
