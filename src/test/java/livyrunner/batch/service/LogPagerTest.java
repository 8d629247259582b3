package livyrunner.batch.service;

import livyrunner.batch.client.LivyClient;
import livyrunner.batch.client.RemoteResponse;
import livyrunner.batch.client.RemoteService;
import livyrunner.batch.client.ResponseParser;
import livyrunner.batch.error.ResponseShapeException;
import livyrunner.batch.support.ScriptedEndpointClient;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static livyrunner.batch.support.ScriptedEndpointClient.logPage;
import static livyrunner.batch.support.ScriptedEndpointClient.logPath;
import static livyrunner.batch.support.ScriptedEndpointClient.numberedLines;
import static org.junit.jupiter.api.Assertions.*;

class LogPagerTest {

    private final ScriptedEndpointClient remote = new ScriptedEndpointClient();
    private final LogPager pager = new LogPager(new LivyClient(remote, new ResponseParser(), "tester"));

    @Test
    void concatenatesPagesInOrder() {
        remote.respond(RemoteService.LIVY, "GET", logPath("8", 0), logPage(0, 250, numberedLines(0, 100)));
        remote.respond(RemoteService.LIVY, "GET", logPath("8", 100), logPage(100, 250, numberedLines(100, 100)));
        remote.respond(RemoteService.LIVY, "GET", logPath("8", 200), logPage(200, 250, numberedLines(200, 50)));

        List<String> lines = pager.lines("8").collect(Collectors.toList());

        assertEquals(250, lines.size());
        assertEquals(numberedLines(0, 250), lines);
        assertEquals(3, remote.requests().size());
    }

    @Test
    void pagesAreFetchedLazily() {
        remote.respond(RemoteService.LIVY, "GET", logPath("8", 0), logPage(0, 250, numberedLines(0, 100)));
        remote.respond(RemoteService.LIVY, "GET", logPath("8", 100), logPage(100, 250, numberedLines(100, 100)));

        Stream<String> lines = pager.lines("8");
        assertTrue(remote.requests().isEmpty());

        Iterator<String> it = lines.iterator();
        assertEquals("line 0", it.next());
        assertEquals(1, remote.requests().size());
    }

    @Test
    void followsServerReportedOffset() {
        // server trimmed the head of the log and starts at 40
        remote.respond(RemoteService.LIVY, "GET", logPath("8", 0), logPage(40, 150, numberedLines(40, 100)));
        remote.respond(RemoteService.LIVY, "GET", logPath("8", 140), logPage(140, 150, numberedLines(140, 10)));

        List<String> lines = pager.lines("8").collect(Collectors.toList());

        assertEquals(numberedLines(40, 110), lines);
    }

    @Test
    void emptyLogProducesNoLines() {
        remote.respond(RemoteService.LIVY, "GET", logPath("8", 0), logPage(0, 0, List.of()));

        assertEquals(0, pager.lines("8").count());
        assertEquals(1, remote.requests().size());
    }

    @Test
    void emptyPageBelowTotalStops() {
        remote.respond(RemoteService.LIVY, "GET", logPath("8", 0), logPage(0, 10, List.of()));

        assertEquals(0, pager.lines("8").count());
        assertEquals(1, remote.requests().size());
    }

    @Test
    void escapedNewlinesAreRendered() {
        remote.respond(RemoteService.LIVY, "GET", logPath("8", 0),
                logPage(0, 2, List.of("Exception in thread main\\n\\tat Foo.bar", "plain")));

        List<String> lines = pager.lines("8").collect(Collectors.toList());

        assertEquals("Exception in thread main\n\tat Foo.bar", lines.get(0));
        assertEquals("plain", lines.get(1));
    }

    @Test
    void malformedPageAbortsPagination() {
        remote.respond(RemoteService.LIVY, "GET", logPath("8", 0), logPage(0, 250, numberedLines(0, 100)));
        remote.respond(RemoteService.LIVY, "GET", logPath("8", 100), RemoteResponse.json("{\"from\":100,\"total\":250}"));
        remote.respond(RemoteService.LIVY, "GET", logPath("8", 200), logPage(200, 250, numberedLines(200, 50)));

        List<String> sink = new ArrayList<>();
        ResponseShapeException e = assertThrows(ResponseShapeException.class, () -> pager.drainTo("8", sink::add));

        assertEquals("$.log", e.path());
        assertEquals(2, remote.requests().size());
        assertFalse(sink.stream().anyMatch(l -> l.startsWith("-") && l.contains("End of full log")));
    }

    @Test
    void drainFramesLinesWithHeaderAndFooter() {
        remote.respond(RemoteService.LIVY, "GET", logPath("8", 0), logPage(0, 2, List.of("a", "b")));

        List<String> sink = new ArrayList<>();
        int count = pager.drainTo("8", sink::add);

        assertEquals(2, count);
        assertEquals(4, sink.size());
        assertTrue(sink.get(0).contains("Full log for batch 8"));
        assertEquals(List.of("a", "b"), sink.subList(1, 3));
        assertTrue(sink.get(3).contains("End of full log for batch 8"));
    }
}
