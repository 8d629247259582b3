package livyrunner.batch.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import livyrunner.batch.error.ResponseShapeException;
import livyrunner.batch.model.JobSubmission;
import livyrunner.batch.model.LogPage;
import livyrunner.batch.support.ScriptedEndpointClient;
import org.junit.jupiter.api.Test;

import java.util.List;

import static livyrunner.batch.support.ScriptedEndpointClient.logPage;
import static livyrunner.batch.support.ScriptedEndpointClient.logPath;
import static org.junit.jupiter.api.Assertions.*;

class LivyClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ScriptedEndpointClient remote = new ScriptedEndpointClient();
    private final LivyClient livy = new LivyClient(remote, new ResponseParser(), "tester");

    @Test
    void submitPostsOnlySetFieldsWithHeaders() throws Exception {
        remote.respond(RemoteService.LIVY, "POST", "batches",
                RemoteResponse.json(201, "{\"id\":42,\"state\":\"starting\"}"));

        String id = livy.submit(JobSubmission.builder().file("job.py").queue("etl").build());

        assertEquals("42", id);
        RemoteRequest request = remote.requests().get(0);
        assertEquals("tester", request.headers().get("X-Requested-By"));
        assertEquals("application/json", request.headers().get("Content-Type"));

        JsonNode body = mapper.readTree(request.body());
        assertEquals(2, body.size());
        assertEquals("job.py", body.get("file").asText());
        assertEquals("etl", body.get("queue").asText());
    }

    @Test
    void submitWithoutIdFails() {
        remote.respond(RemoteService.LIVY, "POST", "batches", RemoteResponse.json(201, "{\"state\":\"starting\"}"));

        ResponseShapeException e = assertThrows(ResponseShapeException.class,
                () -> livy.submit(JobSubmission.builder().file("job.py").build()));
        assertEquals("$.id", e.path());
    }

    @Test
    void stateAndApplicationId() {
        remote.respond(RemoteService.LIVY, "GET", "batches/3",
                ScriptedEndpointClient.batchWithApp("3", "success", "application_1_0003"));

        assertEquals("success", livy.state("3"));
        assertEquals("application_1_0003", livy.applicationId("3"));
    }

    @Test
    void logPageRequestsWindowAndParsesMetadata() {
        remote.respond(RemoteService.LIVY, "GET", logPath("5", 100), logPage(100, 102, List.of("a", "b")));

        LogPage page = livy.logPage("5", 100, 100);

        assertEquals(100, page.from());
        assertEquals(102, page.total());
        assertEquals(List.of("a", "b"), page.lines());
        assertTrue(page.isLast());
    }

    @Test
    void logPageWithoutTotalFails() {
        remote.respond(RemoteService.LIVY, "GET", logPath("5", 0),
                RemoteResponse.json("{\"from\":0,\"log\":[\"a\"]}"));

        ResponseShapeException e = assertThrows(ResponseShapeException.class, () -> livy.logPage("5", 0, 100));
        assertEquals("$.total", e.path());
    }

    @Test
    void closeIssuesDelete() {
        remote.respond(RemoteService.LIVY, "DELETE", "batches/9", RemoteResponse.json("{\"msg\":\"deleted\"}"));

        livy.close("9");

        assertEquals(1, remote.count("DELETE", "batches/9"));
    }
}
