package livyrunner.batch.client;

import com.fasterxml.jackson.databind.JsonNode;
import livyrunner.batch.error.ResponseShapeException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResponseParserTest {

    private final ResponseParser parser = new ResponseParser();

    @Test
    void readsTopLevelAndNestedFields() {
        RemoteResponse response = RemoteResponse.json("{\"state\":\"running\",\"app\":{\"finalStatus\":\"FAILED\"}}");

        assertEquals("running", parser.text(response, "state"));
        assertEquals("FAILED", parser.text(response, "app.finalStatus"));
    }

    @Test
    void numericIdIsReadAsText() {
        assertEquals("42", parser.text(RemoteResponse.json("{\"id\":42,\"state\":\"starting\"}"), "id"));
    }

    @Test
    void missingFieldNamesPathAndPrettyPrintsBody() {
        RemoteResponse response = RemoteResponse.json("{\"id\":7,\"appInfo\":{}}");

        ResponseShapeException e = assertThrows(ResponseShapeException.class,
                () -> parser.text(response, "state", "7"));

        assertEquals("$.state", e.path());
        assertTrue(e.getMessage().contains("$.state"));
        assertTrue(e.getMessage().contains("Batch id=7"));
        // pretty printed: one field per line
        assertTrue(e.renderedBody().contains("\n"), e.renderedBody());
        assertTrue(e.renderedBody().contains("\"id\" : 7"), e.renderedBody());
        assertTrue(e.getMessage().contains(e.renderedBody()));
    }

    @Test
    void nullFieldIsAShapeError() {
        RemoteResponse response = RemoteResponse.json("{\"id\":7,\"appId\":null}");

        ResponseShapeException e = assertThrows(ResponseShapeException.class,
                () -> parser.text(response, "appId", "7"));
        assertEquals("$.appId", e.path());
    }

    @Test
    void objectWhereTextExpectedIsAShapeError() {
        RemoteResponse response = RemoteResponse.json("{\"app\":{\"finalStatus\":\"SUCCEEDED\"}}");
        assertThrows(ResponseShapeException.class, () -> parser.text(response, "app"));
    }

    @Test
    void nonJsonBodyIsRenderedRaw() {
        RemoteResponse response = RemoteResponse.text(200, "<html>Bad gateway</html>");

        ResponseShapeException e = assertThrows(ResponseShapeException.class, () -> parser.text(response, "id"));

        assertEquals("<html>Bad gateway</html>", e.renderedBody());
        assertEquals("$.id", e.path());
        assertNotNull(e.getCause());
    }

    @Test
    void malformedJsonWithJsonContentTypeFallsBackToRaw() {
        RemoteResponse response = RemoteResponse.json("{\"state\": ");
        assertEquals("{\"state\": ", ResponseParser.render(response));
    }

    @Test
    void renderWithoutContentTypeIsRaw() {
        RemoteResponse response = new RemoteResponse(200, null, "{\"a\":1}");
        assertEquals("{\"a\":1}", ResponseParser.render(response));
    }

    @Test
    void integerAndTextList() {
        RemoteResponse response = RemoteResponse.json("{\"from\":100,\"total\":250,\"log\":[\"a\",\"b\"]}");
        JsonNode root = parser.readTree(response, "log", "1");

        assertEquals(100, parser.integer(response, root, "from", "1"));
        assertEquals(250, parser.integer(response, root, "total", "1"));
        assertEquals(List.of("a", "b"), parser.textList(response, root, "log", "1"));
    }

    @Test
    void textWhereIntegerExpectedIsAShapeError() {
        RemoteResponse response = RemoteResponse.json("{\"from\":\"zero\"}");
        JsonNode root = parser.readTree(response, "from", null);

        ResponseShapeException e = assertThrows(ResponseShapeException.class,
                () -> parser.integer(response, root, "from", null));
        assertEquals("$.from", e.path());
    }

    @Test
    void rootPathAddressesDocument() {
        RemoteResponse response = RemoteResponse.json("[{\"jobId\":1}]");
        JsonNode root = parser.readTree(response, "", null);

        assertEquals(1, parser.array(response, root, "", null).size());
        assertEquals("$", ResponseParser.jsonPath(""));
    }

    @Test
    void emptyBodyIsAShapeError() {
        assertThrows(ResponseShapeException.class, () -> parser.text(RemoteResponse.json(""), "id"));
    }
}
