package livyrunner.batch.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import livyrunner.batch.model.JobSubmission;
import livyrunner.batch.model.LogPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Calls of the Livy batch REST API.
 *
 * @see <a href="https://livy.incubator.apache.org/docs/latest/rest-api.html">Livy REST API</a>
 */
public class LivyClient {

    private static final Logger log = LoggerFactory.getLogger(LivyClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String BATCHES = "batches";

    private final RemoteEndpointClient client;
    private final ResponseParser parser;
    private final String requestedBy;

    public LivyClient(RemoteEndpointClient client, ResponseParser parser, String requestedBy) {
        this.client = client;
        this.parser = parser;
        this.requestedBy = requestedBy;
    }

    /**
     * POST the submission and return the id Livy assigned to the new batch.
     */
    public String submit(JobSubmission submission) {
        Map<String, Object> payload = submission.toPayload();
        String body;
        String pretty;
        try {
            body = MAPPER.writeValueAsString(payload);
            pretty = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Can not serialize batch payload: " + e.getMessage(), e);
        }
        log.info("Submitting the batch to Livy... Payload:\n{}", pretty);

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-Requested-By", requestedBy);
        headers.put("Content-Type", "application/json");
        RemoteResponse response = client.exchange(RemoteRequest.post(RemoteService.LIVY, BATCHES, body, headers));
        return parser.text(response, "id");
    }

    /** Raw Livy state of the batch, e.g. {@code running} or {@code dead}. */
    public String state(String batchId) {
        RemoteResponse response = client.exchange(RemoteRequest.get(RemoteService.LIVY, batchPath(batchId)));
        return parser.text(response, "state", batchId);
    }

    /** Id of the Spark application backing the batch. */
    public String applicationId(String batchId) {
        log.info("Getting Spark app id from Livy API for batch {}...", batchId);
        RemoteResponse response = client.exchange(RemoteRequest.get(RemoteService.LIVY, batchPath(batchId)));
        return parser.text(response, "appId", batchId);
    }

    public LogPage logPage(String batchId, int from, int size) {
        String path = batchPath(batchId) + "/log?from=" + from + "&size=" + size;
        RemoteResponse response = client.exchange(RemoteRequest.get(RemoteService.LIVY, path));
        JsonNode page = parser.readTree(response, "log", batchId);
        List<String> lines = parser.textList(response, page, "log", batchId);
        int actualFrom = parser.integer(response, page, "from", batchId);
        int total = parser.integer(response, page, "total", batchId);
        return new LogPage(actualFrom, total, lines);
    }

    /** DELETE the batch. No response body is required. */
    public void close(String batchId) {
        log.info("Closing batch with id = {}", batchId);
        client.exchange(RemoteRequest.delete(RemoteService.LIVY, batchPath(batchId)));
        log.info("Batch {} has been closed", batchId);
    }

    private static String batchPath(String batchId) {
        return BATCHES + "/" + batchId;
    }
}
