package livyrunner.batch.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import livyrunner.batch.error.ResponseShapeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts fields from JSON response bodies by dotted path ({@code "state"},
 * {@code "app.finalStatus"}). An empty path addresses the document root.
 *
 * Any missing, null or wrongly typed field raises {@link ResponseShapeException}
 * naming the JSON path and showing the body that was actually received.
 */
public class ResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ResponseParser.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Read a scalar (string or number) as text. */
    public String text(RemoteResponse response, String path) {
        return text(response, path, null);
    }

    public String text(RemoteResponse response, String path, String batchId) {
        return text(response, readTree(response, path, batchId), path, batchId);
    }

    /** Read a scalar below an already parsed node of {@code response}. */
    public String text(RemoteResponse response, JsonNode node, String path, String batchId) {
        JsonNode value = at(response, node, path, batchId);
        if (!value.isValueNode()) {
            throw shapeError(response, path, batchId, "expected a text value but found " + value.getNodeType(), null);
        }
        return value.asText();
    }

    public int integer(RemoteResponse response, JsonNode node, String path, String batchId) {
        JsonNode value = at(response, node, path, batchId);
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw shapeError(response, path, batchId, "expected an integer but found " + value.getNodeType(), null);
        }
        return value.intValue();
    }

    public List<String> textList(RemoteResponse response, JsonNode node, String path, String batchId) {
        JsonNode value = array(response, node, path, batchId);
        List<String> result = new ArrayList<>(value.size());
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw shapeError(response, path, batchId, "expected an array of strings", null);
            }
            result.add(item.textValue());
        }
        return result;
    }

    public JsonNode array(RemoteResponse response, JsonNode node, String path, String batchId) {
        JsonNode value = at(response, node, path, batchId);
        if (!value.isArray()) {
            throw shapeError(response, path, batchId, "expected an array but found " + value.getNodeType(), null);
        }
        return value;
    }

    /**
     * Parse the whole body. {@code path} is only used to describe the failure.
     */
    public JsonNode readTree(RemoteResponse response, String path, String batchId) {
        try {
            JsonNode root = MAPPER.readTree(response.body());
            if (root == null || root.isMissingNode()) {
                throw shapeError(response, path, batchId, "empty response body", null);
            }
            return root;
        } catch (JsonProcessingException e) {
            throw shapeError(response, path, batchId, "body is not valid JSON", e);
        }
    }

    private JsonNode at(RemoteResponse response, JsonNode node, String path, String batchId) {
        JsonNode current = node;
        if (path != null && !path.isEmpty()) {
            for (String field : path.split("\\.")) {
                current = current.path(field);
            }
        }
        if (current.isMissingNode() || current.isNull()) {
            throw shapeError(response, path, batchId, "field is missing", null);
        }
        return current;
    }

    private ResponseShapeException shapeError(RemoteResponse response, String path, String batchId,
            String reason, Throwable cause) {
        String rendered = render(response);
        StringBuilder msg = new StringBuilder("Can not parse JSON response (").append(reason).append(").");
        if (batchId != null) {
            msg.append(" Batch id=").append(batchId).append('.');
        }
        msg.append("\nTried to find JSON path: ").append(jsonPath(path))
                .append(", but response was:\n").append(rendered);
        log.error(msg.toString());
        return new ResponseShapeException(msg.toString(), jsonPath(path), rendered, cause);
    }

    /** {@code "app.finalStatus"} becomes {@code "$.app.finalStatus"}, the root is {@code "$"}. */
    public static String jsonPath(String path) {
        return path == null || path.isEmpty() ? "$" : "$." + path;
    }

    /**
     * Human-readable body: pretty-printed when the content type says JSON,
     * raw otherwise or when pretty printing fails. Never throws.
     */
    public static String render(RemoteResponse response) {
        String body = response.body();
        String contentType = response.contentType();
        if (contentType == null || !contentType.contains("application/json")) {
            return body;
        }
        try {
            JsonNode tree = MAPPER.readTree(body);
            if (tree == null || tree.isMissingNode()) {
                return body;
            }
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(tree);
        } catch (Exception e) {
            return body;
        }
    }
}
