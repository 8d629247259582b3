package livyrunner.batch.client;

import java.util.List;
import java.util.Map;

/**
 * Status, headers and body of a completed remote exchange.
 */
public record RemoteResponse(int statusCode, Map<String, List<String>> headers, String body) {

    public RemoteResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? "" : body;
    }

    public static RemoteResponse json(int statusCode, String body) {
        return new RemoteResponse(statusCode, Map.of("Content-Type", List.of("application/json")), body);
    }

    public static RemoteResponse json(String body) {
        return json(200, body);
    }

    public static RemoteResponse text(int statusCode, String body) {
        return new RemoteResponse(statusCode, Map.of("Content-Type", List.of("text/plain")), body);
    }

    /** First value of a header, matched case-insensitively, or null. */
    public String header(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }

    public String contentType() {
        return header("Content-Type");
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
