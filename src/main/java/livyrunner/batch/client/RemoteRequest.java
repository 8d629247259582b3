package livyrunner.batch.client;

import java.util.Map;
import java.util.Objects;

/**
 * A single request against one of the remote services.
 *
 * @param service remote service the path is relative to
 * @param method  HTTP method
 * @param path    path relative to the service base URL, may carry a query string
 * @param body    request body, or null
 * @param headers extra request headers
 */
public record RemoteRequest(
        RemoteService service,
        String method,
        String path,
        String body,
        Map<String, String> headers) {

    public RemoteRequest {
        Objects.requireNonNull(service, "service is required");
        Objects.requireNonNull(method, "method is required");
        Objects.requireNonNull(path, "path is required");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static RemoteRequest get(RemoteService service, String path) {
        return new RemoteRequest(service, "GET", path, null, Map.of());
    }

    public static RemoteRequest post(RemoteService service, String path, String body, Map<String, String> headers) {
        return new RemoteRequest(service, "POST", path, body, headers);
    }

    public static RemoteRequest delete(RemoteService service, String path) {
        return new RemoteRequest(service, "DELETE", path, null, Map.of());
    }

    @Override
    public String toString() {
        return method + " " + service + " /" + path;
    }
}
