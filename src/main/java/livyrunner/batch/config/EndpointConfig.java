package livyrunner.batch.config;

import java.net.URI;
import java.util.Objects;

/**
 * Connection identity of one remote service: its base URL.
 */
public record EndpointConfig(String baseUrl) {

    public EndpointConfig {
        Objects.requireNonNull(baseUrl, "baseUrl is required");
        if (baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl must not be blank");
        }
        URI.create(baseUrl);
        baseUrl = baseUrl.trim();
    }

    public static EndpointConfig of(String baseUrl) {
        return new EndpointConfig(baseUrl);
    }

    /** Resolve a path (optionally with a query string) against the base URL. */
    public URI resolve(String path) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String relative = path.startsWith("/") ? path.substring(1) : path;
        return URI.create(base + "/" + relative);
    }
}
