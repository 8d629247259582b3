package livyrunner.batch.client;

import livyrunner.batch.config.RunnerConfig;
import livyrunner.batch.error.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;

/**
 * {@link RemoteEndpointClient} on top of the JDK {@link HttpClient}.
 * Each {@link RemoteService} is resolved against its configured base URL.
 * Non-2xx answers are reported as {@link TransportException}.
 */
public class HttpRemoteEndpointClient implements RemoteEndpointClient {

    private static final Logger log = LoggerFactory.getLogger(HttpRemoteEndpointClient.class);

    private final HttpClient httpClient;
    private final RunnerConfig config;

    public HttpRemoteEndpointClient(RunnerConfig config) {
        this(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(config.requestTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), config);
    }

    public HttpRemoteEndpointClient(HttpClient httpClient, RunnerConfig config) {
        this.httpClient = httpClient;
        this.config = config;
    }

    @Override
    public RemoteResponse exchange(RemoteRequest request) {
        URI uri = config.endpoint(request.service()).resolve(request.path());
        HttpRequest.BodyPublisher publisher = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(request.body());

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(config.requestTimeout())
                .method(request.method(), publisher);
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }

        log.debug("{} {}", request.method(), uri);
        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransportException(request.method() + " " + uri + " failed: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(request.method() + " " + uri + " was interrupted", e);
        }

        RemoteResponse remote = new RemoteResponse(response.statusCode(), response.headers().map(), response.body());
        if (!remote.isSuccessful()) {
            throw new TransportException(request.method() + " " + uri + " returned HTTP "
                    + remote.statusCode() + ": " + remote.body(), remote.statusCode());
        }
        return remote;
    }
}
