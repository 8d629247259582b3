package livyrunner.batch.config;

import livyrunner.batch.client.HttpRemoteEndpointClient;
import livyrunner.batch.client.LivyClient;
import livyrunner.batch.client.RemoteEndpointClient;
import livyrunner.batch.client.ResponseParser;
import livyrunner.batch.service.BatchPoller;
import livyrunner.batch.service.JobLifecycleOrchestrator;
import livyrunner.batch.service.LogPager;
import livyrunner.batch.service.LogSink;
import livyrunner.batch.service.StatusVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires the lifecycle collaborators from a {@link RunnerConfig}.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(RunnerConfig.fromEnv());
 * String batchId = deps.orchestrator().run(submission);
 * </pre>
 */
public final class Dependencies {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final RunnerConfig config;
    private final RemoteEndpointClient client;
    private final ResponseParser parser;
    private final LivyClient livyClient;
    private final BatchPoller poller;
    private final StatusVerifier verifier;
    private final LogPager logPager;
    private final JobLifecycleOrchestrator orchestrator;

    private Dependencies(RunnerConfig config, RemoteEndpointClient client, LogSink logSink) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Transport
        this.client = client;
        this.parser = new ResponseParser();
        this.livyClient = new LivyClient(client, parser, config.requestedBy());

        // Lifecycle stages
        this.poller = new BatchPoller(livyClient, config.pollInterval(), config.timeout());
        this.verifier = new StatusVerifier(client, parser, config.allowEmptySparkJobs());
        this.logPager = new LogPager(livyClient);

        this.orchestrator = new JobLifecycleOrchestrator(livyClient, poller, verifier, logPager, logSink,
                config.verificationBackend(), config.logPolicy());
    }

    /**
     * Create dependencies talking HTTP, spilling batch logs through slf4j.
     */
    public static Dependencies create(RunnerConfig config) {
        return new Dependencies(config, new HttpRemoteEndpointClient(config), LogSink.slf4j());
    }

    /**
     * Create dependencies on top of an existing transport and log sink.
     */
    public static Dependencies create(RunnerConfig config, RemoteEndpointClient client, LogSink logSink) {
        return new Dependencies(config, client, logSink);
    }

    // Getters
    public RunnerConfig config() {
        return config;
    }

    public RemoteEndpointClient client() {
        return client;
    }

    public ResponseParser parser() {
        return parser;
    }

    public LivyClient livyClient() {
        return livyClient;
    }

    public BatchPoller poller() {
        return poller;
    }

    public StatusVerifier verifier() {
        return verifier;
    }

    public LogPager logPager() {
        return logPager;
    }

    public JobLifecycleOrchestrator orchestrator() {
        return orchestrator;
    }
}
