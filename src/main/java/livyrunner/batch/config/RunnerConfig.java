package livyrunner.batch.config;

import livyrunner.batch.client.RemoteService;
import livyrunner.batch.model.LogPolicy;
import livyrunner.batch.model.VerificationBackend;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for a batch runner.
 * All settings have sensible defaults.
 */
public final class RunnerConfig {

    // Endpoints
    private EndpointConfig livy = EndpointConfig.of("http://localhost:8998");
    private EndpointConfig spark = EndpointConfig.of("http://localhost:18080");
    private EndpointConfig yarn = EndpointConfig.of("http://localhost:8088");

    // Polling
    private Duration pollInterval = Duration.ofSeconds(20);
    private Duration timeout = Duration.ofMinutes(10);

    // Lifecycle
    private VerificationBackend verificationBackend = VerificationBackend.NONE;
    private LogPolicy logPolicy = LogPolicy.ALWAYS;
    private boolean allowEmptySparkJobs = true;

    // Transport
    private Duration requestTimeout = Duration.ofSeconds(60);
    private String requestedBy = "livy-batch-runner";

    private RunnerConfig() {
    }

    public static RunnerConfig defaults() {
        return new RunnerConfig();
    }

    public static RunnerConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static RunnerConfig fromEnv(Map<String, String> env) {
        RunnerConfig config = new RunnerConfig();

        String livyUrl = env.get("LIVY_URL");
        if (livyUrl != null && !livyUrl.isBlank()) {
            config.livy = EndpointConfig.of(livyUrl);
        }

        String sparkUrl = env.get("SPARK_URL");
        if (sparkUrl != null && !sparkUrl.isBlank()) {
            config.spark = EndpointConfig.of(sparkUrl);
        }

        String yarnUrl = env.get("YARN_URL");
        if (yarnUrl != null && !yarnUrl.isBlank()) {
            config.yarn = EndpointConfig.of(yarnUrl);
        }

        String pollSec = env.get("LIVY_POLL_INTERVAL_SEC");
        if (pollSec != null && !pollSec.isBlank()) {
            config.withPollInterval(Duration.ofSeconds(Long.parseLong(pollSec.trim())));
        }

        String timeoutMin = env.get("LIVY_TIMEOUT_MIN");
        if (timeoutMin != null && !timeoutMin.isBlank()) {
            config.withTimeout(Duration.ofMinutes(Long.parseLong(timeoutMin.trim())));
        }

        String verifyIn = env.get("LIVY_VERIFY_IN");
        if (verifyIn != null) {
            config.verificationBackend = VerificationBackend.parse(verifyIn);
        }

        String logPolicy = env.get("LIVY_LOG_POLICY");
        if (logPolicy != null) {
            config.logPolicy = LogPolicy.parse(logPolicy);
        }

        return config;
    }

    // Getters
    public EndpointConfig livy() {
        return livy;
    }

    public EndpointConfig spark() {
        return spark;
    }

    public EndpointConfig yarn() {
        return yarn;
    }

    public EndpointConfig endpoint(RemoteService service) {
        return switch (service) {
            case LIVY -> livy;
            case SPARK -> spark;
            case YARN -> yarn;
        };
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration timeout() {
        return timeout;
    }

    public VerificationBackend verificationBackend() {
        return verificationBackend;
    }

    public LogPolicy logPolicy() {
        return logPolicy;
    }

    public boolean allowEmptySparkJobs() {
        return allowEmptySparkJobs;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public String requestedBy() {
        return requestedBy;
    }

    // Fluent setters for testing/customization
    public RunnerConfig withLivy(EndpointConfig livy) {
        this.livy = livy;
        return this;
    }

    public RunnerConfig withSpark(EndpointConfig spark) {
        this.spark = spark;
        return this;
    }

    public RunnerConfig withYarn(EndpointConfig yarn) {
        this.yarn = yarn;
        return this;
    }

    public RunnerConfig withPollInterval(Duration pollInterval) {
        if (pollInterval.isNegative()) {
            throw new IllegalArgumentException("poll interval must not be negative: " + pollInterval);
        }
        this.pollInterval = pollInterval;
        return this;
    }

    public RunnerConfig withTimeout(Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.timeout = timeout;
        return this;
    }

    public RunnerConfig withVerificationBackend(VerificationBackend backend) {
        this.verificationBackend = backend;
        return this;
    }

    public RunnerConfig withLogPolicy(LogPolicy logPolicy) {
        this.logPolicy = logPolicy;
        return this;
    }

    public RunnerConfig withAllowEmptySparkJobs(boolean allow) {
        this.allowEmptySparkJobs = allow;
        return this;
    }

    public RunnerConfig withRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        return this;
    }

    public RunnerConfig withRequestedBy(String requestedBy) {
        this.requestedBy = requestedBy;
        return this;
    }

    @Override
    public String toString() {
        return "RunnerConfig{" +
                "livy='" + livy.baseUrl() + '\'' +
                ", pollInterval=" + pollInterval +
                ", timeout=" + timeout +
                ", verifyIn=" + verificationBackend +
                ", logPolicy=" + logPolicy +
                '}';
    }
}
