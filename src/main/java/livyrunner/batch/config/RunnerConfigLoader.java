package livyrunner.batch.config;

import livyrunner.batch.model.LogPolicy;
import livyrunner.batch.model.VerificationBackend;
import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.time.Duration;

/**
 * Loads runner settings from an INI file.
 * Supports sections [LIVY], [SPARK], [YARN] (each with {@code url}) and [BATCH].
 * Missing sections and keys keep their defaults.
 *
 * <pre>
 * [LIVY]
 * url = http://livy:8998
 *
 * [BATCH]
 * poll_interval_sec = 20
 * timeout_minutes   = 10
 * verify_in         = yarn
 * log_policy        = on_failure
 * </pre>
 */
public final class RunnerConfigLoader {

    private RunnerConfigLoader() {
    }

    /**
     * @throws IOException              if the file can not be read
     * @throws IllegalArgumentException if a value is invalid (unknown verification method, bad number or flag)
     */
    public static RunnerConfig load(File file) throws IOException {
        return apply(new Ini(file), RunnerConfig.defaults());
    }

    static RunnerConfig apply(Ini ini, RunnerConfig cfg) {
        Profile.Section livy = ini.get("LIVY");
        Profile.Section spark = ini.get("SPARK");
        Profile.Section yarn = ini.get("YARN");
        Profile.Section batch = ini.get("BATCH");

        String livyUrl = opt(livy, "url");
        if (livyUrl != null) cfg.withLivy(EndpointConfig.of(livyUrl));
        String sparkUrl = opt(spark, "url");
        if (sparkUrl != null) cfg.withSpark(EndpointConfig.of(sparkUrl));
        String yarnUrl = opt(yarn, "url");
        if (yarnUrl != null) cfg.withYarn(EndpointConfig.of(yarnUrl));

        if (batch == null) {
            return cfg;
        }

        String poll = opt(batch, "poll_interval_sec");
        if (poll != null) cfg.withPollInterval(Duration.ofSeconds(toLong("poll_interval_sec", poll)));

        String timeout = opt(batch, "timeout_minutes");
        if (timeout != null) cfg.withTimeout(Duration.ofMinutes(toLong("timeout_minutes", timeout)));

        String requestTimeout = opt(batch, "request_timeout_sec");
        if (requestTimeout != null) {
            cfg.withRequestTimeout(Duration.ofSeconds(toLong("request_timeout_sec", requestTimeout)));
        }

        // rejected here rather than when the lifecycle runs
        cfg.withVerificationBackend(VerificationBackend.parse(opt(batch, "verify_in")));
        cfg.withLogPolicy(LogPolicy.parse(opt(batch, "log_policy")));

        String requestedBy = opt(batch, "requested_by");
        if (requestedBy != null) cfg.withRequestedBy(requestedBy);

        String allowEmpty = opt(batch, "allow_empty_spark_jobs");
        if (allowEmpty != null) cfg.withAllowEmptySparkJobs(toBoolean("allow_empty_spark_jobs", allowEmpty));

        return cfg;
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        if (s == null) return null;
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static boolean toBoolean(String key, String value) {
        if ("true".equalsIgnoreCase(value)) return true;
        if ("false".equalsIgnoreCase(value)) return false;
        throw new IllegalArgumentException(key + " must be true or false, got '" + value + "'");
    }

    private static long toLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a whole number, got '" + value + "'", e);
        }
    }
}
