package livyrunner.batch.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable set of optional Livy batch parameters.
 *
 * Every field is optional. {@link #toPayload()} writes a field only when it is set:
 * strings must be non-blank, lists and maps non-empty, integers non-null.
 * Zero is a valid integer value and is sent as-is.
 *
 * A submission can be read from a JSON document using the Livy payload keys,
 * so a submission file is simply a Livy request body. Unknown keys are rejected.
 */
@JsonDeserialize(builder = JobSubmission.Builder.class)
public final class JobSubmission {
    private final String file;
    private final String proxyUser;
    private final String className;
    private final List<String> arguments;
    private final List<String> jars;
    private final List<String> pyFiles;
    private final List<String> files;
    private final String driverMemory;
    private final Integer driverCores;
    private final String executorMemory;
    private final Integer executorCores;
    private final Integer numExecutors;
    private final List<String> archives;
    private final String queue;
    private final String name;
    private final Map<String, String> conf;

    private JobSubmission(Builder builder) {
        this.file = builder.file;
        this.proxyUser = builder.proxyUser;
        this.className = builder.className;
        this.arguments = copy(builder.arguments);
        this.jars = copy(builder.jars);
        this.pyFiles = copy(builder.pyFiles);
        this.files = copy(builder.files);
        this.driverMemory = builder.driverMemory;
        this.driverCores = nonNegative("driverCores", builder.driverCores);
        this.executorMemory = builder.executorMemory;
        this.executorCores = nonNegative("executorCores", builder.executorCores);
        this.numExecutors = nonNegative("numExecutors", builder.numExecutors);
        this.archives = copy(builder.archives);
        this.queue = builder.queue;
        this.name = builder.name;
        this.conf = builder.conf == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(builder.conf));
    }

    // Getters
    public String file() {
        return file;
    }

    public String proxyUser() {
        return proxyUser;
    }

    public String className() {
        return className;
    }

    public List<String> arguments() {
        return arguments;
    }

    public List<String> jars() {
        return jars;
    }

    public List<String> pyFiles() {
        return pyFiles;
    }

    public List<String> files() {
        return files;
    }

    public String driverMemory() {
        return driverMemory;
    }

    public Integer driverCores() {
        return driverCores;
    }

    public String executorMemory() {
        return executorMemory;
    }

    public Integer executorCores() {
        return executorCores;
    }

    public Integer numExecutors() {
        return numExecutors;
    }

    public List<String> archives() {
        return archives;
    }

    public String queue() {
        return queue;
    }

    public String name() {
        return name;
    }

    public Map<String, String> conf() {
        return conf;
    }

    /**
     * Build the Livy {@code POST /batches} body from the fields that are set.
     * Key order is stable so logged payloads are easy to compare.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        putText(payload, "file", file);
        putText(payload, "proxyUser", proxyUser);
        putText(payload, "className", className);
        putCollection(payload, "args", arguments);
        putCollection(payload, "jars", jars);
        putCollection(payload, "pyFiles", pyFiles);
        putCollection(payload, "files", files);
        putText(payload, "driverMemory", driverMemory);
        putNumber(payload, "driverCores", driverCores);
        putText(payload, "executorMemory", executorMemory);
        putNumber(payload, "executorCores", executorCores);
        putNumber(payload, "numExecutors", numExecutors);
        putCollection(payload, "archives", archives);
        putText(payload, "queue", queue);
        putText(payload, "name", name);
        if (conf != null && !conf.isEmpty()) {
            payload.put("conf", new LinkedHashMap<>(conf));
        }
        return payload;
    }

    private static void putText(Map<String, Object> payload, String key, String value) {
        if (value != null && !value.isBlank()) {
            payload.put(key, value);
        }
    }

    private static void putCollection(Map<String, Object> payload, String key, Collection<String> value) {
        if (value != null && !value.isEmpty()) {
            payload.put(key, value);
        }
    }

    private static void putNumber(Map<String, Object> payload, String key, Integer value) {
        if (value != null) {
            payload.put(key, value);
        }
    }

    private static List<String> copy(List<String> values) {
        return values == null ? null : List.copyOf(values);
    }

    private static Integer nonNegative(String field, Integer value) {
        if (value != null && value < 0) {
            throw new IllegalArgumentException(field + " must not be negative: " + value);
        }
        return value;
    }

    public Builder toBuilder() {
        return new Builder()
                .file(file)
                .proxyUser(proxyUser)
                .className(className)
                .arguments(arguments)
                .jars(jars)
                .pyFiles(pyFiles)
                .files(files)
                .driverMemory(driverMemory)
                .driverCores(driverCores)
                .executorMemory(executorMemory)
                .executorCores(executorCores)
                .numExecutors(numExecutors)
                .archives(archives)
                .queue(queue)
                .name(name)
                .conf(conf);
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private String file;
        private String proxyUser;
        private String className;
        private List<String> arguments;
        private List<String> jars;
        private List<String> pyFiles;
        private List<String> files;
        private String driverMemory;
        private Integer driverCores;
        private String executorMemory;
        private Integer executorCores;
        private Integer numExecutors;
        private List<String> archives;
        private String queue;
        private String name;
        private Map<String, String> conf;

        public Builder file(String file) {
            this.file = file;
            return this;
        }

        public Builder proxyUser(String proxyUser) {
            this.proxyUser = proxyUser;
            return this;
        }

        public Builder className(String className) {
            this.className = className;
            return this;
        }

        @JsonProperty("args")
        public Builder arguments(List<String> arguments) {
            this.arguments = arguments;
            return this;
        }

        public Builder jars(List<String> jars) {
            this.jars = jars;
            return this;
        }

        public Builder pyFiles(List<String> pyFiles) {
            this.pyFiles = pyFiles;
            return this;
        }

        public Builder files(List<String> files) {
            this.files = files;
            return this;
        }

        public Builder driverMemory(String driverMemory) {
            this.driverMemory = driverMemory;
            return this;
        }

        public Builder driverCores(Integer driverCores) {
            this.driverCores = driverCores;
            return this;
        }

        public Builder executorMemory(String executorMemory) {
            this.executorMemory = executorMemory;
            return this;
        }

        public Builder executorCores(Integer executorCores) {
            this.executorCores = executorCores;
            return this;
        }

        public Builder numExecutors(Integer numExecutors) {
            this.numExecutors = numExecutors;
            return this;
        }

        public Builder archives(List<String> archives) {
            this.archives = archives;
            return this;
        }

        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder conf(Map<String, String> conf) {
            this.conf = conf;
            return this;
        }

        public JobSubmission build() {
            return new JobSubmission(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobSubmission that))
            return false;
        return Objects.equals(toPayload(), that.toPayload());
    }

    @Override
    public int hashCode() {
        return toPayload().hashCode();
    }

    @Override
    public String toString() {
        return "JobSubmission{file='" + file + "', className='" + className + "', name='" + name + "'}";
    }
}
