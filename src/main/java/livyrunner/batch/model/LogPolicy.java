package livyrunner.batch.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * When the full batch log is spilled to the log sink.
 */
public enum LogPolicy {
    ALWAYS,
    ON_FAILURE,
    NEVER;

    public boolean shouldSpill(boolean failed) {
        return switch (this) {
            case ALWAYS -> true;
            case ON_FAILURE -> failed;
            case NEVER -> false;
        };
    }

    /**
     * Parse a configured value, accepting {@code on-failure} as well as {@code on_failure}.
     * Null or blank means {@link #ALWAYS}.
     */
    public static LogPolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return ALWAYS;
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (LogPolicy policy : values()) {
            if (policy.name().equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown log policy '" + value
                + "'. Allowed policies: " + Arrays.toString(values()).toLowerCase(Locale.ROOT));
    }
}
