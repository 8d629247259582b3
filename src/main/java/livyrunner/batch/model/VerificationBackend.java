package livyrunner.batch.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Secondary status source consulted after Livy reports success.
 */
public enum VerificationBackend {
    /** Trust Livy's terminal state as-is */
    NONE,
    /** Spark monitoring REST API: every job of the application must have SUCCEEDED */
    SPARK,
    /** YARN ResourceManager REST API: the application's finalStatus must be SUCCEEDED */
    YARN;

    /**
     * Parse a configured value. Null, blank and {@code none} mean {@link #NONE}.
     *
     * @throws IllegalArgumentException for any other unknown value
     */
    public static VerificationBackend parse(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (VerificationBackend backend : values()) {
            if (backend.name().equals(normalized)) {
                return backend;
            }
        }
        throw new IllegalArgumentException("Can not create batch runner with verification method '" + value
                + "'. Allowed methods: " + Arrays.toString(values()).toLowerCase(Locale.ROOT));
    }

    public boolean isEnabled() {
        return this != NONE;
    }
}
