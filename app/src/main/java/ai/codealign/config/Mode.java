package ai.codealign.config;

/**
 * What the CLI does with formatted output.
 */
public enum Mode {
    /** Print formatted text to standard output. */
    PRINT,
    /** Rewrite changed files in place. */
    WRITE,
    /** Report files that would change and fail if there are any. */
    CHECK;

    public static Mode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PRINT;
        }
        for (Mode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw);
    }
}
