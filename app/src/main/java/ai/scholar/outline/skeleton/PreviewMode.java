package ai.scholar.outline.skeleton;

/**
 * How much of each paragraph a skeleton preview shows.
 */
public enum PreviewMode {
    FIRST,
    FULL;

    public static PreviewMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return FIRST;
        }
        for (PreviewMode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported preview mode: " + raw);
    }
}
