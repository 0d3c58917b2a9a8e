package ai.scholar.outline.config;

import java.util.Locale;

/**
 * Rendering of the per-paper outline records.
 */
public enum OutputFormat {
    JSON("json"),
    JSONL("jsonl"),
    TEXT("txt"),
    PREVIEW("preview.txt");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static OutputFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            return JSON;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "json" -> JSON;
            case "jsonl", "ndjson" -> JSONL;
            case "text", "txt" -> TEXT;
            case "preview" -> PREVIEW;
            default -> throw new IllegalArgumentException("Unsupported output format: " + raw);
        };
    }
}
