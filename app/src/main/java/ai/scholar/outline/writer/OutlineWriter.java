package ai.scholar.outline.writer;

import ai.scholar.outline.config.OutputFormat;
import ai.scholar.outline.skeleton.PreviewMode;
import ai.scholar.outline.skeleton.SkeletonFormatter;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Renders paper records in the configured format and writes them to an output directory, or to a stream when no
 * directory is configured.
 */
public class OutlineWriter {

    private final PaperRecordSerializer serializer;
    private final SkeletonFormatter formatter;
    private final OutputFormat format;
    private final PreviewMode previewMode;

    public OutlineWriter(OutputFormat format, PreviewMode previewMode) {
        this(new PaperRecordSerializer(), new SkeletonFormatter(), format, previewMode);
    }

    public OutlineWriter(PaperRecordSerializer serializer, SkeletonFormatter formatter, OutputFormat format, PreviewMode previewMode) {
        this.serializer = serializer;
        this.formatter = formatter;
        this.format = format;
        this.previewMode = previewMode;
    }

    public String render(PaperRecord record) {
        return switch (format) {
            case JSON -> serializer.toJson(record, true);
            case JSONL -> serializer.toJson(record, false);
            case TEXT -> formatter.text(record.structure());
            case PREVIEW -> formatter.preview(record.structure(), previewMode).context();
        };
    }

    /**
     * Writes the record to {@code <outputDirectory>/<stem>.<extension>}.
     *
     * @return the written file
     */
    public Path write(Path outputDirectory, String stem, PaperRecord record) {
        Path target = outputDirectory.resolve(stem + "." + format.extension());
        try {
            Files.createDirectories(outputDirectory);
            Files.writeString(target, render(record) + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write outline: " + target, ex);
        }
        return target;
    }

    public void print(PrintStream out, PaperRecord record) {
        out.println(render(record));
    }
}
