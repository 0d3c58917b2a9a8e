package ai.scholar.outline.config;

import ai.scholar.outline.skeleton.PreviewMode;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 *
 * @param inputs          TEI files or directories of TEI files
 * @param outputDirectory where records are written; empty means standard output
 * @param parallelism     number of documents parsed at the same time
 * @param verbose         whether outline reconstruction logs at debug level
 */
public record Config(
        List<Path> inputs,
        OutputFormat outputFormat,
        PreviewMode previewMode,
        Optional<Path> outputDirectory,
        int parallelism,
        LogFormat logFormat,
        boolean verbose
) {

    public Config {
        if (inputs == null || inputs.isEmpty()) {
            throw new IllegalArgumentException("At least one input must be provided");
        }
        inputs = List.copyOf(inputs);
        outputFormat = Objects.requireNonNull(outputFormat, "outputFormat");
        previewMode = Objects.requireNonNull(previewMode, "previewMode");
        outputDirectory = outputDirectory == null ? Optional.empty() : outputDirectory;
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
    }
}
