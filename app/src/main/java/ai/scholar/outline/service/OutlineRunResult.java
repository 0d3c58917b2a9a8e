package ai.scholar.outline.service;

import java.nio.file.Path;
import java.util.List;

/**
 * Summary of a batch run.
 *
 * @param processed inputs whose outline was produced, in input order
 * @param degraded  processed inputs whose numbering could not be followed
 * @param failures  inputs that could not be read or written, in input order
 */
public record OutlineRunResult(List<Path> processed, List<Path> degraded, List<Path> failures) {

    public OutlineRunResult {
        processed = List.copyOf(processed);
        degraded = List.copyOf(degraded);
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
