package ai.scholar.outline.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Expands configured inputs into TEI files: directories contribute their {@code *.xml} files (not recursively,
 * sorted by name), files are taken as given.
 */
public class InputResolver {

    private static final String TEI_EXTENSION = ".xml";

    public List<Path> resolve(List<Path> inputs) {
        List<Path> files = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                files.addAll(listTeiFiles(input));
            } else {
                files.add(input);
            }
        }
        return files;
    }

    /**
     * Output file stem for an input: its name without {@code .tei.xml} or {@code .xml}.
     */
    public static String stem(Path file) {
        String name = file.getFileName().toString();
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".tei.xml")) {
            return name.substring(0, name.length() - ".tei.xml".length());
        }
        if (lower.endsWith(TEI_EXTENSION)) {
            return name.substring(0, name.length() - TEI_EXTENSION.length());
        }
        return name;
    }

    private List<Path> listTeiFiles(Path directory) {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(TEI_EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list TEI files in " + directory, ex);
        }
    }
}
