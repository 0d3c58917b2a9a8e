package ai.scholar.outline.tei;

import java.util.List;
import java.util.Optional;

/**
 * Content read from a TEI file before any structure is inferred.
 */
public record TeiDocument(Optional<String> title,
                          Optional<String> author,
                          List<String> abstractParagraphs,
                          List<Division> divisions) {

    public TeiDocument {
        title = title == null ? Optional.empty() : title.filter(value -> !value.isBlank());
        author = author == null ? Optional.empty() : author.filter(value -> !value.isBlank());
        abstractParagraphs = abstractParagraphs == null ? List.of() : List.copyOf(abstractParagraphs);
        divisions = divisions == null ? List.of() : List.copyOf(divisions);
    }

    public static TeiDocument ofDivisions(List<Division> divisions) {
        return new TeiDocument(Optional.empty(), Optional.empty(), List.of(), divisions);
    }

    public int blockCount() {
        return divisions.stream().mapToInt(division -> division.blocks().size()).sum();
    }
}
