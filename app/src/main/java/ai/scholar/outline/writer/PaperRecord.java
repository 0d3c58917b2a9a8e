package ai.scholar.outline.writer;

import ai.scholar.outline.model.Document;
import ai.scholar.outline.model.Paragraph;
import ai.scholar.outline.skeleton.Skeleton;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Per-paper output: metadata plus the skeleton of the body.
 *
 * @param abstractText abstract paragraphs joined by a single space
 * @param source       where the TEI document came from, usually a file path
 */
public record PaperRecord(Optional<String> title,
                          Optional<String> author,
                          Optional<String> abstractText,
                          String source,
                          boolean degraded,
                          Skeleton structure) {

    public PaperRecord {
        title = title == null ? Optional.empty() : title;
        author = author == null ? Optional.empty() : author;
        abstractText = abstractText == null ? Optional.empty() : abstractText;
        source = Objects.requireNonNull(source, "source");
        structure = Objects.requireNonNull(structure, "structure");
    }

    public static PaperRecord of(Document document, String source) {
        Optional<String> abstractText = document.abstractSection()
                .map(section -> section.paragraphs().stream()
                        .map(Paragraph::text)
                        .collect(Collectors.joining(" ")));
        return new PaperRecord(document.title(), document.author(), abstractText, source,
                document.degraded(), Skeleton.of(document));
    }
}
