package ai.scholar.outline.model;

import java.util.Objects;

/**
 * A paragraph of text owned by exactly one section, or by the document when it precedes every section.
 */
public record Paragraph(int ownerIndex, String text) {

    public Paragraph {
        if (ownerIndex < Document.DOCUMENT_INDEX) {
            throw new IllegalArgumentException("Invalid owner index: " + ownerIndex);
        }
        text = Objects.requireNonNull(text, "text");
    }
}
