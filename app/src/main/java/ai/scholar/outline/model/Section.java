package ai.scholar.outline.model;

import java.util.List;
import java.util.Objects;

/**
 * Immutable section node stored in the document arena. Parent and children are referenced by arena index;
 * a parent index of {@link Document#DOCUMENT_INDEX} means the section hangs directly off the document.
 */
public record Section(int index,
                      int parentIndex,
                      String name,
                      Address address,
                      List<Integer> childIndices,
                      List<Paragraph> paragraphs) {

    public Section {
        if (index < 0) {
            throw new IllegalArgumentException("Section index must not be negative");
        }
        if (parentIndex < Document.DOCUMENT_INDEX || parentIndex >= index) {
            throw new IllegalArgumentException("Parent of section " + index + " must precede it, was " + parentIndex);
        }
        name = name == null ? "" : name;
        address = Objects.requireNonNull(address, "address");
        childIndices = List.copyOf(childIndices);
        paragraphs = List.copyOf(paragraphs);
    }

    public boolean isTopLevel() {
        return parentIndex == Document.DOCUMENT_INDEX;
    }
}
