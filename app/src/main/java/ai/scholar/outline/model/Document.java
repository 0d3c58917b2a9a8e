package ai.scholar.outline.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Root of a reconstructed outline. All sections, the abstract included, live in a single arena and refer to each
 * other by index, so the tree never holds child-to-parent object references.
 */
public final class Document {

    /** Owner index used for paragraphs and top-level sections that belong to the document itself. */
    public static final int DOCUMENT_INDEX = -1;

    private final String title;
    private final String author;
    private final Integer abstractIndex;
    private final List<Paragraph> leadingParagraphs;
    private final List<Integer> topLevelIndices;
    private final List<Section> sections;
    private final boolean degraded;

    Document(String title,
             String author,
             Integer abstractIndex,
             List<Paragraph> leadingParagraphs,
             List<Integer> topLevelIndices,
             List<Section> sections,
             boolean degraded) {
        this.title = title;
        this.author = author;
        this.abstractIndex = abstractIndex;
        this.leadingParagraphs = List.copyOf(leadingParagraphs);
        this.topLevelIndices = List.copyOf(topLevelIndices);
        this.sections = List.copyOf(sections);
        this.degraded = degraded;
    }

    public Optional<String> title() {
        return Optional.ofNullable(title);
    }

    public Optional<String> author() {
        return Optional.ofNullable(author);
    }

    public Optional<Section> abstractSection() {
        return abstractIndex == null ? Optional.empty() : Optional.of(sections.get(abstractIndex));
    }

    public List<Paragraph> leadingParagraphs() {
        return leadingParagraphs;
    }

    public List<Section> topLevelSections() {
        return resolve(topLevelIndices);
    }

    public List<Section> children(Section section) {
        return resolve(section.childIndices());
    }

    public Section section(int index) {
        return sections.get(index);
    }

    /**
     * Number of ancestor hops from the section to the document; top-level sections have depth 1.
     */
    public int depth(Section section) {
        int depth = 1;
        Section current = section;
        while (!current.isTopLevel()) {
            current = sections.get(current.parentIndex());
            depth++;
        }
        return depth;
    }

    /**
     * Every section of the body outline, excluding the abstract, in document order.
     */
    public List<Section> outlineSections() {
        List<Section> ordered = new ArrayList<>();
        for (Section section : topLevelSections()) {
            collect(section, ordered);
        }
        return ordered;
    }

    public boolean degraded() {
        return degraded;
    }

    public boolean isEmpty() {
        return leadingParagraphs.isEmpty() && topLevelIndices.isEmpty();
    }

    private void collect(Section section, List<Section> ordered) {
        ordered.add(section);
        for (Section child : children(section)) {
            collect(child, ordered);
        }
    }

    private List<Section> resolve(List<Integer> indices) {
        List<Section> resolved = new ArrayList<>(indices.size());
        for (Integer index : indices) {
            resolved.add(sections.get(index));
        }
        return resolved;
    }
}
