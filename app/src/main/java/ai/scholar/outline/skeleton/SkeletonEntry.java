package ai.scholar.outline.skeleton;

/**
 * One element of a skeleton: either a section marker or a paragraph.
 */
public interface SkeletonEntry {

    /**
     * Marker announcing a section, e.g. {@code "Section 2.1. Background"}.
     */
    record SectionMarker(String label) implements SkeletonEntry {
    }

    /**
     * Paragraph text with whitespace collapsed.
     */
    record ParagraphEntry(String text) implements SkeletonEntry {
    }
}
