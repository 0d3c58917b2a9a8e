package ai.scholar.outline.skeleton;

import java.util.List;

/**
 * A section marker and the paragraphs that follow it directly in the skeleton.
 */
public record SectionGroup(String name, List<String> paragraphs) {

    public SectionGroup {
        paragraphs = List.copyOf(paragraphs);
    }
}
