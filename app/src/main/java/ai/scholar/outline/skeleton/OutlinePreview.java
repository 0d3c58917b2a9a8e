package ai.scholar.outline.skeleton;

import java.util.List;

/**
 * Compact rendering of a skeleton, with the paragraph texts in the order they are numbered in the context.
 */
public record OutlinePreview(String context, List<String> paragraphs) {

    public OutlinePreview {
        paragraphs = List.copyOf(paragraphs);
    }
}
