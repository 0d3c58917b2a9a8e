package ai.scholar.outline.skeleton;

import ai.scholar.outline.structure.SentenceSplitter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a {@link Skeleton} into the textual shapes consumed downstream.
 */
public class SkeletonFormatter {

    /** Group name for paragraphs that precede every section marker. */
    public static final String UNSECTIONED_GROUP = "Paper Content";

    /**
     * Numbers the paragraphs and interleaves them with the section markers. In {@link PreviewMode#FIRST} mode only the
     * first sentence of each paragraph is shown, followed by {@code ...}. Every paragraph line is followed by a blank
     * line.
     */
    public OutlinePreview preview(Skeleton skeleton, PreviewMode mode) {
        List<String> lines = new ArrayList<>();
        List<String> paragraphs = new ArrayList<>();
        for (SkeletonEntry entry : skeleton.entries()) {
            if (entry instanceof SkeletonEntry.SectionMarker marker) {
                lines.add(marker.label());
            } else if (entry instanceof SkeletonEntry.ParagraphEntry paragraph) {
                paragraphs.add(paragraph.text());
                String shown = mode == PreviewMode.FIRST
                        ? SentenceSplitter.firstSentence(paragraph.text()) + " ..."
                        : paragraph.text();
                lines.add("Paragraph " + paragraphs.size() + ": " + shown + "\n");
            }
        }
        return new OutlinePreview(String.join("\n", lines), paragraphs);
    }

    public List<SectionGroup> groups(Skeleton skeleton) {
        List<String> names = new ArrayList<>();
        List<List<String>> bodies = new ArrayList<>();
        for (SkeletonEntry entry : skeleton.entries()) {
            if (entry instanceof SkeletonEntry.SectionMarker marker) {
                names.add(marker.label());
                bodies.add(new ArrayList<>());
            } else if (entry instanceof SkeletonEntry.ParagraphEntry paragraph) {
                if (names.isEmpty()) {
                    names.add(UNSECTIONED_GROUP);
                    bodies.add(new ArrayList<>());
                }
                bodies.get(bodies.size() - 1).add(paragraph.text());
            }
        }
        List<SectionGroup> groups = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            groups.add(new SectionGroup(names.get(i), bodies.get(i)));
        }
        return groups;
    }

    /**
     * Plain text: each group as its name, a blank line and its paragraphs separated by blank lines. Groups are
     * separated by blank lines too, so a group without paragraphs leaves an empty block after its name.
     */
    public String text(Skeleton skeleton) {
        return groups(skeleton).stream()
                .map(group -> group.name() + "\n\n" + String.join("\n\n", group.paragraphs()))
                .collect(Collectors.joining("\n\n"));
    }
}
