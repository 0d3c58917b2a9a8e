package ai.scholar.outline.skeleton;

import ai.scholar.outline.model.Document;
import ai.scholar.outline.model.Paragraph;
import ai.scholar.outline.model.Section;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Linear view of a document handed to downstream consumers: leading paragraphs, then every section depth first as a
 * marker followed by its paragraphs and its children. Markers number sections by position ({@code 1}, {@code 1.2},
 * ...), whatever numbering the source used. The abstract is not part of the skeleton.
 */
public record Skeleton(List<SkeletonEntry> entries) {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public Skeleton {
        entries = List.copyOf(entries);
    }

    public static Skeleton of(Document document) {
        List<SkeletonEntry> entries = new ArrayList<>();
        appendParagraphs(document.leadingParagraphs(), entries);
        List<Section> topLevel = document.topLevelSections();
        for (int i = 0; i < topLevel.size(); i++) {
            appendSection(document, topLevel.get(i), String.valueOf(i + 1), entries);
        }
        return new Skeleton(entries);
    }

    public static String marker(String dottedPosition, String title) {
        String label = "Section " + dottedPosition + ".";
        return title == null || title.isBlank() ? label : label + " " + title.trim();
    }

    public static String normalize(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public List<String> paragraphs() {
        List<String> paragraphs = new ArrayList<>();
        for (SkeletonEntry entry : entries) {
            if (entry instanceof SkeletonEntry.ParagraphEntry paragraph) {
                paragraphs.add(paragraph.text());
            }
        }
        return paragraphs;
    }

    public List<String> markers() {
        List<String> markers = new ArrayList<>();
        for (SkeletonEntry entry : entries) {
            if (entry instanceof SkeletonEntry.SectionMarker marker) {
                markers.add(marker.label());
            }
        }
        return markers;
    }

    private static void appendSection(Document document, Section section, String position, List<SkeletonEntry> entries) {
        entries.add(new SkeletonEntry.SectionMarker(marker(position, section.name())));
        appendParagraphs(section.paragraphs(), entries);
        List<Section> children = document.children(section);
        for (int i = 0; i < children.size(); i++) {
            appendSection(document, children.get(i), position + "." + (i + 1), entries);
        }
    }

    private static void appendParagraphs(List<Paragraph> paragraphs, List<SkeletonEntry> entries) {
        for (Paragraph paragraph : paragraphs) {
            String text = normalize(paragraph.text());
            if (!text.isEmpty()) {
                entries.add(new SkeletonEntry.ParagraphEntry(text));
            }
        }
    }
}
