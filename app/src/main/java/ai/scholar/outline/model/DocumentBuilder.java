package ai.scholar.outline.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Mutable arena used while an outline is being assembled. Sections and paragraphs are only ever appended; the one
 * permitted edit is giving a still-untitled section its title together with its first paragraph.
 */
public final class DocumentBuilder {

    private String title;
    private String author;
    private Integer abstractIndex;
    private final List<Paragraph> leadingParagraphs = new ArrayList<>();
    private final List<Integer> topLevelIndices = new ArrayList<>();
    private final List<Node> nodes = new ArrayList<>();
    private boolean degraded;

    public DocumentBuilder title(String title) {
        this.title = blankToNull(title);
        return this;
    }

    public DocumentBuilder author(String author) {
        this.author = blankToNull(author);
        return this;
    }

    public DocumentBuilder degraded(boolean degraded) {
        this.degraded = degraded;
        return this;
    }

    /**
     * Registers the abstract as a detached section named "Abstract". Empty paragraph lists leave the document
     * without an abstract.
     */
    public DocumentBuilder abstractParagraphs(List<String> paragraphs) {
        if (abstractIndex != null) {
            throw new IllegalStateException("Abstract already set");
        }
        if (paragraphs == null || paragraphs.isEmpty()) {
            return this;
        }
        Node node = new Node(nodes.size(), Document.DOCUMENT_INDEX, "Abstract", Address.root());
        nodes.add(node);
        for (String paragraph : paragraphs) {
            node.paragraphs.add(new Paragraph(node.index, paragraph));
        }
        abstractIndex = node.index;
        return this;
    }

    /**
     * Opens a new section under {@code parentIndex} and returns its arena index.
     */
    public int addSection(int parentIndex, String name, Address address) {
        Objects.requireNonNull(address, "address");
        if (parentIndex != Document.DOCUMENT_INDEX) {
            checkIndex(parentIndex);
            if (abstractIndex != null && parentIndex == abstractIndex) {
                throw new IllegalArgumentException("The abstract cannot hold child sections");
            }
        }
        Node node = new Node(nodes.size(), parentIndex, name == null ? "" : name.trim(), address);
        nodes.add(node);
        if (parentIndex == Document.DOCUMENT_INDEX) {
            topLevelIndices.add(node.index);
        } else {
            nodes.get(parentIndex).children.add(node.index);
        }
        return node.index;
    }

    public void addParagraph(int ownerIndex, String text) {
        if (ownerIndex == Document.DOCUMENT_INDEX) {
            leadingParagraphs.add(new Paragraph(Document.DOCUMENT_INDEX, text));
            return;
        }
        checkIndex(ownerIndex);
        nodes.get(ownerIndex).paragraphs.add(new Paragraph(ownerIndex, text));
    }

    public String sectionName(int index) {
        checkIndex(index);
        return nodes.get(index).name;
    }

    public int paragraphCount(int index) {
        checkIndex(index);
        return nodes.get(index).paragraphs.size();
    }

    /**
     * Fills the title of a section that has none yet.
     *
     * @throws IllegalStateException when the section is already titled
     */
    public void fillTitle(int index, String name) {
        checkIndex(index);
        Node node = nodes.get(index);
        if (!node.name.isEmpty()) {
            throw new IllegalStateException("Section " + index + " already has a title");
        }
        node.name = name == null ? "" : name.trim();
    }

    public Document build() {
        List<Section> sections = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            sections.add(new Section(node.index, node.parentIndex, node.name, node.address, node.children, node.paragraphs));
        }
        return new Document(title, author, abstractIndex, leadingParagraphs, topLevelIndices, sections, degraded);
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= nodes.size()) {
            throw new IndexOutOfBoundsException("No section with index " + index);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static final class Node {
        private final int index;
        private final int parentIndex;
        private final Address address;
        private final List<Integer> children = new ArrayList<>();
        private final List<Paragraph> paragraphs = new ArrayList<>();
        private String name;

        private Node(int index, int parentIndex, String name, Address address) {
            this.index = index;
            this.parentIndex = parentIndex;
            this.name = name;
            this.address = address;
        }
    }
}
