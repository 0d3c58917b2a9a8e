package ai.scholar.outline.tei;

import java.util.Objects;
import java.util.Optional;

/**
 * One block of a body division: its extracted text, the explicit address attached to it (the TEI {@code n}
 * attribute of a heading) and its markup kind.
 */
public record ContentBlock(BlockKind kind, String text, Optional<String> addressAttribute) {

    public ContentBlock {
        Objects.requireNonNull(kind, "kind");
        text = text == null ? "" : text.trim();
        addressAttribute = addressAttribute == null
                ? Optional.empty()
                : addressAttribute.map(String::trim).filter(value -> !value.isEmpty());
    }

    public static ContentBlock heading(String text) {
        return new ContentBlock(BlockKind.HEADING, text, Optional.empty());
    }

    public static ContentBlock heading(String address, String text) {
        return new ContentBlock(BlockKind.HEADING, text, Optional.ofNullable(address));
    }

    public static ContentBlock paragraph(String text) {
        return new ContentBlock(BlockKind.PARAGRAPH, text, Optional.empty());
    }

    public static ContentBlock other(String text) {
        return new ContentBlock(BlockKind.OTHER, text, Optional.empty());
    }

    public boolean isHeading() {
        return kind == BlockKind.HEADING;
    }

    /**
     * Heading text with the explicit address in front, the way the heading reads when printed.
     */
    public String displayText() {
        return addressAttribute.map(address -> (address + " " + text).trim()).orElse(text);
    }
}
