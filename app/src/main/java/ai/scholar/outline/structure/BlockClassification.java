package ai.scholar.outline.structure;

import ai.scholar.outline.model.Address;
import java.util.Optional;

/**
 * Result of classifying one content block.
 *
 * @param heading   whether the block opens a new section
 * @param address   parsed section address; empty for plain paragraphs and for unnumbered headings
 * @param title     section title, possibly empty
 * @param remainder text to attach as the first paragraph of the new section, possibly empty
 */
public record BlockClassification(boolean heading, Optional<Address> address, String title, String remainder) {

    private static final BlockClassification PLAIN = new BlockClassification(false, Optional.empty(), "", "");

    public BlockClassification {
        address = address == null ? Optional.empty() : address;
        title = title == null ? "" : title.trim();
        remainder = remainder == null ? "" : remainder.trim();
    }

    public static BlockClassification plain() {
        return PLAIN;
    }

    public static BlockClassification heading(Address address, String title, String remainder) {
        return new BlockClassification(true, Optional.ofNullable(address), title, remainder);
    }
}
