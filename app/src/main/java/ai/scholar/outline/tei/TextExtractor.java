package ai.scholar.outline.tei;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Flattens the text of a markup element, leaving out citation markers.
 *
 * <p>The subtree of every {@code ref} element is skipped, while the text that follows a reference (its tail) is kept,
 * so {@code "as shown <ref>[12]</ref> before"} becomes {@code "as shown  before"}.
 */
public final class TextExtractor {

    private TextExtractor() {
    }

    public static String extract(Element element) {
        if (element == null) {
            return "";
        }
        StringBuilder builder = new StringBuilder();
        appendChildren(element, builder);
        return builder.toString().trim();
    }

    private static void appendChildren(Element element, StringBuilder builder) {
        for (Node child : element.childNodes()) {
            if (child instanceof TextNode textNode) {
                builder.append(textNode.getWholeText());
            } else if (child instanceof Element childElement && !TeiElements.isReference(childElement)) {
                appendChildren(childElement, builder);
            }
        }
    }
}
