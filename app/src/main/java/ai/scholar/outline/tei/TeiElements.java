package ai.scholar.outline.tei;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.jsoup.nodes.Element;

/**
 * Namespace-agnostic helpers for navigating TEI elements. Elements are matched by local name so that both
 * default-namespace documents and {@code tei:}-prefixed ones are handled.
 */
final class TeiElements {

    static final String HEAD = "head";
    static final String PARAGRAPH = "p";
    static final String DIVISION = "div";
    static final String REFERENCE = "ref";

    private TeiElements() {
    }

    static String localName(Element element) {
        String name = element.tagName();
        int colon = name.indexOf(':');
        if (colon >= 0) {
            name = name.substring(colon + 1);
        }
        return name.toLowerCase(Locale.ROOT);
    }

    static boolean is(Element element, String localName) {
        return localName(element).equals(localName);
    }

    static boolean isReference(Element element) {
        return is(element, REFERENCE);
    }

    static List<Element> children(Element parent, String localName) {
        List<Element> matches = new ArrayList<>();
        for (Element child : parent.children()) {
            if (is(child, localName)) {
                matches.add(child);
            }
        }
        return matches;
    }

    /**
     * Descendants with the given local name in document order, excluding {@code root} itself.
     */
    static List<Element> descendants(Element root, String localName) {
        List<Element> matches = new ArrayList<>();
        for (Element element : root.getAllElements()) {
            if (element != root && is(element, localName)) {
                matches.add(element);
            }
        }
        return matches;
    }

    static Optional<Element> firstDescendant(Element root, String localName) {
        for (Element element : root.getAllElements()) {
            if (element != root && is(element, localName)) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    /**
     * Follows a path of local names, each step searching the descendants of the previous match.
     */
    static Optional<Element> findPath(Element root, String... localNames) {
        Optional<Element> current = Optional.of(root);
        for (String localName : localNames) {
            current = current.flatMap(element -> firstDescendant(element, localName));
        }
        return current;
    }
}
