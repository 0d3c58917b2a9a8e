package ai.scholar.outline.structure;

import ai.scholar.outline.model.Address;
import ai.scholar.outline.tei.ContentBlock;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a content block opens a new section and, if so, extracts its address, title and remainder.
 *
 * <p>Heading blocks are trusted: any leading address is taken, and a heading without one still opens a section.
 * Paragraph blocks only open a section when they start with {@code "<address>. "} and that address fits the open
 * section chain, which tells a sub-heading run into the prose apart from a numbered list item.
 */
public class BlockClassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(BlockClassifier.class);

    static final Set<String> NON_SECTION_KEYWORDS = Set.of(
            "figure", "fig", "table", "theorem", "lemma", "proposition", "corollary", "definition",
            "remark", "example", "proof", "algorithm", "equation", "appendix");

    private static final Pattern HEADING_ADDRESS = Pattern.compile("^((?:\\d+\\.)*\\d+)\\.?(?:\\s+(.*))?$", Pattern.DOTALL);
    private static final Pattern EMBEDDED_ADDRESS = Pattern.compile("^((?:\\d+\\.)*\\d+)\\.\\s+(.*)$", Pattern.DOTALL);
    private static final Pattern LEADING_WORD = Pattern.compile("^[^\\p{L}\\d]*(\\p{L}+)");

    private final HierarchyTracker tracker;

    public BlockClassifier(HierarchyTracker tracker) {
        this.tracker = tracker;
    }

    public BlockClassification classify(ContentBlock block, HierarchyState state) {
        if (startsWithNonSectionKeyword(block.text())) {
            return BlockClassification.plain();
        }
        return switch (block.kind()) {
            case HEADING -> classifyHeading(block);
            case PARAGRAPH -> state.isUnnumbered() ? BlockClassification.plain() : classifyParagraph(block, state);
            case OTHER -> BlockClassification.plain();
        };
    }

    private BlockClassification classifyHeading(ContentBlock block) {
        Optional<BlockClassification> fromAttribute = block.addressAttribute()
                .flatMap(this::parseHeading)
                .map(parsed -> block.text().isEmpty()
                        ? parsed
                        : BlockClassification.heading(parsed.address().orElseThrow(), block.text(), ""));
        BlockClassification classification = fromAttribute
                .or(() -> parseHeading(block.text()))
                .orElseGet(() -> BlockClassification.heading(null, block.text(), ""));
        if (startsWithNonSectionKeyword(classification.title())) {
            return BlockClassification.plain();
        }
        return classification;
    }

    private Optional<BlockClassification> parseHeading(String text) {
        Matcher matcher = HEADING_ADDRESS.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        Optional<Address> address = parseAddress(matcher.group(1));
        String title = matcher.group(2) == null ? "" : matcher.group(2);
        return address.map(value -> BlockClassification.heading(value, title, ""));
    }

    private BlockClassification classifyParagraph(ContentBlock block, HierarchyState state) {
        Matcher matcher = EMBEDDED_ADDRESS.matcher(block.text());
        if (!matcher.matches()) {
            return BlockClassification.plain();
        }
        Optional<Address> address = parseAddress(matcher.group(1));
        if (address.isEmpty()) {
            return BlockClassification.plain();
        }
        Address candidate = address.get();
        if (state.isEmpty() && candidate.components().stream().anyMatch(component -> component > 1)) {
            LOGGER.debug("Numbered paragraph {} before any section kept as text", candidate);
            return BlockClassification.plain();
        }
        if (!tracker.relate(state, candidate).isConsistent()) {
            LOGGER.debug("Numbered paragraph {} does not fit open sections {}, kept as text", candidate, state.topAddress());
            return BlockClassification.plain();
        }
        String rest = matcher.group(2).trim();
        BlockClassification classification = SentenceSplitter.split(rest)
                .map(split -> BlockClassification.heading(candidate, split.lead(), split.rest()))
                .orElseGet(() -> BlockClassification.heading(candidate, rest, ""));
        if (startsWithNonSectionKeyword(classification.title())) {
            return BlockClassification.plain();
        }
        return classification;
    }

    private Optional<Address> parseAddress(String dotted) {
        Optional<Address> address = Address.parse(dotted);
        if (address.isEmpty()) {
            LOGGER.debug("Ignoring malformed section address '{}'", dotted);
        }
        return address;
    }

    static boolean startsWithNonSectionKeyword(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        Matcher matcher = LEADING_WORD.matcher(text);
        return matcher.find() && NON_SECTION_KEYWORDS.contains(matcher.group(1).toLowerCase(Locale.ROOT));
    }
}
