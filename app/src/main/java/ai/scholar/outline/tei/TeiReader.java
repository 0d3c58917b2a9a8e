package ai.scholar.outline.tei;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads GROBID TEI output into metadata, abstract paragraphs and the body block stream.
 * Parsing is lenient: malformed markup yields whatever content jsoup can recover, never an exception.
 */
public class TeiReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(TeiReader.class);

    private static final String ADDRESS_ATTRIBUTE = "n";

    public TeiDocument read(Path file) {
        try {
            return read(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read TEI document: " + file, ex);
        }
    }

    public TeiDocument read(String xml) {
        if (xml == null || xml.isBlank()) {
            return TeiDocument.ofDivisions(List.of());
        }
        Element root = Jsoup.parse(xml, "", Parser.xmlParser());
        TeiDocument document = new TeiDocument(
                readTitle(root),
                readAuthors(root),
                readAbstract(root),
                readBody(root));
        LOGGER.debug("Read TEI document with {} divisions ({} blocks), {} abstract paragraphs",
                document.divisions().size(), document.blockCount(), document.abstractParagraphs().size());
        return document;
    }

    private Optional<String> readTitle(Element root) {
        return TeiElements.findPath(root, "titlestmt", "title")
                .map(TextExtractor::extract)
                .filter(value -> !value.isBlank());
    }

    private Optional<String> readAuthors(Element root) {
        Optional<Element> sourceDesc = TeiElements.firstDescendant(root, "sourcedesc");
        if (sourceDesc.isEmpty()) {
            return Optional.empty();
        }
        List<String> names = new ArrayList<>();
        for (Element author : TeiElements.descendants(sourceDesc.get(), "author")) {
            TeiElements.firstDescendant(author, "persname")
                    .map(this::fullName)
                    .filter(name -> !name.isBlank())
                    .ifPresent(names::add);
        }
        return names.isEmpty() ? Optional.empty() : Optional.of(String.join(", ", names));
    }

    private String fullName(Element persName) {
        String first = "";
        for (Element forename : TeiElements.descendants(persName, "forename")) {
            if ("first".equals(forename.attr("type"))) {
                first = TextExtractor.extract(forename);
                break;
            }
        }
        String last = TeiElements.firstDescendant(persName, "surname")
                .map(TextExtractor::extract)
                .orElse("");
        return (first + " " + last).trim();
    }

    private List<String> readAbstract(Element root) {
        Optional<Element> abstractElement = TeiElements.findPath(root, "profiledesc", "abstract");
        if (abstractElement.isEmpty()) {
            return List.of();
        }
        List<String> paragraphs = new ArrayList<>();
        for (Element division : TeiElements.descendants(abstractElement.get(), TeiElements.DIVISION)) {
            for (Element paragraph : TeiElements.descendants(division, TeiElements.PARAGRAPH)) {
                addIfPresent(paragraphs, TextExtractor.extract(paragraph));
            }
        }
        if (paragraphs.isEmpty()) {
            for (Element paragraph : TeiElements.descendants(abstractElement.get(), TeiElements.PARAGRAPH)) {
                addIfPresent(paragraphs, TextExtractor.extract(paragraph));
            }
        }
        return paragraphs;
    }

    private List<Division> readBody(Element root) {
        Optional<Element> body = TeiElements.findPath(root, "text", "body");
        if (body.isEmpty()) {
            LOGGER.debug("TEI document has no body");
            return List.of();
        }
        List<Division> divisions = new ArrayList<>();
        for (Element division : TeiElements.children(body.get(), TeiElements.DIVISION)) {
            divisions.add(readDivision(division));
        }
        return divisions;
    }

    private Division readDivision(Element division) {
        List<ContentBlock> blocks = new ArrayList<>();
        for (Element child : division.children()) {
            String text = TextExtractor.extract(child);
            if (TeiElements.is(child, TeiElements.HEAD)) {
                Optional<String> address = Optional.of(child.attr(ADDRESS_ATTRIBUTE)).filter(value -> !value.isBlank());
                if (!text.isEmpty() || address.isPresent()) {
                    blocks.add(new ContentBlock(BlockKind.HEADING, text, address));
                }
            } else if (!text.isEmpty()) {
                BlockKind kind = TeiElements.is(child, TeiElements.PARAGRAPH) ? BlockKind.PARAGRAPH : BlockKind.OTHER;
                blocks.add(new ContentBlock(kind, text, Optional.empty()));
            }
        }
        return new Division(blocks);
    }

    private static void addIfPresent(List<String> paragraphs, String text) {
        if (!text.isBlank()) {
            paragraphs.add(text);
        }
    }
}
