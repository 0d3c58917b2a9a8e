package ai.scholar.outline.structure;

import ai.scholar.outline.model.Document;
import ai.scholar.outline.model.DocumentBuilder;
import ai.scholar.outline.tei.TeiDocument;
import ai.scholar.outline.tei.TeiReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns TEI markup into a {@link Document}. Structural problems never escape: when the section numbering cannot be
 * followed the body is re-read as flat paragraphs.
 */
public class OutlineParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(OutlineParser.class);

    private final TeiReader reader;
    private final OutlineAssembler assembler;
    private final FallbackDegrader degrader;

    public OutlineParser() {
        this(new TeiReader(), new OutlineAssembler(), new FallbackDegrader());
    }

    public OutlineParser(TeiReader reader, OutlineAssembler assembler, FallbackDegrader degrader) {
        this.reader = reader;
        this.assembler = assembler;
        this.degrader = degrader;
    }

    public Document parse(String teiXml) {
        return parse(reader.read(teiXml));
    }

    public Document parse(TeiDocument source) {
        DocumentBuilder builder = metadataBuilder(source);
        AssemblyOutcome outcome = assembler.assemble(source.divisions(), builder);
        if (outcome.isCompleted()) {
            Document document = builder.build();
            LOGGER.debug("Built outline with {} sections and {} leading paragraphs",
                    document.outlineSections().size(), document.leadingParagraphs().size());
            return document;
        }
        LOGGER.warn("Section {} at block {} does not fit the outline, falling back to flat paragraphs",
                outcome.offendingAddress().orElseThrow(), outcome.blockPosition());
        return degrader.degrade(source.divisions(), metadataBuilder(source));
    }

    private DocumentBuilder metadataBuilder(TeiDocument source) {
        return new DocumentBuilder()
                .title(source.title().orElse(null))
                .author(source.author().orElse(null))
                .abstractParagraphs(source.abstractParagraphs());
    }
}
