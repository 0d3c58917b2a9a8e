package ai.scholar.outline.structure;

import ai.scholar.outline.model.Document;
import ai.scholar.outline.model.DocumentBuilder;
import ai.scholar.outline.tei.ContentBlock;
import ai.scholar.outline.tei.Division;
import java.util.List;

/**
 * Flat reconstruction used when the numbering of a document cannot be followed. Every division is flattened into
 * document-level paragraphs; heading text is carried over as a prefix of the paragraph that follows it.
 */
public class FallbackDegrader {

    public Document degrade(List<Division> divisions, DocumentBuilder builder) {
        for (Division division : divisions) {
            StringBuilder pendingHeading = new StringBuilder();
            for (ContentBlock block : division.blocks()) {
                if (block.isHeading()) {
                    appendSeparated(pendingHeading, block.displayText());
                    continue;
                }
                StringBuilder paragraph = new StringBuilder(pendingHeading);
                appendSeparated(paragraph, block.text());
                emit(builder, paragraph);
                pendingHeading.setLength(0);
            }
            emit(builder, pendingHeading);
        }
        return builder.degraded(true).build();
    }

    private void emit(DocumentBuilder builder, StringBuilder text) {
        if (!text.isEmpty()) {
            builder.addParagraph(Document.DOCUMENT_INDEX, text.toString());
        }
    }

    private static void appendSeparated(StringBuilder builder, String text) {
        if (text.isEmpty()) {
            return;
        }
        if (!builder.isEmpty()) {
            builder.append(' ');
        }
        builder.append(text);
    }
}
