package ai.scholar.outline.writer;

import ai.scholar.outline.skeleton.SkeletonEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Serializes {@link PaperRecord}s as JSON. Section markers become JSON strings and paragraphs become
 * {@code {"text": ...}} objects, in skeleton order.
 */
public class PaperRecordSerializer {

    private final ObjectMapper objectMapper;

    public PaperRecordSerializer() {
        this(new ObjectMapper());
    }

    public PaperRecordSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode toTree(PaperRecord record) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("title", record.title().orElse(null));
        root.put("author", record.author().orElse(null));
        root.put("abstract", record.abstractText().orElse(null));
        root.put("source", record.source());
        root.put("degraded", record.degraded());
        ArrayNode structure = root.putArray("structure");
        for (SkeletonEntry entry : record.structure().entries()) {
            if (entry instanceof SkeletonEntry.SectionMarker marker) {
                structure.add(marker.label());
            } else if (entry instanceof SkeletonEntry.ParagraphEntry paragraph) {
                structure.addObject().put("text", paragraph.text());
            }
        }
        return root;
    }

    public String toJson(PaperRecord record, boolean pretty) {
        try {
            ObjectNode tree = toTree(record);
            return pretty
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree)
                    : objectMapper.writeValueAsString(tree);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize outline of " + record.source(), ex);
        }
    }
}
