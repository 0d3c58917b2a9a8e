package ai.scholar.outline.tei;

import java.util.List;

/**
 * A top-level body division and its blocks in stream order.
 */
public record Division(List<ContentBlock> blocks) {

    public Division {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public static Division of(ContentBlock... blocks) {
        return new Division(List.of(blocks));
    }
}
