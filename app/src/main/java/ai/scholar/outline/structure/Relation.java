package ai.scholar.outline.structure;

import java.util.Objects;

/**
 * Outcome of relating a candidate address to the open section chain.
 *
 * @param kind        relation kind
 * @param anchorDepth depth of the open frame that becomes the parent of the new section; {@code 0} means the
 *                    document itself. Frames deeper than the anchor are closed. Meaningless for
 *                    {@link RelationKind#INCONSISTENT}.
 */
public record Relation(RelationKind kind, int anchorDepth) {

    private static final Relation INCONSISTENT = new Relation(RelationKind.INCONSISTENT, -1);

    public Relation {
        Objects.requireNonNull(kind, "kind");
        if (kind != RelationKind.INCONSISTENT && anchorDepth < 0) {
            throw new IllegalArgumentException("anchorDepth must not be negative");
        }
    }

    public static Relation descend(int anchorDepth) {
        return new Relation(RelationKind.DESCEND, anchorDepth);
    }

    public static Relation sibling(int anchorDepth) {
        return new Relation(RelationKind.SIBLING, anchorDepth);
    }

    public static Relation ascend(int anchorDepth) {
        return new Relation(RelationKind.ASCEND, anchorDepth);
    }

    public static Relation inconsistent() {
        return INCONSISTENT;
    }

    public boolean isConsistent() {
        return kind != RelationKind.INCONSISTENT;
    }
}
