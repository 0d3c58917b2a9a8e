package ai.scholar.outline.structure;

/**
 * How a candidate address relates to the chain of currently open sections.
 */
public enum RelationKind {
    DESCEND,
    SIBLING,
    ASCEND,
    INCONSISTENT
}
