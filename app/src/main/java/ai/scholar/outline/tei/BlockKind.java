package ai.scholar.outline.tei;

/**
 * Markup kind of a content block inside a body division.
 */
public enum BlockKind {
    /** A dedicated {@code head} element. */
    HEADING,
    /** An ordinary {@code p} element. */
    PARAGRAPH,
    /** Any other element (formula, list, table ...), always treated as plain text. */
    OTHER
}
