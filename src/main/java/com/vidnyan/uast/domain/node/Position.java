package com.vidnyan.uast.domain.node;

/**
 * Resolved source position.
 * Offset is an absolute UTF-8 byte offset, line is 1-based, column is a 0-based byte delta.
 */
public record Position(
    int offset,
    int line,
    int column
) {

    /**
     * Position used when nothing in the tree carries a hint.
     */
    public static final Position START = new Position(0, 1, 0);

    public Position {
        if (offset < 0) {
            throw new IllegalArgumentException("Negative offset: " + offset);
        }
    }

    /**
     * Format as readable string.
     */
    public String format() {
        return line + ":" + column + "@" + offset;
    }
}
