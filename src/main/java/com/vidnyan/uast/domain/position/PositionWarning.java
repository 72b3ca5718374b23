package com.vidnyan.uast.domain.position;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * A line/column hint that could not be mapped onto the source.
 * Non-fatal: the node falls back to its nearest positioned ancestor.
 */
@Value
@Builder
public class PositionWarning {
    String nodeKind;
    String nodePath;
    Boundary boundary;
    int line;
    int column;
    String reason;

    public enum Boundary {
        START,
        END
    }

    public String toDisplayString() {
        return String.format("%s (%s) %s %d:%d - %s",
                nodePath, nodeKind, boundary.name().toLowerCase(Locale.ROOT), line, column, reason);
    }
}
