package com.vidnyan.uast.domain.position;

import com.vidnyan.uast.domain.node.AnnotatedNode;

import java.util.List;

/**
 * Output of position resolution: the tree with every node positioned, plus diagnostics.
 */
public record PositionedTree(
    AnnotatedNode root,
    List<PositionWarning> warnings
) {

    public PositionedTree {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
