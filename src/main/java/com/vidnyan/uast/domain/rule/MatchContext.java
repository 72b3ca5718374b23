package com.vidnyan.uast.domain.rule;

import com.vidnyan.uast.domain.node.NativeNode;

import java.util.Optional;

/**
 * Where a node sits in the tree: the field it was reached through, its parent node and
 * the parent's own context. Contexts link upwards, so a child shares its ancestors'
 * contexts instead of copying them.
 */
public record MatchContext(
    String fieldRole,
    NativeNode parentNode,
    MatchContext parentContext,
    int depth
) {

    private static final MatchContext ROOT = new MatchContext(null, null, null, 0);

    public static MatchContext root() {
        return ROOT;
    }

    /**
     * Context of a child of {@code parent} reached through {@code role}.
     * {@code parent} is the node this context belongs to.
     */
    public MatchContext descend(NativeNode parent, String role) {
        return new MatchContext(role, parent, this, depth + 1);
    }

    public Optional<String> role() {
        return Optional.ofNullable(fieldRole);
    }

    public Optional<NativeNode> parent() {
        return Optional.ofNullable(parentNode);
    }

    public boolean isRoot() {
        return parentNode == null;
    }
}
