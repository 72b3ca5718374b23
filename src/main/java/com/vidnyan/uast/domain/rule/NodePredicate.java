package com.vidnyan.uast.domain.rule;

import com.vidnyan.uast.domain.node.NativeNode;

/**
 * Condition tested against a single node in its tree context.
 * Implementations must be pure: no state, no side effects.
 * Build instances through {@link Predicates}.
 */
public interface NodePredicate {

    boolean matches(NativeNode node, MatchContext context);
}
