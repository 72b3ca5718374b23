package com.vidnyan.uast.domain.rule;

import com.vidnyan.uast.domain.node.NativeNode;

import java.util.Objects;

/**
 * The predicate vocabulary available to rule tables.
 * There is deliberately no and/or: conditions compose by nesting rules.
 */
public final class Predicates {

    private Predicates() {
    }

    /**
     * Evaluate {@code predicate} against {@code node}.
     */
    public static boolean matches(NodePredicate predicate, NativeNode node, MatchContext context) {
        return predicate.matches(node, context);
    }

    public static NodePredicate any() {
        return Any.INSTANCE;
    }

    public static NodePredicate kind(String kind) {
        return new Kind(kind);
    }

    /**
     * True iff the node was reached through the parent field {@code role}.
     */
    public static NodePredicate fieldRole(String role) {
        return new FieldRole(role);
    }

    public static NodePredicate not(NodePredicate predicate) {
        return new Not(predicate);
    }

    /**
     * True iff the node's own scalar field {@code name} equals {@code value}.
     */
    public static NodePredicate property(String name, String value) {
        return new Property(name, value);
    }

    public static NodePredicate token(String token) {
        return new Token(token);
    }

    /**
     * True iff some immediate child matches {@code predicate} in its own edge context.
     */
    public static NodePredicate hasChild(NodePredicate predicate) {
        return new HasChild(predicate);
    }

    enum Any implements NodePredicate {
        INSTANCE;

        @Override
        public boolean matches(NativeNode node, MatchContext context) {
            return true;
        }

        @Override
        public String toString() {
            return "any";
        }
    }

    record Kind(String kind) implements NodePredicate {
        Kind {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public boolean matches(NativeNode node, MatchContext context) {
            return kind.equals(node.kind());
        }

        @Override
        public String toString() {
            return "kind(" + kind + ")";
        }
    }

    record FieldRole(String role) implements NodePredicate {
        FieldRole {
            Objects.requireNonNull(role, "role");
        }

        @Override
        public boolean matches(NativeNode node, MatchContext context) {
            return role.equals(context.fieldRole());
        }

        @Override
        public String toString() {
            return "fieldRole(" + role + ")";
        }
    }

    record Not(NodePredicate predicate) implements NodePredicate {
        Not {
            Objects.requireNonNull(predicate, "predicate");
        }

        @Override
        public boolean matches(NativeNode node, MatchContext context) {
            return !predicate.matches(node, context);
        }

        @Override
        public String toString() {
            return "not(" + predicate + ")";
        }
    }

    record Property(String name, String value) implements NodePredicate {
        Property {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public boolean matches(NativeNode node, MatchContext context) {
            return node.property(name).map(v -> v.equals(value)).orElse(false);
        }

        @Override
        public String toString() {
            return "property(" + name + "=" + value + ")";
        }
    }

    record Token(String token) implements NodePredicate {
        @Override
        public boolean matches(NativeNode node, MatchContext context) {
            return Objects.equals(token, node.token());
        }

        @Override
        public String toString() {
            return "token(" + token + ")";
        }
    }

    record HasChild(NodePredicate predicate) implements NodePredicate {
        HasChild {
            Objects.requireNonNull(predicate, "predicate");
        }

        @Override
        public boolean matches(NativeNode node, MatchContext context) {
            for (NativeNode.Field field : node.fields()) {
                MatchContext childContext = context.descend(node, field.role());
                for (NativeNode child : field.nodes()) {
                    if (predicate.matches(child, childContext)) {
                        return true;
                    }
                }
            }
            return false;
        }

        @Override
        public String toString() {
            return "hasChild(" + predicate + ")";
        }
    }
}
