package com.vidnyan.uast.domain.node;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A native node together with the roles the rule table attached to it.
 * Same shape as the native tree it came from. Positions are absent until resolved.
 */
public record AnnotatedNode(
    NativeNode source,
    RoleSet roles,
    List<AnnotatedField> fields,
    Position startPosition,
    Position endPosition
) {

    public AnnotatedNode {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(roles, "roles");
        fields = List.copyOf(fields);
    }

    /**
     * Annotated counterpart of {@link NativeNode.Field}.
     */
    public record AnnotatedField(String role, List<AnnotatedNode> nodes, boolean list) {

        public AnnotatedField {
            nodes = List.copyOf(nodes);
        }
    }

    /**
     * Create an unpositioned node.
     */
    public static AnnotatedNode of(NativeNode source, RoleSet roles, List<AnnotatedField> fields) {
        return new AnnotatedNode(source, roles, fields, null, null);
    }

    public String kind() {
        return source.kind();
    }

    public Optional<String> token() {
        return source.tokenValue();
    }

    public Map<String, String> properties() {
        return source.properties();
    }

    public boolean hasRole(Role role) {
        return roles.contains(role);
    }

    public Optional<Position> start() {
        return Optional.ofNullable(startPosition);
    }

    public Optional<Position> end() {
        return Optional.ofNullable(endPosition);
    }

    public Optional<AnnotatedField> field(String role) {
        return fields.stream().filter(f -> f.role().equals(role)).findFirst();
    }

    /**
     * The single child under {@code role}, or the first element when the field is a list.
     */
    public AnnotatedNode child(String role) {
        return field(role)
                .filter(f -> !f.nodes().isEmpty())
                .map(f -> f.nodes().get(0))
                .orElseThrow(() -> new IllegalArgumentException(kind() + " has no child in field '" + role + "'"));
    }

    /**
     * Immediate children in declared field order.
     */
    public List<AnnotatedNode> children() {
        List<AnnotatedNode> children = new ArrayList<>();
        for (AnnotatedField field : fields) {
            children.addAll(field.nodes());
        }
        return children;
    }

    /**
     * This node and all of its descendants, pre-order.
     */
    public List<AnnotatedNode> preOrder() {
        List<AnnotatedNode> out = new ArrayList<>();
        collect(this, out);
        return out;
    }

    private static void collect(AnnotatedNode node, List<AnnotatedNode> out) {
        out.add(node);
        for (AnnotatedField field : node.fields()) {
            for (AnnotatedNode child : field.nodes()) {
                collect(child, out);
            }
        }
    }

    /**
     * Copy with positions and already-positioned fields.
     */
    public AnnotatedNode withPositions(Position start, Position end, List<AnnotatedField> positionedFields) {
        return new AnnotatedNode(source, roles, positionedFields, start, end);
    }

    @Override
    public String toString() {
        return kind() + roles;
    }
}
