package com.vidnyan.uast.domain.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One node of a language-specific parse tree, as handed over by the parser.
 * Immutable. Children hang off named fields ("left", "body", "args") in declaration order.
 */
public record NativeNode(
    String kind,
    String token,
    Map<String, String> properties,
    List<Field> fields,
    Integer line,
    Integer column,
    Integer endLine,
    Integer endColumn
) {

    public NativeNode {
        Objects.requireNonNull(kind, "kind");
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        fields = List.copyOf(fields);
    }

    /**
     * A named edge to one child or an ordered list of children.
     * {@code list} keeps the native shape: a one-element list is not a single child.
     */
    public record Field(String role, List<NativeNode> nodes, boolean list) {

        public Field {
            Objects.requireNonNull(role, "role");
            nodes = List.copyOf(nodes);
            if (!list && nodes.size() != 1) {
                throw new IllegalArgumentException("Single field '" + role + "' must hold exactly one node");
            }
        }

        /**
         * Path segment of the child at {@code index}, e.g. {@code Module/body[2]}.
         */
        public static String childPath(String parentPath, String role, boolean list, int index) {
            return list ? parentPath + "/" + role + "[" + index + "]" : parentPath + "/" + role;
        }
    }

    public Optional<String> tokenValue() {
        return Optional.ofNullable(token);
    }

    public Optional<String> property(String name) {
        return Optional.ofNullable(properties.get(name));
    }

    public Optional<Field> field(String role) {
        return fields.stream().filter(f -> f.role().equals(role)).findFirst();
    }

    public boolean hasStartHint() {
        return line != null;
    }

    public boolean hasEndHint() {
        return endLine != null;
    }

    /**
     * Number of nodes in this subtree, this node included.
     */
    public int size() {
        int size = 1;
        for (Field field : fields) {
            for (NativeNode child : field.nodes()) {
                size += child.size();
            }
        }
        return size;
    }

    /**
     * Builder for NativeNode.
     */
    public static Builder builder(String kind) {
        return new Builder(kind);
    }

    public static class Builder {
        private final String kind;
        private String token;
        private final Map<String, String> properties = new LinkedHashMap<>();
        private final Map<String, Field> fields = new LinkedHashMap<>();
        private Integer line;
        private Integer column;
        private Integer endLine;
        private Integer endColumn;

        private Builder(String kind) {
            this.kind = kind;
        }

        public Builder token(String token) { this.token = token; return this; }
        public Builder property(String name, String value) { this.properties.put(name, value); return this; }

        public Builder position(int line, int column) {
            this.line = line;
            this.column = column;
            return this;
        }

        public Builder endPosition(int line, int column) {
            this.endLine = line;
            this.endColumn = column;
            return this;
        }

        public Builder child(String role, NativeNode node) {
            return addField(new Field(role, List.of(node), false));
        }

        public Builder children(String role, NativeNode... nodes) {
            return children(role, List.of(nodes));
        }

        public Builder children(String role, List<NativeNode> nodes) {
            return addField(new Field(role, new ArrayList<>(nodes), true));
        }

        private Builder addField(Field field) {
            if (fields.putIfAbsent(field.role(), field) != null) {
                throw new IllegalArgumentException("Duplicate field '" + field.role() + "' on " + kind);
            }
            return this;
        }

        public NativeNode build() {
            return new NativeNode(kind, token, properties, new ArrayList<>(fields.values()),
                    line, column, endLine, endColumn);
        }
    }
}
