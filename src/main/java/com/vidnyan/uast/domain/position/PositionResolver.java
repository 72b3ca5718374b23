package com.vidnyan.uast.domain.position;

import com.vidnyan.uast.domain.node.AnnotatedNode;
import com.vidnyan.uast.domain.node.NativeNode;
import com.vidnyan.uast.domain.node.Position;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Fills absolute offsets from the line/column hints of an annotated tree.
 * <p>
 * A node with a usable start hint is positioned from it. A node without one, or with a
 * hint outside the source, takes the start position of its nearest positioned ancestor
 * (never a sibling or descendant); the root falls back to {@link Position#START}.
 * Bad hints are reported as {@link PositionWarning}s, never as failures.
 * End hints are resolved when present and are not inherited.
 */
@Slf4j
public class PositionResolver {

    private final boolean logWarnings;

    public PositionResolver() {
        this(false);
    }

    public PositionResolver(boolean logWarnings) {
        this.logWarnings = logWarnings;
    }

    public PositionedTree resolvePositions(String sourceText, AnnotatedNode root) {
        LineIndex index = LineIndex.of(sourceText);
        List<PositionWarning> warnings = new ArrayList<>();
        AnnotatedNode positioned = resolve(root, Position.START, root.kind(), index, warnings);
        log.debug("Resolved positions over {} lines ({} bytes), {} warnings",
                index.lineCount(), index.size(), warnings.size());
        if (logWarnings) {
            warnings.forEach(w -> log.warn("Position fallback: {}", w.toDisplayString()));
        }
        return new PositionedTree(positioned, warnings);
    }

    private AnnotatedNode resolve(AnnotatedNode node, Position inherited, String path,
                                  LineIndex index, List<PositionWarning> warnings) {
        NativeNode source = node.source();
        Position start = inherited;
        if (source.hasStartHint()) {
            Position own = map(index, source.line(), source.column(), PositionWarning.Boundary.START,
                    node, path, warnings);
            if (own != null) {
                start = own;
            }
        }
        Position end = null;
        if (source.hasEndHint()) {
            end = map(index, source.endLine(), source.endColumn(), PositionWarning.Boundary.END,
                    node, path, warnings);
        }

        List<AnnotatedNode.AnnotatedField> fields = new ArrayList<>(node.fields().size());
        for (AnnotatedNode.AnnotatedField field : node.fields()) {
            List<AnnotatedNode> children = new ArrayList<>(field.nodes().size());
            for (int i = 0; i < field.nodes().size(); i++) {
                String childPath = NativeNode.Field.childPath(path, field.role(), field.list(), i);
                children.add(resolve(field.nodes().get(i), start, childPath, index, warnings));
            }
            fields.add(new AnnotatedNode.AnnotatedField(field.role(), children, field.list()));
        }
        return node.withPositions(start, end, fields);
    }

    private static Position map(LineIndex index, Integer line, Integer column, PositionWarning.Boundary boundary,
                                AnnotatedNode node, String path, List<PositionWarning> warnings) {
        int col = column != null ? column : 0;
        String reason = null;
        if (!index.hasLine(line)) {
            reason = "line outside 1.." + index.lineCount();
        } else if (col < 0) {
            reason = "negative column";
        }
        if (reason != null) {
            warnings.add(PositionWarning.builder()
                    .nodeKind(node.kind())
                    .nodePath(path)
                    .boundary(boundary)
                    .line(line)
                    .column(col)
                    .reason(reason)
                    .build());
            return null;
        }
        return index.position(line, col);
    }
}
