package com.vidnyan.uast.domain.annotation;

import com.vidnyan.uast.domain.node.AnnotatedNode;
import com.vidnyan.uast.domain.node.NativeNode;
import com.vidnyan.uast.domain.node.RoleSet;
import com.vidnyan.uast.domain.rule.MatchContext;
import com.vidnyan.uast.domain.rule.Predicates;
import com.vidnyan.uast.domain.rule.Rule;
import com.vidnyan.uast.domain.rule.RuleTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a native tree and attaches roles according to a rule graph.
 * <p>
 * A rule list is applied along an axis: the node itself, its immediate children, or its
 * whole subtree in pre-order. Validation rules go first; the first one matching any node
 * of the axis aborts the run. Annotation rules then run one at a time in declaration
 * order, each across the whole axis, before the next rule starts. A rule matched at a
 * node attaches its roles, then applies its nested groups in the order they were
 * declared. Roles attached first stay first, so an earlier rule gives a node its primary
 * role. Child order is the declared order of the native tree, so two runs over the same
 * input always produce the same role order.
 * <p>
 * Stateless. All mutable state lives in a single run, so one instance can be shared.
 */
@Slf4j
public class Annotator {

    /**
     * Annotate {@code root} with a language rule table.
     */
    public AnnotatedNode annotate(RuleTable table, NativeNode root) throws StructuralException {
        log.debug("Annotating {} tree rooted at {}", table.language(), root.kind());
        return annotate(table.root(), root);
    }

    /**
     * Annotate {@code root} starting from {@code rootRule}.
     *
     * @throws StructuralException if a validation rule matched anywhere in the tree
     */
    public AnnotatedNode annotate(Rule rootRule, NativeNode root) throws StructuralException {
        Run run = new Run();
        NodeState state = NodeState.build(root, MatchContext.root(), root.kind());
        run.applyAxis(List.of(rootRule), List.of(state));
        AnnotatedNode annotated = state.freeze();
        if (log.isDebugEnabled()) {
            List<AnnotatedNode> nodes = annotated.preOrder();
            long unmatched = nodes.stream().filter(n -> n.roles().isEmpty()).count();
            log.debug("Annotated {} nodes: {} predicate evaluations, {} rule matches, {} nodes without roles",
                    nodes.size(), run.evaluations, run.matches, unmatched);
        }
        return annotated;
    }

    /**
     * Counters for one run.
     */
    private static final class Run {
        private int evaluations;
        private int matches;

        private void applyAxis(List<Rule> rules, List<NodeState> axis) throws StructuralException {
            for (NodeState node : axis) {
                for (Rule rule : rules) {
                    if (rule.isValidation() && matches(rule, node)) {
                        String message = rule.errorMessage().orElseThrow();
                        log.debug("Validation rule {} failed at {}", rule, node.path);
                        throw new StructuralException(message, node.node.kind(), node.path);
                    }
                }
            }
            for (Rule rule : rules) {
                if (rule.isValidation()) {
                    continue;
                }
                for (NodeState node : axis) {
                    if (matches(rule, node)) {
                        matches++;
                        apply(rule, node);
                    }
                }
            }
        }

        private void apply(Rule rule, NodeState node) throws StructuralException {
            node.roles.addAll(rule.roles());
            for (Rule.Scope scope : rule.scopes()) {
                switch (scope.axis()) {
                    case SELF -> applyAxis(scope.rules(), List.of(node));
                    case CHILDREN -> applyAxis(scope.rules(), node.children());
                    case DESCENDANTS -> applyAxis(scope.rules(), node.descendants());
                }
            }
        }

        private boolean matches(Rule rule, NodeState node) {
            evaluations++;
            return Predicates.matches(rule.predicate(), node.node, node.context);
        }
    }

    /**
     * Mutable mirror of a native node, alive for one run only.
     */
    private static final class NodeState {
        private final NativeNode node;
        private final MatchContext context;
        private final String path;
        private final RoleSet.Builder roles = RoleSet.builder();
        private final List<FieldState> fields = new ArrayList<>();

        private NodeState(NativeNode node, MatchContext context, String path) {
            this.node = node;
            this.context = context;
            this.path = path;
        }

        static NodeState build(NativeNode node, MatchContext context, String path) {
            NodeState state = new NodeState(node, context, path);
            for (NativeNode.Field field : node.fields()) {
                MatchContext childContext = context.descend(node, field.role());
                List<NodeState> children = new ArrayList<>(field.nodes().size());
                for (int i = 0; i < field.nodes().size(); i++) {
                    String childPath = NativeNode.Field.childPath(path, field.role(), field.list(), i);
                    children.add(build(field.nodes().get(i), childContext, childPath));
                }
                state.fields.add(new FieldState(field, children));
            }
            return state;
        }

        List<NodeState> children() {
            List<NodeState> children = new ArrayList<>();
            for (FieldState field : fields) {
                children.addAll(field.nodes);
            }
            return children;
        }

        // Excludes this node.
        List<NodeState> descendants() {
            List<NodeState> out = new ArrayList<>();
            collectDescendants(out);
            return out;
        }

        private void collectDescendants(List<NodeState> out) {
            for (FieldState field : fields) {
                for (NodeState child : field.nodes) {
                    out.add(child);
                    child.collectDescendants(out);
                }
            }
        }

        AnnotatedNode freeze() {
            List<AnnotatedNode.AnnotatedField> frozen = new ArrayList<>(fields.size());
            for (FieldState field : fields) {
                List<AnnotatedNode> nodes = new ArrayList<>(field.nodes.size());
                for (NodeState child : field.nodes) {
                    nodes.add(child.freeze());
                }
                frozen.add(new AnnotatedNode.AnnotatedField(field.field.role(), nodes, field.field.list()));
            }
            return AnnotatedNode.of(node, roles.build(), frozen);
        }
    }

    private record FieldState(NativeNode.Field field, List<NodeState> nodes) {
    }
}
