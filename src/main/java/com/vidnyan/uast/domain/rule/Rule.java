package com.vidnyan.uast.domain.rule;

import com.vidnyan.uast.domain.node.Role;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Unit of annotation configuration: a predicate plus what happens to the nodes it matches.
 * <p>
 * A rule is one of two kinds. A <em>validation rule</em> carries an error and nothing else;
 * a match aborts annotation of the whole tree. An <em>annotation rule</em> carries roles to
 * attach and nested rule groups, each applied along one {@link Axis}:
 * <ul>
 *   <li>{@code self} - evaluated again against the same node,</li>
 *   <li>{@code children} - evaluated against each immediate child,</li>
 *   <li>{@code descendants} - evaluated against every node below, at any depth.</li>
 * </ul>
 * Groups run in the order the fluent methods were called, so
 * {@code on(p).children(a).self(b)} applies {@code a} before {@code b}.
 * Rules are immutable; every fluent method returns a new rule, so tables can be built
 * once and shared between threads.
 */
public final class Rule {

    public enum Axis {
        SELF, CHILDREN, DESCENDANTS
    }

    /**
     * Nested rules applied along one axis of the matched node.
     */
    public record Scope(Axis axis, List<Rule> rules) {
        public Scope {
            Objects.requireNonNull(axis, "axis");
            rules = List.copyOf(rules);
        }
    }

    private final NodePredicate predicate;
    private final List<Role> roles;
    private final String error;
    private final List<Scope> scopes;

    private Rule(NodePredicate predicate, List<Role> roles, String error, List<Scope> scopes) {
        this.predicate = Objects.requireNonNull(predicate, "predicate");
        this.roles = List.copyOf(roles);
        this.error = error;
        this.scopes = List.copyOf(scopes);
    }

    /**
     * Start a rule matching {@code predicate}.
     */
    public static Rule on(NodePredicate predicate) {
        return new Rule(predicate, List.of(), null, List.of());
    }

    /**
     * Roles to attach on match, appended after any already declared.
     */
    public Rule roles(Role... more) {
        return roles(List.of(more));
    }

    public Rule roles(List<? extends Role> more) {
        requireAnnotationRule("roles");
        return new Rule(predicate, concat(roles, more), null, scopes);
    }

    /**
     * Turn this rule into a validation rule failing with {@code message}.
     */
    public Rule error(String message) {
        Objects.requireNonNull(message, "message");
        if (!roles.isEmpty() || !scopes.isEmpty()) {
            throw new IllegalStateException("Validation rule on " + predicate + " cannot carry roles or nested rules");
        }
        return new Rule(predicate, List.of(), message, scopes);
    }

    public Rule self(Rule... rules) {
        return scope(Axis.SELF, rules);
    }

    public Rule children(Rule... rules) {
        return scope(Axis.CHILDREN, rules);
    }

    public Rule descendants(Rule... rules) {
        return scope(Axis.DESCENDANTS, rules);
    }

    private Rule scope(Axis axis, Rule... rules) {
        requireAnnotationRule(axis.name().toLowerCase(Locale.ROOT) + " rules");
        return new Rule(predicate, roles, null, concat(scopes, List.of(new Scope(axis, List.of(rules)))));
    }

    public NodePredicate predicate() {
        return predicate;
    }

    public List<Role> roles() {
        return roles;
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }

    public boolean isValidation() {
        return error != null;
    }

    /**
     * Nested groups in declaration order.
     */
    public List<Scope> scopes() {
        return scopes;
    }

    public List<Rule> selfRules() {
        return rulesOn(Axis.SELF);
    }

    public List<Rule> childRules() {
        return rulesOn(Axis.CHILDREN);
    }

    public List<Rule> descendantRules() {
        return rulesOn(Axis.DESCENDANTS);
    }

    /**
     * Number of rules in this graph, this one included.
     */
    public int ruleCount() {
        int count = 1;
        for (Scope scope : scopes) {
            for (Rule rule : scope.rules()) {
                count += rule.ruleCount();
            }
        }
        return count;
    }

    private List<Rule> rulesOn(Axis axis) {
        List<Rule> out = new ArrayList<>();
        for (Scope scope : scopes) {
            if (scope.axis() == axis) {
                out.addAll(scope.rules());
            }
        }
        return out;
    }

    private void requireAnnotationRule(String what) {
        if (error != null) {
            throw new IllegalStateException("Validation rule on " + predicate + " cannot carry " + what);
        }
    }

    private static <T> List<T> concat(List<T> head, List<? extends T> tail) {
        List<T> out = new ArrayList<>(head.size() + tail.size());
        out.addAll(head);
        out.addAll(tail);
        return out;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("on(").append(predicate).append(')');
        if (error != null) {
            sb.append(".error(").append(error).append(')');
        }
        if (!roles.isEmpty()) {
            sb.append(".roles").append(roles.stream().map(Role::tag).toList());
        }
        for (Scope scope : scopes) {
            sb.append('.').append(scope.axis().name().toLowerCase(Locale.ROOT))
                    .append('[').append(scope.rules().size()).append(']');
        }
        return sb.toString();
    }
}
