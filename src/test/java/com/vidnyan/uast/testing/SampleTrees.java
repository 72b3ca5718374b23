package com.vidnyan.uast.testing;

import com.vidnyan.uast.domain.node.NativeNode;
import com.vidnyan.uast.domain.rule.Rule;
import com.vidnyan.uast.domain.rule.RuleTable;

import static com.vidnyan.uast.domain.node.UastRole.*;
import static com.vidnyan.uast.domain.rule.Predicates.*;

/**
 * A cut-down Python rule table and the native trees the tests feed it.
 */
public final class SampleTrees {

    private SampleTrees() {
    }

    public static final Rule PYTHON_RULES = Rule.on(any()).self(
            Rule.on(not(kind("Module"))).error("root must be of kind Module"),
            Rule.on(kind("Module")).roles(FILE, MODULE).descendants(
                    Rule.on(kind("BinOp")).roles(EXPRESSION, BINARY).children(
                            Rule.on(fieldRole("op")).roles(EXPRESSION, BINARY, OPERATOR),
                            Rule.on(fieldRole("left")).roles(EXPRESSION, BINARY, LEFT),
                            Rule.on(fieldRole("right")).roles(EXPRESSION, BINARY, RIGHT)),
                    Rule.on(kind("Add")).roles(BINARY, OPERATOR, ADD),
                    Rule.on(kind("Lt")).roles(BINARY, OPERATOR, LESS_THAN),
                    Rule.on(kind("Num")).roles(LITERAL, NUMBER, EXPRESSION, PRIMITIVE),
                    Rule.on(kind("Name")).roles(IDENTIFIER, EXPRESSION),
                    Rule.on(kind("Expr")).roles(EXPRESSION),
                    Rule.on(kind("Assign")).roles(BINARY, ASSIGNMENT, EXPRESSION).children(
                            Rule.on(fieldRole("targets")).roles(LEFT),
                            Rule.on(fieldRole("value")).roles(RIGHT)),
                    // ops and comparators are parallel lists; they cannot be paired, only tagged coarsely
                    Rule.on(kind("Compare")).roles(EXPRESSION, BINARY).children(
                            Rule.on(fieldRole("ops")).roles(EXPRESSION),
                            Rule.on(fieldRole("left")).roles(EXPRESSION, LEFT),
                            Rule.on(fieldRole("comparators")).roles(EXPRESSION, RIGHT)),
                    Rule.on(kind("Call")).roles(FUNCTION, CALL, EXPRESSION).children(
                            Rule.on(fieldRole("args")).roles(FUNCTION, CALL, POSITIONAL, ARGUMENT, NAME),
                            Rule.on(fieldRole("func")).self(
                                    Rule.on(kind("Name")).roles(CALL, CALLEE),
                                    Rule.on(kind("Attribute")).roles(CALL, CALLEE).children(
                                            Rule.on(fieldRole("value")).roles(CALL, RECEIVER)))),
                    Rule.on(kind("PreviousNoops")).roles(WHITESPACE).children(
                            Rule.on(fieldRole("lines")).roles(COMMENT))));

    public static final RuleTable PYTHON = new RuleTable("python", PYTHON_RULES);

    /**
     * Source of {@link #assignment()}.
     */
    public static final String ASSIGNMENT_SOURCE = "x = a + 1\n";

    /**
     * {@code x = a + 1}
     */
    public static NativeNode assignment() {
        NativeNode binOp = NativeNode.builder("BinOp").position(1, 4)
                .child("left", NativeNode.builder("Name").property("id", "a").token("a").position(1, 4).build())
                .child("op", NativeNode.builder("Add").build())
                .child("right", NativeNode.builder("Num").token("1").position(1, 8).build())
                .build();
        NativeNode assign = NativeNode.builder("Assign").position(1, 0)
                .children("targets", NativeNode.builder("Name").property("id", "x").token("x").position(1, 0).build())
                .child("value", binOp)
                .build();
        return NativeNode.builder("Module").children("body", assign).build();
    }

    /**
     * {@code print(a < b < c)} with a leading comment line.
     */
    public static NativeNode callWithComparison() {
        NativeNode compare = NativeNode.builder("Compare").position(2, 6)
                .child("left", NativeNode.builder("Name").token("a").position(2, 6).build())
                .children("ops", NativeNode.builder("Lt").build(), NativeNode.builder("Lt").build())
                .children("comparators",
                        NativeNode.builder("Name").token("b").position(2, 10).build(),
                        NativeNode.builder("Name").token("c").position(2, 14).build())
                .build();
        NativeNode call = NativeNode.builder("Call").position(2, 0)
                .child("func", NativeNode.builder("Name").token("print").position(2, 0).build())
                .children("args", compare)
                .build();
        NativeNode noops = NativeNode.builder("PreviousNoops").position(1, 0)
                .children("lines", NativeNode.builder("NoopLine").token("# compare").position(1, 0).build())
                .build();
        NativeNode expr = NativeNode.builder("Expr")
                .child("noops_previous", noops)
                .child("value", call)
                .build();
        return NativeNode.builder("Module").children("body", expr).build();
    }

    public static final String CALL_SOURCE = "# compare\nprint(a < b < c)\n";
}
