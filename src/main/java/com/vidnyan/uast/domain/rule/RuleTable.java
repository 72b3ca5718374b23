package com.vidnyan.uast.domain.rule;

import java.util.Objects;

/**
 * The complete rule set for one source language: a single root rule.
 * Built once and shared read-only by every annotation run.
 */
public record RuleTable(
    String language,
    Rule root
) {

    public RuleTable {
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(root, "root");
        if (root.isValidation()) {
            throw new IllegalArgumentException("Root rule of '" + language + "' must be an annotation rule");
        }
    }

    /**
     * Total rules in the table.
     */
    public int size() {
        return root.ruleCount();
    }
}
