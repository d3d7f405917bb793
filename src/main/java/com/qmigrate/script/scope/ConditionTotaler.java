package com.qmigrate.script.scope;

import com.qmigrate.script.condition.ConditionSimplifier;

/**
 * Computes and caches every scope's total condition, depth first and left to
 * right. An "else" scope negates the total condition of its preceding sibling.
 */
public final class ConditionTotaler {

    private final ConditionSimplifier simplifier;

    public ConditionTotaler(ConditionSimplifier simplifier) {
        this.simplifier = simplifier;
    }

    public void total(Scope root) {
        evaluate(root, null, null);
    }

    /** Returns the scope's total condition for use by the next sibling. */
    private String evaluate(Scope scope, String parentTotal, String previousTotal) {
        String total = scope.condition();
        if ("else".equals(total)) {
            if (previousTotal == null) {
                throw new StructuralError(scope.file(), "Else branch without previous condition");
            }
            total = "NOT (" + previousTotal + ")";
        }
        if (parentTotal != null) {
            total = total.isEmpty() ? parentTotal : "(" + parentTotal + ") AND (" + total + ")";
        }

        String simplified = simplifier.simplify(total);
        scope.cacheTotalCondition(simplified);

        String previous = null;
        for (Scope child : scope.ownChildren()) {
            previous = evaluate(child, simplified, previous);
        }
        for (Scope included : scope.includedScopes()) {
            evaluate(included, simplified, null);
        }
        return simplified;
    }
}
