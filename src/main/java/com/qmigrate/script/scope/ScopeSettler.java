package com.qmigrate.script.scope;

import java.util.ArrayList;
import java.util.List;

/**
 * Bottom-up collapse of operation-free scopes that only wrap one conditional
 * (plus an optional else). The wrapped child takes over the conjoined
 * condition; the else child is rewritten to the explicit complement so it no
 * longer depends on sibling order.
 */
final class ScopeSettler {

    private ScopeSettler() {}

    static void settle(Scope scope) {
        List<Scope> settled = new ArrayList<>();
        List<Scope> children = scope.ownChildren();
        for (int i = 0; i < children.size(); i++) {
            Scope c = children.get(i);
            settle(c);

            if (!canMerge(c)) {
                settled.add(c);
                continue;
            }

            // c's own else branch would otherwise negate the promoted child instead of c
            if (i + 1 < children.size() && "else".equals(children.get(i + 1).condition())) {
                children.get(i + 1).setCondition("NOT (" + c.condition() + ")");
            }

            List<Scope> grandChildren = c.ownChildren();
            Scope branch = grandChildren.get(0);
            String branchCondition = branch.condition();
            branch.setCondition("(" + c.condition() + ") AND (" + branchCondition + ")");
            settled.add(branch);

            if (grandChildren.size() == 2) {
                Scope otherwise = grandChildren.get(1);
                otherwise.setCondition("(" + c.condition() + ") AND NOT (" + branchCondition + ")");
                settled.add(otherwise);
            }
            c.detach();
        }
        scope.replaceChildren(settled);
    }

    static boolean canMerge(Scope scope) {
        if ("else".equals(scope.condition()) || scope.condition().isEmpty()) return false;
        if (scope.hasOperations()) return false;

        List<Scope> children = scope.ownChildren();
        int count = children.size();
        if (count == 0 || count > 2) return false;
        if ("else".equals(children.get(0).condition())) return false;
        return count == 1 || "else".equals(children.get(1).condition());
    }
}
