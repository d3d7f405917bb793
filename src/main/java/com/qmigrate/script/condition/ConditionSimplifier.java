package com.qmigrate.script.condition;

import java.util.ArrayList;
import java.util.List;

import com.qmigrate.debug.Debug;
import com.qmigrate.script.condition.BoolExpr.Kind;

/**
 * Simplifies mapped conditions ("WIN32 AND NOT (APPLE OR UNIX)") to a canonical
 * minimal form using two-level minimization plus the platform axioms.
 *
 * Equivalent inputs give the same output; simplifying an output again returns
 * it unchanged. Conditions over more atoms than the minimizer tabulates are
 * first reduced on the tree ({@link ConditionReducer}); contradictions among
 * them still come out as OFF, and their independent parts are minimized one by
 * one. Only text that does not parse is returned as is (trimmed).
 */
public final class ConditionSimplifier {
    private static final String TAG = "qmigrate.simplify";

    public static final String TRUE = "ON";
    public static final String FALSE = "OFF";

    private static final int MAX_ROUNDS = 32;

    private final LogicMinimizer minimizer = new LogicMinimizer();

    public String simplify(String condition) {
        String input = condition == null ? "" : condition.trim();
        if (input.isEmpty()) return TRUE;

        final BoolExpr parsed;
        try {
            parsed = new BoolExprParser(input).parse();
        } catch (IllegalArgumentException e) {
            Debug.get().d(TAG, "Leaving condition as is (" + e.getMessage() + "): " + input);
            return input;
        }

        BoolExpr expr = parsed;
        for (int round = 0; round < MAX_ROUNDS; round++) {
            BoolExpr next = simplify(expr);
            if (next.equals(expr)) break;
            expr = next;
        }
        String out = expr.render();
        Debug.get().t(TAG, () -> input + " => " + out);
        return out;
    }

    BoolExpr simplify(BoolExpr expr) {
        if (fits(expr)) return minimizeWithAxioms(expr);

        BoolExpr reduced = ConditionReducer.reduce(expr);
        if (fits(reduced)) return minimizeWithAxioms(reduced);
        if (ConditionReducer.isUnsatisfiable(reduced)) return BoolExpr.FALSE;
        if (ConditionReducer.isUnsatisfiable(ConditionReducer.pushNegations(BoolExpr.not(reduced)))) {
            return BoolExpr.TRUE;
        }

        Debug.get().t(TAG, () -> "Simplifying " + reduced.atoms().size() + " atoms part by part: " + reduced);
        return ConditionReducer.reduce(simplifyParts(reduced));
    }

    private static boolean fits(BoolExpr expr) {
        return expr.atoms().size() <= LogicMinimizer.MAX_ATOMS;
    }

    private BoolExpr minimizeWithAxioms(BoolExpr expr) {
        expr = minimizer.minimize(expr);
        for (int round = 0; round < MAX_ROUNDS; round++) {
            BoolExpr axioms = PlatformAxioms.apply(expr);
            if (axioms.equals(expr)) break;
            BoolExpr next = minimizer.minimize(axioms);
            if (next.equals(expr)) break;
            expr = next;
        }
        return expr;
    }

    /**
     * Atom-disjoint groups of a top-level AND / OR are simplified separately;
     * when everything is connected, each argument is.
     */
    private BoolExpr simplifyParts(BoolExpr expr) {
        if (expr.kind() != Kind.AND && expr.kind() != Kind.OR) return expr;

        List<List<BoolExpr>> groups = ConditionReducer.components(expr.args());
        List<BoolExpr> parts = new ArrayList<>();
        if (groups.size() > 1) {
            for (List<BoolExpr> group : groups) parts.add(simplify(BoolExpr.nary(expr.kind(), group)));
        } else {
            for (BoolExpr a : expr.args()) parts.add(simplify(a));
        }
        return BoolExpr.nary(expr.kind(), parts);
    }
}
