package com.qmigrate.script.condition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import com.qmigrate.script.condition.BoolExpr.Kind;

/**
 * Shrinks conditions with too many atoms to tabulate.
 *
 * Works on the expression tree directly: negations are pushed down to the
 * atoms, the platform rewrites are applied, and the literals of every AND / OR
 * are substituted into their siblings (A AND f is A AND f[A=1], A OR f is
 * A OR f[A=0]) together with whatever the platform rules force from them.
 * A bounded case-split search then tells contradictions and tautologies apart
 * from everything else.
 */
final class ConditionReducer {

    private static final int MAX_ROUNDS = 32;

    // case-split nodes per satisfiability check; an exhausted search proves nothing
    static final int SEARCH_BUDGET = 100_000;

    private ConditionReducer() {}

    static BoolExpr reduce(BoolExpr expr) {
        for (int round = 0; round < MAX_ROUNDS; round++) {
            BoolExpr next = substituteLiterals(PlatformAxioms.apply(pushNegations(expr)));
            if (next.equals(expr)) break;
            expr = next;
        }
        return expr;
    }

    /** Negation normal form: NOT only directly above atoms. */
    static BoolExpr pushNegations(BoolExpr expr) {
        switch (expr.kind()) {
            case NOT: {
                BoolExpr operand = expr.args().get(0);
                if (operand.kind() != Kind.AND && operand.kind() != Kind.OR) return expr;
                List<BoolExpr> negated = new ArrayList<>();
                for (BoolExpr a : operand.args()) negated.add(pushNegations(BoolExpr.not(a)));
                return BoolExpr.nary(operand.kind() == Kind.AND ? Kind.OR : Kind.AND, negated);
            }
            case AND:
            case OR: {
                List<BoolExpr> args = new ArrayList<>();
                for (BoolExpr a : expr.args()) args.add(pushNegations(a));
                return BoolExpr.nary(expr.kind(), args);
            }
            default:
                return expr;
        }
    }

    /** Replaces assigned atoms by constants. */
    static BoolExpr restrict(BoolExpr expr, Map<String, Boolean> assignment) {
        switch (expr.kind()) {
            case ATOM: {
                Boolean v = assignment.get(((BoolExpr.Atom) expr).name);
                return v == null ? expr : BoolExpr.constant(v);
            }
            case NOT:
                return BoolExpr.not(restrict(expr.args().get(0), assignment));
            case AND:
            case OR: {
                List<BoolExpr> args = new ArrayList<>();
                for (BoolExpr a : expr.args()) args.add(restrict(a, assignment));
                return BoolExpr.nary(expr.kind(), args);
            }
            default:
                return expr;
        }
    }

    private static BoolExpr substituteLiterals(BoolExpr expr) {
        if (expr.kind() != Kind.AND && expr.kind() != Kind.OR) return expr;
        boolean isAnd = expr.kind() == Kind.AND;

        // inside an AND its literals hold, inside an OR the siblings only matter when they fail
        Map<String, Boolean> known = new HashMap<>();
        List<BoolExpr> out = new ArrayList<>();
        List<BoolExpr> compound = new ArrayList<>();
        for (BoolExpr a : expr.args()) {
            if (!isLiteral(a)) {
                compound.add(a);
                continue;
            }
            boolean positive = a.kind() == Kind.ATOM;
            if (!PlatformAxioms.assign(known, literalName(a), isAnd == positive)) {
                return isAnd ? BoolExpr.FALSE : BoolExpr.TRUE;
            }
            out.add(a);
        }
        for (BoolExpr c : compound) {
            out.add(substituteLiterals(restrict(c, known)));
        }
        return BoolExpr.nary(expr.kind(), out);
    }

    static boolean isLiteral(BoolExpr e) {
        return e.kind() == Kind.ATOM || (e.kind() == Kind.NOT && e.args().get(0).kind() == Kind.ATOM);
    }

    private static String literalName(BoolExpr literal) {
        BoolExpr atom = literal.kind() == Kind.NOT ? literal.args().get(0) : literal;
        return ((BoolExpr.Atom) atom).name;
    }

    // -------------------------
    // Independent parts
    // -------------------------

    /** Groups args so that no two groups share an atom; groups keep the args' order. */
    static List<List<BoolExpr>> components(List<BoolExpr> args) {
        int[] parent = new int[args.size()];
        for (int i = 0; i < parent.length; i++) parent[i] = i;

        Map<String, Integer> owner = new HashMap<>();
        for (int i = 0; i < args.size(); i++) {
            for (String atom : args.get(i).atoms()) {
                Integer j = owner.putIfAbsent(atom, i);
                if (j != null) parent[find(parent, i)] = find(parent, j);
            }
        }

        Map<Integer, List<BoolExpr>> groups = new LinkedHashMap<>();
        for (int i = 0; i < args.size(); i++) {
            groups.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(args.get(i));
        }
        return new ArrayList<>(groups.values());
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    // -------------------------
    // Satisfiability
    // -------------------------

    /** True only when no assignment consistent with the platform rules satisfies expr. */
    static boolean isUnsatisfiable(BoolExpr expr) {
        return !new Search().satisfiable(expr, new HashMap<>());
    }

    private static final class Search {
        private int nodes;

        /** Gives up by answering true once the budget is spent. */
        boolean satisfiable(BoolExpr expr, Map<String, Boolean> assignment) {
            if (expr.equals(BoolExpr.TRUE)) return true;
            if (expr.equals(BoolExpr.FALSE)) return false;
            if (++nodes > SEARCH_BUDGET) return true;

            if (expr.kind() == Kind.AND) {
                Map<String, Boolean> units = new HashMap<>(assignment);
                boolean found = false;
                for (BoolExpr a : expr.args()) {
                    if (!isLiteral(a)) continue;
                    found = true;
                    if (!PlatformAxioms.assign(units, literalName(a), a.kind() == Kind.ATOM)) return false;
                }
                if (found) return satisfiable(restrict(expr, units), units);
            }

            String atom = new TreeSet<>(expr.atoms()).first();
            for (boolean value : new boolean[] { true, false }) {
                Map<String, Boolean> branch = new HashMap<>(assignment);
                if (PlatformAxioms.assign(branch, atom, value) && satisfiable(restrict(expr, branch), branch)) {
                    return true;
                }
            }
            return false;
        }
    }
}
