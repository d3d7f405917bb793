package com.qmigrate.script.condition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import com.qmigrate.script.condition.BoolExpr.Kind;

/**
 * What is known about the platform variables: UNIX and WIN32 are
 * complementary, a flavor implies its platform, and platforms of different
 * families exclude each other.
 *
 * The same rules are used two ways: as rewrites on an expression
 * ({@link #apply}) and as propagation over a partial assignment
 * ({@link #assign}).
 */
final class PlatformAxioms {

    private static final BoolExpr UNIX = BoolExpr.atom("UNIX");
    private static final BoolExpr WIN32 = BoolExpr.atom("WIN32");
    private static final BoolExpr WINRT = BoolExpr.atom("WINRT");
    private static final BoolExpr APPLE = BoolExpr.atom("APPLE");
    private static final BoolExpr BSD = BoolExpr.atom("BSD");
    private static final BoolExpr ANDROID = BoolExpr.atom("ANDROID");
    private static final BoolExpr ANDROID_EMBEDDED = BoolExpr.atom("ANDROID_EMBEDDED");

    private static final List<BoolExpr> APPLES = atoms(
            "APPLE_OSX", "APPLE_UIKIT", "APPLE_IOS", "APPLE_TVOS", "APPLE_WATCHOS");
    private static final List<BoolExpr> BSDS = atoms("FREEBSD", "OPENBSD", "NETBSD");
    private static final List<BoolExpr> ANDROIDS = List.of(ANDROID, ANDROID_EMBEDDED);
    private static final List<BoolExpr> UNIXES = unixes();

    /** {platform, flavor}, in rewrite order. */
    private static final List<BoolExpr[]> FLAVORS = new ArrayList<>();
    /** {member, other} pairs that never hold together, in rewrite order. */
    private static final List<BoolExpr[]> EXCLUSIONS = new ArrayList<>();

    static {
        flavors(WIN32, List.of(WINRT));
        flavors(APPLE, APPLES);
        flavors(BSD, BSDS);
        flavors(UNIX, UNIXES);
        flavors(ANDROID, List.of(ANDROID_EMBEDDED));

        exclusions(List.of(WIN32, WINRT), UNIXES);
        exclusions(ANDROIDS, UNIXES);
        List<BoolExpr> bsdFamily = new ArrayList<>();
        bsdFamily.add(BSD);
        bsdFamily.addAll(BSDS);
        exclusions(bsdFamily, UNIXES);
        for (String single : Arrays.asList("HAIKU", "QNX", "INTEGRITY", "LINUX", "VXWORKS")) {
            exclusions(List.of(BoolExpr.atom(single)), UNIXES);
        }
    }

    private PlatformAxioms() {}

    private static List<BoolExpr> atoms(String... names) {
        List<BoolExpr> out = new ArrayList<>();
        for (String n : names) out.add(BoolExpr.atom(n));
        return out;
    }

    private static List<BoolExpr> unixes() {
        List<BoolExpr> out = new ArrayList<>();
        out.add(APPLE);
        out.addAll(APPLES);
        out.add(BSD);
        out.addAll(BSDS);
        out.add(BoolExpr.atom("LINUX"));
        out.addAll(ANDROIDS);
        out.addAll(atoms("HAIKU", "INTEGRITY", "VXWORKS", "QNX", "WASM"));
        return out;
    }

    private static void flavors(BoolExpr platform, List<BoolExpr> flavors) {
        for (BoolExpr f : flavors) FLAVORS.add(new BoolExpr[] { platform, f });
    }

    private static void exclusions(List<BoolExpr> family, List<BoolExpr> others) {
        for (BoolExpr member : family) {
            for (BoolExpr other : others) {
                if (!family.contains(other)) EXCLUSIONS.add(new BoolExpr[] { member, other });
            }
        }
    }

    // -------------------------
    // Rewrites
    // -------------------------

    static BoolExpr apply(BoolExpr expr) {
        expr = substitute(expr, BoolExpr.not(UNIX), WIN32);
        expr = substitute(expr, BoolExpr.not(WIN32), UNIX);

        expr = rewrite(expr, Kind.OR, List.of(UNIX, WIN32), BoolExpr.TRUE);
        expr = rewrite(expr, Kind.AND, List.of(UNIX, WIN32), BoolExpr.FALSE);

        // a flavor implies its platform: "P AND f" is "f", "P OR f" is "P", "NOT P AND f" is false
        for (BoolExpr[] rule : FLAVORS) {
            BoolExpr platform = rule[0];
            BoolExpr f = rule[1];
            expr = rewrite(expr, Kind.AND, List.of(platform, f), f);
            expr = rewrite(expr, Kind.OR, List.of(platform, f), platform);
            expr = rewrite(expr, Kind.AND, List.of(BoolExpr.not(platform), f), BoolExpr.FALSE);
        }

        for (BoolExpr[] pair : EXCLUSIONS) {
            BoolExpr member = pair[0];
            BoolExpr other = pair[1];
            expr = rewrite(expr, Kind.AND, List.of(member, BoolExpr.not(other)), member);
            expr = rewrite(expr, Kind.AND, List.of(BoolExpr.not(member), other), other);
            expr = rewrite(expr, Kind.AND, List.of(member, other), BoolExpr.FALSE);
        }
        return expr;
    }

    /** Replaces every occurrence of from (structurally equal) with to. */
    static BoolExpr substitute(BoolExpr expr, BoolExpr from, BoolExpr to) {
        if (expr.equals(from)) return to;
        switch (expr.kind()) {
            case NOT:
                return BoolExpr.not(substitute(expr.args().get(0), from, to));
            case AND:
            case OR: {
                List<BoolExpr> args = new ArrayList<>();
                for (BoolExpr a : expr.args()) args.add(substitute(a, from, to));
                return BoolExpr.nary(expr.kind(), args);
            }
            default:
                return expr;
        }
    }

    /**
     * Bottom-up: any node of kind op that contains all of matches has them
     * replaced by the single replacement.
     */
    static BoolExpr rewrite(BoolExpr expr, Kind op, List<BoolExpr> matches, BoolExpr replacement) {
        switch (expr.kind()) {
            case NOT:
                expr = BoolExpr.not(rewrite(expr.args().get(0), op, matches, replacement));
                break;
            case AND:
            case OR: {
                List<BoolExpr> args = new ArrayList<>();
                for (BoolExpr a : expr.args()) args.add(rewrite(a, op, matches, replacement));
                expr = BoolExpr.nary(expr.kind(), args);
                break;
            }
            default:
                break;
        }

        if (expr.kind() == op && expr.args().containsAll(matches)) {
            List<BoolExpr> kept = new ArrayList<>(expr.args());
            kept.removeAll(matches);
            kept.add(replacement);
            return BoolExpr.nary(op, kept);
        }
        return expr;
    }

    // -------------------------
    // Propagation
    // -------------------------

    /**
     * Sets atom to value in assignment together with everything the rules
     * force from it. Returns false, leaving assignment partly updated, when
     * that contradicts a value already assigned.
     */
    static boolean assign(Map<String, Boolean> assignment, String atom, boolean value) {
        Deque<Object[]> work = new ArrayDeque<>();
        work.add(new Object[] { atom, value });
        while (!work.isEmpty()) {
            Object[] next = work.poll();
            String name = (String) next[0];
            boolean v = (Boolean) next[1];

            Boolean current = assignment.get(name);
            if (current != null) {
                if (current != v) return false;
                continue;
            }
            assignment.put(name, v);

            if (name.equals(nameOf(UNIX))) work.add(new Object[] { nameOf(WIN32), !v });
            if (name.equals(nameOf(WIN32))) work.add(new Object[] { nameOf(UNIX), !v });

            for (BoolExpr[] rule : FLAVORS) {
                if (v && name.equals(nameOf(rule[1]))) work.add(new Object[] { nameOf(rule[0]), true });
                if (!v && name.equals(nameOf(rule[0]))) work.add(new Object[] { nameOf(rule[1]), false });
            }
            if (v) {
                for (BoolExpr[] pair : EXCLUSIONS) {
                    if (name.equals(nameOf(pair[0]))) work.add(new Object[] { nameOf(pair[1]), false });
                    if (name.equals(nameOf(pair[1]))) work.add(new Object[] { nameOf(pair[0]), false });
                }
            }
        }
        return true;
    }

    private static String nameOf(BoolExpr atom) {
        return ((BoolExpr.Atom) atom).name;
    }
}
