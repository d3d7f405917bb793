package com.qmigrate.script.condition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable boolean expression over named atoms.
 *
 * The factory methods keep expressions canonical: nested AND/OR are
 * flattened, duplicates and identity constants dropped, absorbing constants
 * and complementary literals folded, and arguments sorted. Two expressions
 * built from the same terms are therefore equal regardless of input order.
 */
public abstract class BoolExpr {

    public enum Kind { CONST, ATOM, NOT, AND, OR }

    public static final BoolExpr TRUE = new Const(true);
    public static final BoolExpr FALSE = new Const(false);

    private static final Comparator<BoolExpr> ORDER =
            Comparator.comparing(BoolExpr::sortKey).thenComparing(BoolExpr::render);

    private BoolExpr() {}

    public abstract Kind kind();

    /** Evaluates with atom i taking bit i of assignment, per index. */
    abstract boolean eval(Map<String, Integer> index, int assignment);

    abstract void collectAtoms(Set<String> out);

    /** Target syntax: AND / OR / NOT, "ON" and "OFF" for the constants. */
    public abstract String render();

    public List<BoolExpr> args() {
        return Collections.emptyList();
    }

    public Set<String> atoms() {
        Set<String> out = new LinkedHashSet<>();
        collectAtoms(out);
        return out;
    }

    String sortKey() {
        return render();
    }

    @Override
    public String toString() {
        return render();
    }

    // -------------------------
    // Factories
    // -------------------------

    public static BoolExpr constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static BoolExpr atom(String name) {
        return new Atom(name);
    }

    public static BoolExpr not(BoolExpr operand) {
        if (operand == TRUE) return FALSE;
        if (operand == FALSE) return TRUE;
        if (operand.kind() == Kind.NOT) return ((Not) operand).operand;
        return new Not(operand);
    }

    public static BoolExpr and(BoolExpr... args) {
        return nary(Kind.AND, List.of(args));
    }

    public static BoolExpr and(List<BoolExpr> args) {
        return nary(Kind.AND, args);
    }

    public static BoolExpr or(BoolExpr... args) {
        return nary(Kind.OR, List.of(args));
    }

    public static BoolExpr or(List<BoolExpr> args) {
        return nary(Kind.OR, args);
    }

    static BoolExpr nary(Kind kind, List<BoolExpr> args) {
        BoolExpr identity = kind == Kind.AND ? TRUE : FALSE;
        BoolExpr absorbing = kind == Kind.AND ? FALSE : TRUE;

        Set<BoolExpr> flat = new LinkedHashSet<>();
        for (BoolExpr a : args) {
            if (a.kind() == kind) {
                flat.addAll(a.args());
            } else {
                flat.add(a);
            }
        }
        flat.remove(identity);
        if (flat.contains(absorbing)) return absorbing;
        for (BoolExpr a : flat) {
            if (flat.contains(not(a))) return absorbing;
        }

        if (flat.isEmpty()) return identity;
        if (flat.size() == 1) return flat.iterator().next();

        List<BoolExpr> sorted = new ArrayList<>(flat);
        sorted.sort(ORDER);
        return new Nary(kind, sorted);
    }

    // -------------------------
    // Variants
    // -------------------------

    private static final class Const extends BoolExpr {
        private final boolean value;

        Const(boolean value) { this.value = value; }

        @Override public Kind kind() { return Kind.CONST; }
        @Override boolean eval(Map<String, Integer> index, int assignment) { return value; }
        @Override void collectAtoms(Set<String> out) { }
        @Override public String render() { return value ? ConditionSimplifier.TRUE : ConditionSimplifier.FALSE; }

        @Override public boolean equals(Object o) { return o instanceof Const && ((Const) o).value == value; }
        @Override public int hashCode() { return Boolean.hashCode(value); }
    }

    static final class Atom extends BoolExpr {
        final String name;

        Atom(String name) {
            if (name == null || name.isEmpty()) throw new IllegalArgumentException("Empty atom");
            this.name = name;
        }

        @Override public Kind kind() { return Kind.ATOM; }

        @Override
        boolean eval(Map<String, Integer> index, int assignment) {
            Integer bit = index.get(name);
            if (bit == null) throw new IllegalStateException("Unindexed atom " + name);
            return ((assignment >> bit) & 1) == 1;
        }

        @Override void collectAtoms(Set<String> out) { out.add(name); }
        @Override public String render() { return name; }
        @Override String sortKey() { return name; }

        @Override public boolean equals(Object o) { return o instanceof Atom && ((Atom) o).name.equals(name); }
        @Override public int hashCode() { return name.hashCode(); }
    }

    static final class Not extends BoolExpr {
        final BoolExpr operand;

        Not(BoolExpr operand) { this.operand = operand; }

        @Override public Kind kind() { return Kind.NOT; }
        @Override boolean eval(Map<String, Integer> index, int assignment) { return !operand.eval(index, assignment); }
        @Override void collectAtoms(Set<String> out) { operand.collectAtoms(out); }
        @Override public List<BoolExpr> args() { return List.of(operand); }

        @Override
        public String render() {
            String inner = operand.render();
            return operand.kind() == Kind.AND || operand.kind() == Kind.OR ? "NOT (" + inner + ")" : "NOT " + inner;
        }

        // a negated literal sorts right after its atom
        @Override String sortKey() { return operand.sortKey() + "\u0001"; }

        @Override public boolean equals(Object o) { return o instanceof Not && ((Not) o).operand.equals(operand); }
        @Override public int hashCode() { return ~operand.hashCode(); }
    }

    private static final class Nary extends BoolExpr {
        private final Kind kind;
        private final List<BoolExpr> args;

        Nary(Kind kind, List<BoolExpr> args) {
            this.kind = kind;
            this.args = Collections.unmodifiableList(args);
        }

        @Override public Kind kind() { return kind; }
        @Override public List<BoolExpr> args() { return args; }

        @Override
        boolean eval(Map<String, Integer> index, int assignment) {
            if (kind == Kind.AND) {
                for (BoolExpr a : args) if (!a.eval(index, assignment)) return false;
                return true;
            }
            for (BoolExpr a : args) if (a.eval(index, assignment)) return true;
            return false;
        }

        @Override
        void collectAtoms(Set<String> out) {
            for (BoolExpr a : args) a.collectAtoms(out);
        }

        @Override
        public String render() {
            String op = kind == Kind.AND ? " AND " : " OR ";
            Kind nested = kind == Kind.AND ? Kind.OR : Kind.AND;
            StringBuilder sb = new StringBuilder();
            for (BoolExpr a : args) {
                if (sb.length() > 0) sb.append(op);
                sb.append(a.kind() == nested ? "(" + a.render() + ")" : a.render());
            }
            return sb.toString();
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Nary)) return false;
            Nary other = (Nary) o;
            return other.kind == kind && other.args.equals(args);
        }

        @Override public int hashCode() { return Objects.hash(kind, args); }
    }
}
