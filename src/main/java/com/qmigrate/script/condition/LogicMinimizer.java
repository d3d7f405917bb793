package com.qmigrate.script.condition;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Two-level minimization (Quine-McCluskey prime implicants plus a minimum
 * cover) of an expression's truth table.
 *
 * The result is a sum of products when at least half of the rows are true
 * and a product of sums otherwise. Atoms the function does not depend on
 * disappear.
 */
final class LogicMinimizer {

    static final int MAX_ATOMS = 10;

    // Exhaustive cover search gives up after this many nodes and goes greedy.
    private static final int SEARCH_BUDGET = 20_000;

    BoolExpr minimize(BoolExpr expr) {
        TruthTable table = TruthTable.of(expr, MAX_ATOMS).withoutIrrelevantAtoms();
        int ones = table.countTrue();
        if (ones == 0) return BoolExpr.FALSE;
        if (ones == table.size()) return BoolExpr.TRUE;

        List<String> atoms = table.atoms();
        if (ones * 2 >= table.size()) {
            List<BoolExpr> terms = new ArrayList<>();
            for (Implicant imp : cover(table.rowsWith(true), atoms.size())) {
                terms.add(imp.toProduct(atoms));
            }
            return BoolExpr.or(terms);
        }

        List<BoolExpr> clauses = new ArrayList<>();
        for (Implicant imp : cover(table.rowsWith(false), atoms.size())) {
            clauses.add(imp.toSum(atoms));
        }
        return BoolExpr.and(clauses);
    }

    // -------------------------
    // Prime implicants
    // -------------------------

    static final class Implicant {
        final int value;
        final int mask; // set bits are "don't care"

        Implicant(int value, int mask) {
            this.value = value;
            this.mask = mask;
        }

        boolean covers(int row) {
            return (row & ~mask) == value;
        }

        int literals(int width) {
            return width - Integer.bitCount(mask);
        }

        String pattern(int width) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < width; i++) {
                if (((mask >> i) & 1) == 1) sb.append('-');
                else sb.append(((value >> i) & 1) == 1 ? '1' : '0');
            }
            return sb.toString();
        }

        BoolExpr toProduct(List<String> atoms) {
            List<BoolExpr> lits = new ArrayList<>();
            for (int i = 0; i < atoms.size(); i++) {
                if (((mask >> i) & 1) == 1) continue;
                BoolExpr a = BoolExpr.atom(atoms.get(i));
                lits.add(((value >> i) & 1) == 1 ? a : BoolExpr.not(a));
            }
            return BoolExpr.and(lits);
        }

        /** The clause that is false exactly on this implicant's rows. */
        BoolExpr toSum(List<String> atoms) {
            List<BoolExpr> lits = new ArrayList<>();
            for (int i = 0; i < atoms.size(); i++) {
                if (((mask >> i) & 1) == 1) continue;
                BoolExpr a = BoolExpr.atom(atoms.get(i));
                lits.add(((value >> i) & 1) == 1 ? BoolExpr.not(a) : a);
            }
            return BoolExpr.or(lits);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Implicant)) return false;
            Implicant other = (Implicant) o;
            return other.value == value && other.mask == mask;
        }

        @Override
        public int hashCode() {
            return Objects.hash(value, mask);
        }
    }

    static List<Implicant> primeImplicants(List<Integer> rows, int width) {
        Set<Implicant> current = new LinkedHashSet<>();
        for (int row : rows) current.add(new Implicant(row, 0));

        List<Implicant> primes = new ArrayList<>();
        while (!current.isEmpty()) {
            Set<Implicant> next = new LinkedHashSet<>();
            Set<Implicant> combined = new HashSet<>();
            for (Implicant imp : current) {
                for (int i = 0; i < width; i++) {
                    int bit = 1 << i;
                    if ((imp.mask & bit) != 0 || (imp.value & bit) != 0) continue;
                    Implicant partner = new Implicant(imp.value | bit, imp.mask);
                    if (current.contains(partner)) {
                        next.add(new Implicant(imp.value, imp.mask | bit));
                        combined.add(imp);
                        combined.add(partner);
                    }
                }
            }
            for (Implicant imp : current) {
                if (!combined.contains(imp)) primes.add(imp);
            }
            current = next;
        }

        primes.sort(Comparator.<Implicant>comparingInt(p -> p.literals(width))
                .thenComparing(p -> p.pattern(width)));
        return primes;
    }

    // -------------------------
    // Cover
    // -------------------------

    static List<Implicant> cover(List<Integer> rows, int width) {
        List<Implicant> primes = primeImplicants(rows, width);

        BitSet[] coverage = new BitSet[primes.size()];
        for (int p = 0; p < primes.size(); p++) {
            coverage[p] = new BitSet(rows.size());
            for (int r = 0; r < rows.size(); r++) {
                if (primes.get(p).covers(rows.get(r))) coverage[p].set(r);
            }
        }

        List<Integer> chosen = new ArrayList<>();
        BitSet covered = new BitSet(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            int only = -1;
            int count = 0;
            for (int p = 0; p < primes.size(); p++) {
                if (coverage[p].get(r)) {
                    only = p;
                    count++;
                }
            }
            if (count == 1 && !chosen.contains(only)) {
                chosen.add(only);
                covered.or(coverage[only]);
            }
        }

        List<Integer> candidates = new ArrayList<>();
        for (int p = 0; p < primes.size(); p++) {
            if (!chosen.contains(p)) {
                BitSet extra = (BitSet) coverage[p].clone();
                extra.andNot(covered);
                if (!extra.isEmpty()) candidates.add(p);
            }
        }

        CoverSearch search = new CoverSearch(rows.size(), coverage, primes, width);
        List<Integer> rest = search.run(candidates, covered);
        chosen.addAll(rest);

        List<Implicant> out = new ArrayList<>();
        for (int p : chosen) out.add(primes.get(p));
        return out;
    }

    /** Branch and bound over the remaining candidates, minimizing (terms, literals). */
    private static final class CoverSearch {
        private final int rowCount;
        private final BitSet[] coverage;
        private final List<Implicant> primes;
        private final int width;

        private List<Integer> best;
        private int bestTerms = Integer.MAX_VALUE;
        private int bestLiterals = Integer.MAX_VALUE;
        private int nodes;

        CoverSearch(int rowCount, BitSet[] coverage, List<Implicant> primes, int width) {
            this.rowCount = rowCount;
            this.coverage = coverage;
            this.primes = primes;
            this.width = width;
        }

        List<Integer> run(List<Integer> candidates, BitSet covered) {
            if (covered.cardinality() == rowCount) return new ArrayList<>();
            search(candidates, covered, new ArrayList<>(), 0);
            if (best == null) {
                return greedy(candidates, covered);
            }
            return best;
        }

        private void search(List<Integer> candidates, BitSet covered, List<Integer> picked, int literals) {
            if (++nodes > SEARCH_BUDGET) return;
            if (covered.cardinality() == rowCount) {
                if (picked.size() < bestTerms || (picked.size() == bestTerms && literals < bestLiterals)) {
                    best = new ArrayList<>(picked);
                    bestTerms = picked.size();
                    bestLiterals = literals;
                }
                return;
            }
            if (picked.size() + 1 > bestTerms) return;

            // branch on the first uncovered row; every cover must pick one of its primes
            int row = covered.nextClearBit(0);
            for (int p : candidates) {
                if (!coverage[p].get(row)) continue;
                BitSet next = (BitSet) covered.clone();
                next.or(coverage[p]);
                picked.add(p);
                search(candidates, next, picked, literals + primes.get(p).literals(width));
                picked.remove(picked.size() - 1);
            }
        }

        private List<Integer> greedy(List<Integer> candidates, BitSet covered) {
            BitSet done = (BitSet) covered.clone();
            List<Integer> out = new ArrayList<>();
            while (done.cardinality() < rowCount) {
                int bestPrime = -1;
                int bestGain = 0;
                for (int p : candidates) {
                    BitSet gain = (BitSet) coverage[p].clone();
                    gain.andNot(done);
                    if (gain.cardinality() > bestGain) {
                        bestGain = gain.cardinality();
                        bestPrime = p;
                    }
                }
                if (bestPrime < 0) throw new IllegalStateException("Prime implicants do not cover the function");
                out.add(bestPrime);
                done.or(coverage[bestPrime]);
            }
            return out;
        }
    }
}
