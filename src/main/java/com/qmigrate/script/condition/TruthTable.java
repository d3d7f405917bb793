package com.qmigrate.script.condition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Truth table of an expression over its atoms in sorted order. Row m assigns
 * atom i the value of bit i of m.
 */
final class TruthTable {

    private final List<String> atoms;
    private final boolean[] rows;

    private TruthTable(List<String> atoms, boolean[] rows) {
        this.atoms = atoms;
        this.rows = rows;
    }

    static TruthTable of(BoolExpr expr, int maxAtoms) {
        List<String> atoms = new ArrayList<>(new TreeSet<>(expr.atoms()));
        if (atoms.size() > maxAtoms) {
            throw new IllegalStateException("Too many atoms to tabulate: " + atoms.size());
        }
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < atoms.size(); i++) index.put(atoms.get(i), i);

        boolean[] rows = new boolean[1 << atoms.size()];
        for (int m = 0; m < rows.length; m++) {
            rows[m] = expr.eval(index, m);
        }
        return new TruthTable(Collections.unmodifiableList(atoms), rows);
    }

    List<String> atoms() {
        return atoms;
    }

    int size() {
        return rows.length;
    }

    boolean get(int row) {
        return rows[row];
    }

    int countTrue() {
        int n = 0;
        for (boolean r : rows) if (r) n++;
        return n;
    }

    List<Integer> rowsWith(boolean value) {
        List<Integer> out = new ArrayList<>();
        for (int m = 0; m < rows.length; m++) {
            if (rows[m] == value) out.add(m);
        }
        return out;
    }

    /** Atom i matters when flipping it changes some row. */
    private boolean isRelevant(int bit) {
        int flip = 1 << bit;
        for (int m = 0; m < rows.length; m++) {
            if (rows[m] != rows[m ^ flip]) return true;
        }
        return false;
    }

    /** The same function over only the atoms it depends on. */
    TruthTable withoutIrrelevantAtoms() {
        List<Integer> keep = new ArrayList<>();
        for (int i = 0; i < atoms.size(); i++) {
            if (isRelevant(i)) keep.add(i);
        }
        if (keep.size() == atoms.size()) return this;

        List<String> kept = new ArrayList<>();
        for (int i : keep) kept.add(atoms.get(i));

        boolean[] reduced = new boolean[1 << keep.size()];
        for (int m = 0; m < reduced.length; m++) {
            int full = 0;
            for (int j = 0; j < keep.size(); j++) {
                if (((m >> j) & 1) == 1) full |= 1 << keep.get(j);
            }
            reduced[m] = rows[full];
        }
        return new TruthTable(Collections.unmodifiableList(kept), reduced);
    }
}
