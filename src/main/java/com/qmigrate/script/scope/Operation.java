package com.qmigrate.script.scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.qmigrate.script.parser.OpKind;

/**
 * One mutation of a variable's value list. The set of variants is closed:
 * instances come from {@link #of(OpKind, List)} only.
 */
public abstract class Operation {

    /** Maps raw operand values before they are combined, e.g. to resolve file paths. */
    @FunctionalInterface
    public interface Transformer {
        List<String> apply(List<String> values);
    }

    public static final Transformer IDENTITY = values -> values;

    protected final List<String> values;

    private Operation(List<String> values) {
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Operation of(OpKind kind, List<String> values) {
        switch (kind) {
            case SET: return new SetOp(values);
            case ADD: return new AddOp(values);
            case UNIQUE_ADD: return new UniqueAddOp(values);
            case REMOVE: return new RemoveOp(values);
            default: throw new IllegalArgumentException("Unknown operation kind: " + kind);
        }
    }

    public abstract OpKind kind();

    /** Returns the new accumulated list; the input list is never modified. */
    public abstract List<String> process(String key, List<String> input, Transformer transformer);

    public List<String> values() {
        return values;
    }

    @Override
    public String toString() {
        String prefix = kind().symbol().substring(0, 1);
        if (values.isEmpty()) return prefix + "(<NOTHING>)";
        StringBuilder sb = new StringBuilder(prefix).append('(');
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(", ");
            String v = values.get(i);
            sb.append(v.isEmpty() ? "<NONE>" : "\"" + v + "\"");
        }
        return sb.append(')').toString();
    }

    private static Transformer orIdentity(Transformer transformer) {
        return transformer == null ? IDENTITY : transformer;
    }

    static final class SetOp extends Operation {
        SetOp(List<String> values) { super(values); }

        @Override public OpKind kind() { return OpKind.SET; }

        @Override
        public List<String> process(String key, List<String> input, Transformer transformer) {
            String selfReference = "$$" + key;
            List<String> result = new ArrayList<>();
            List<String> pending = new ArrayList<>();
            for (String v : values) {
                if (v.equals(selfReference)) {
                    result.addAll(orIdentity(transformer).apply(pending));
                    pending.clear();
                    result.addAll(input);
                } else {
                    pending.add(v);
                }
            }
            result.addAll(orIdentity(transformer).apply(pending));
            return result;
        }
    }

    static final class AddOp extends Operation {
        AddOp(List<String> values) { super(values); }

        @Override public OpKind kind() { return OpKind.ADD; }

        @Override
        public List<String> process(String key, List<String> input, Transformer transformer) {
            List<String> result = new ArrayList<>(input);
            result.addAll(orIdentity(transformer).apply(values));
            return result;
        }
    }

    static final class UniqueAddOp extends Operation {
        UniqueAddOp(List<String> values) { super(values); }

        @Override public OpKind kind() { return OpKind.UNIQUE_ADD; }

        @Override
        public List<String> process(String key, List<String> input, Transformer transformer) {
            Set<String> seen = new LinkedHashSet<>(input);
            List<String> result = new ArrayList<>(input);
            for (String v : orIdentity(transformer).apply(values)) {
                if (seen.add(v)) result.add(v);
            }
            return result;
        }
    }

    /**
     * Drops operands present in the input; operands that are absent are kept as
     * "-value" markers after the survivors so consumers can emit removals.
     */
    static final class RemoveOp extends Operation {
        RemoveOp(List<String> values) { super(values); }

        @Override public OpKind kind() { return OpKind.REMOVE; }

        @Override
        public List<String> process(String key, List<String> input, Transformer transformer) {
            List<String> operands = orIdentity(transformer).apply(values);
            Set<String> inputSet = new HashSet<>(input);
            Set<String> removeSet = new HashSet<>(operands);

            List<String> result = new ArrayList<>();
            for (String v : input) {
                if (!removeSet.contains(v)) result.add(v);
            }
            for (String v : operands) {
                if (!inputSet.contains(v)) result.add("-" + v);
            }
            return result;
        }
    }
}
