package com.qmigrate.script.scope;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/** Indented text rendering of a scope subtree, for the --debug dumps. */
public final class ScopeDumper {

    private ScopeDumper() {}

    public static String dump(Scope scope) {
        return dump(scope, 0);
    }

    public static String dump(Scope scope, int indent) {
        StringBuilder out = new StringBuilder();
        dump(scope, indent, out);
        return out.toString();
    }

    private static void dump(Scope scope, int indent, StringBuilder out) {
        String ind = spaces(indent);
        out.append(ind).append("Scope \"").append(scope).append("\":\n");
        if (scope.totalCondition() != null) {
            out.append(ind).append("  Total condition = ").append(scope.totalCondition()).append('\n');
        }

        out.append(ind).append("  Keys:\n");
        Set<String> keys = new TreeSet<>(scope.keys());
        if (keys.isEmpty()) {
            out.append(ind).append("    -- NONE --\n");
        }
        for (String key : keys) {
            out.append(ind).append("    ").append(key).append(" = \"").append(scope.operations(key)).append("\"\n");
        }

        out.append(ind).append("  Children:\n");
        section(scope.ownChildren(), indent, out);
        out.append(ind).append("  Includes:\n");
        section(scope.includedScopes(), indent, out);
    }

    private static void section(List<Scope> scopes, int indent, StringBuilder out) {
        if (scopes.isEmpty()) {
            out.append(spaces(indent)).append("    -- NONE --\n");
            return;
        }
        for (Scope s : scopes) {
            dump(s, indent + 1, out);
        }
    }

    /** One line per scope: ROOT, then INCL and CHLD entries. */
    public static String structure(Scope scope) {
        StringBuilder out = new StringBuilder();
        structure(scope, "ROOT", 0, out);
        return out.toString();
    }

    private static void structure(Scope scope, String type, int indent, StringBuilder out) {
        out.append(spaces(indent)).append(type).append(": ").append(scope).append('\n');
        for (Scope s : scope.includedScopes()) structure(s, "INCL", indent + 1, out);
        for (Scope s : scope.ownChildren()) structure(s, "CHLD", indent + 1, out);
    }

    private static String spaces(int indent) {
        return "    ".repeat(indent);
    }
}
