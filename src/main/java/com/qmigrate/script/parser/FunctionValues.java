package com.qmigrate.script.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.qmigrate.debug.Debug;

/**
 * Parse-time resolution of "$$function(args)" values.
 *
 * Only a handful of replace functions have a meaning without evaluating the
 * project; everything else degrades to a literal "join(...)" of its arguments
 * so that downstream consumers can still see what was written.
 */
final class FunctionValues {

    private static final Set<String> JOINED = Set.of(
            "join",
            "files",
            "cmakeRelativePath",
            "shell_quote",
            "shadowed",
            "cmakeTargetPath",
            "shell_path",
            "cmakeProcessLibs",
            "cmakeTargetPaths",
            "cmakePortablePaths",
            "escape_expand",
            "member");

    private FunctionValues() {}

    static String resolve(String name, String rawArgs, int line, int column) {
        List<String> args = words(rawArgs);

        switch (name) {
            case "qtLibraryTarget":
                if (args.size() > 1) {
                    throw new ParseError(line, column,
                            "Don't know what to do with more than one function argument for $$qtLibraryTarget().");
                }
                return args.isEmpty() ? "" : args.get(0);
            case "files":
                // $$files(glob, recursive): only the glob is kept
                if (args.isEmpty()) return "";
                String glob = args.get(0);
                return glob.endsWith(",") ? glob.substring(0, glob.length() - 1) : glob;
            case "quote":
                return rawArgs.trim();
            default:
                if (!JOINED.contains(name)) {
                    Debug.get().d("qmigrate.parser",
                            "Unknown replace function $$" + name + "(), kept as join()");
                }
                return "join(" + String.join("", args) + ")";
        }
    }

    /** Whitespace separated words; quoted strings and parenthesized groups stay whole. */
    static List<String> words(String text) {
        List<String> out = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        int depth = 0;
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' && (i == 0 || text.charAt(i - 1) != '\\')) quoted = !quoted;
            if (!quoted) {
                if (c == '(') depth++;
                else if (c == ')') depth--;
                else if (depth == 0 && Character.isWhitespace(c)) {
                    if (word.length() > 0) {
                        out.add(word.toString());
                        word.setLength(0);
                    }
                    continue;
                }
            }
            word.append(c);
        }
        if (word.length() > 0) out.add(word.toString());
        return out;
    }
}
