package com.qmigrate.script.scope;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.qmigrate.debug.Debug;

/**
 * Expands "$$name" / "$${name}" substitutions against a scope.
 *
 * A substitution that is the whole value broadcasts: every resolved value
 * yields one output. A substitution inside a longer string collapses to the
 * first resolved value (or nothing). Scanning repeats until the text stops
 * changing. "$$(NAME)" becomes the environment reference "$ENV{NAME}".
 */
final class ValueExpander {
    private static final String TAG = "qmigrate.scope";

    private static final Pattern SUBSTITUTION = Pattern.compile("\\$\\$\\{?([A-Za-z_][A-Za-z0-9_]*)\\}?");
    private static final Pattern ENVIRONMENT = Pattern.compile("\\$\\$\\(([A-Za-z_][A-Za-z0-9_]*)\\)");

    // Self-growing definitions such as "A = x$$A" never reach a fixed point.
    private static final int MAX_STEPS = 64;
    private static final int MAX_DEPTH = 16;

    private final Scope scope;

    ValueExpander(Scope scope) {
        this.scope = scope;
    }

    List<String> expand(String value) {
        return expand(value, 0);
    }

    private List<String> expand(String value, int depth) {
        String result = value;
        Matcher m = SUBSTITUTION.matcher(result);
        int steps = 0;

        while (m.find()) {
            String before = result;
            String name = m.group(1);

            if (m.group(0).equals(result)) {
                List<String> resolved = scope.resolve(name, true);
                if (resolved.size() == 1) {
                    result = replaceEnvironment(resolved.get(0));
                } else {
                    if (depth >= MAX_DEPTH) {
                        Debug.get().w(TAG, "Expansion of " + value + " is too deeply nested in " + scope);
                        return List.of(value);
                    }
                    List<String> out = new ArrayList<>();
                    for (String entry : resolved) {
                        out.addAll(expand(replaceEnvironment(entry), depth + 1));
                    }
                    return out;
                }
            } else {
                List<String> resolved = scope.resolve(name, true);
                String replacement = resolved.isEmpty() ? "" : resolved.get(0);
                result = result.substring(0, m.start()) + replacement + result.substring(m.end());
                result = replaceEnvironment(result);
            }

            if (result.equals(before)) {
                return List.of(result);
            }
            if (++steps >= MAX_STEPS) {
                Debug.get().w(TAG, "Expansion of " + value + " does not settle in " + scope);
                return List.of(result);
            }
            m = SUBSTITUTION.matcher(result);
        }

        return List.of(replaceEnvironment(result));
    }

    static String replaceEnvironment(String value) {
        return ENVIRONMENT.matcher(value).replaceAll("\\$ENV{$1}");
    }
}
