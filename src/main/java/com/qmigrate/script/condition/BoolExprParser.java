package com.qmigrate.script.condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parses mapped conditions such as "APPLE AND NOT (TARGET Qt::Gui OR ON)".
 *
 * <pre>
 * or      := and { OR and }
 * and     := unary { AND unary }
 * unary   := NOT unary | primary
 * primary := '(' or ')' | word { word }
 * </pre>
 *
 * Consecutive plain words form a single atom, so "TARGET Qt::Gui" or
 * "CMAKE_BUILD_TYPE STREQUAL Debug" stay one variable. A lone ON / TRUE
 * or OFF / FALSE is a constant.
 */
final class BoolExprParser {

    private static final Set<String> KEYWORDS = Set.of("AND", "OR", "NOT");

    private final List<String> tokens;
    private int current = 0;

    BoolExprParser(String text) {
        this.tokens = tokenize(text);
    }

    /** @throws IllegalArgumentException on malformed input */
    BoolExpr parse() {
        if (tokens.isEmpty()) return BoolExpr.TRUE;
        BoolExpr expr = or();
        if (!isAtEnd()) {
            throw new IllegalArgumentException("Unexpected '" + peek() + "' at token " + current);
        }
        return expr;
    }

    private BoolExpr or() {
        List<BoolExpr> args = new ArrayList<>();
        args.add(and());
        while (match("OR")) {
            args.add(and());
        }
        return args.size() == 1 ? args.get(0) : BoolExpr.or(args);
    }

    private BoolExpr and() {
        List<BoolExpr> args = new ArrayList<>();
        args.add(unary());
        while (match("AND")) {
            args.add(unary());
        }
        return args.size() == 1 ? args.get(0) : BoolExpr.and(args);
    }

    private BoolExpr unary() {
        if (match("NOT")) return BoolExpr.not(unary());
        return primary();
    }

    private BoolExpr primary() {
        if (isAtEnd()) throw new IllegalArgumentException("Unexpected end of condition");
        if (match("(")) {
            BoolExpr inner = or();
            if (!match(")")) throw new IllegalArgumentException("Expect ')' at token " + current);
            return inner;
        }
        if (!isWord(peek())) {
            throw new IllegalArgumentException("Unexpected '" + peek() + "' at token " + current);
        }

        List<String> words = new ArrayList<>();
        while (!isAtEnd() && isWord(peek())) {
            words.add(tokens.get(current++));
        }
        if (words.size() == 1) {
            switch (words.get(0)) {
                case "ON":
                case "TRUE":
                    return BoolExpr.TRUE;
                case "OFF":
                case "FALSE":
                    return BoolExpr.FALSE;
                default:
                    break;
            }
        }
        return BoolExpr.atom(String.join(" ", words));
    }

    private static boolean isWord(String token) {
        return !KEYWORDS.contains(token) && !token.equals("(") && !token.equals(")");
    }

    private boolean match(String token) {
        if (isAtEnd() || !peek().equals(token)) return false;
        current++;
        return true;
    }

    private String peek() {
        return tokens.get(current);
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }

    private static List<String> tokenize(String text) {
        List<String> out = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c) || c == '(' || c == ')') {
                if (word.length() > 0) {
                    out.add(word.toString());
                    word.setLength(0);
                }
                if (c == '(' || c == ')') out.add(String.valueOf(c));
            } else {
                word.append(c);
            }
        }
        if (word.length() > 0) out.add(word.toString());
        return out;
    }
}
