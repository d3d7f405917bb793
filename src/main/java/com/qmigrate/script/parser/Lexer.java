package com.qmigrate.script.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Character scanner for qmake project text.
 *
 * The dialect is context sensitive (':' or '=' are plain characters inside a
 * value but operators elsewhere), so the lexer does not pre-tokenize. The
 * parser asks for the token kind it expects at the current position.
 */
public class Lexer {
    private static final String CONDITION_STOP_CHARS = "#{}|:=\\\n";
    private static final String VALUE_STOP_CHARS = "#{}()";

    private final String source;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;

    public Lexer(String source) {
        this.source = source == null ? "" : source;
    }

    // -------------------------
    // Cursor
    // -------------------------

    public boolean isAtEnd() { return current >= source.length(); }

    public char peek() { return isAtEnd() ? '\0' : source.charAt(current); }

    char peekAt(int pos) { return pos < source.length() ? source.charAt(pos) : '\0'; }

    public char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            lineStart = current;
        }
        return c;
    }

    public int line() { return line; }
    public int column() { return current - lineStart + 1; }

    /** Opaque position marker, used for bounded lookahead. */
    public long mark() {
        return ((long) current << 32) | (line & 0xffffffffL);
    }

    public void reset(long mark) {
        current = (int) (mark >>> 32);
        line = (int) mark;
        int nl = source.lastIndexOf('\n', current - 1);
        lineStart = nl + 1;
    }

    /** Skips spaces, tabs, carriage returns and a trailing '#' comment. Never consumes '\n'. */
    public void skipBlanks() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r') {
                advance();
            } else if (c == '#') {
                while (!isAtEnd() && peek() != '\n') advance();
            } else {
                return;
            }
        }
    }

    /** True at EOF, end of line, or a closing brace (after skipping blanks). */
    public boolean atStatementEnd() {
        skipBlanks();
        char c = peek();
        return isAtEnd() || c == '\n' || c == '}';
    }

    public boolean match(char expected) {
        if (isAtEnd() || peek() != expected) return false;
        advance();
        return true;
    }

    public void consume(char expected, String message) {
        if (!match(expected)) throw error(message);
    }

    public void skipToLineEnd() {
        while (!isAtEnd() && peek() != '\n') advance();
    }

    // -------------------------
    // Identifiers, keywords, operators
    // -------------------------

    public static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    public static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9') || c == '-' || c == '.' || c == '/';
    }

    private int identifierEnd(int pos) {
        if (!isIdentifierStart(peekAt(pos))) return -1;
        int p = pos + 1;
        while (p < source.length() && isIdentifierPart(source.charAt(p))) p++;
        return p;
    }

    public Token identifier() {
        int line0 = line, col0 = column();
        int end = identifierEnd(current);
        if (end < 0) throw error("Expect identifier.");
        String text = source.substring(current, end);
        while (current < end) advance();
        return new Token(TokenType.IDENTIFIER, text, null, line0, col0);
    }

    public boolean checkKeyword(String keyword) {
        if (!source.startsWith(keyword, current)) return false;
        char next = peekAt(current + keyword.length());
        return !isIdentifierPart(next);
    }

    public Token keyword(String keyword) {
        int line0 = line, col0 = column();
        if (!checkKeyword(keyword)) throw error("Expect '" + keyword + "'.");
        for (int i = 0; i < keyword.length(); i++) advance();
        return new Token(TokenType.ELSE, keyword, null, line0, col0);
    }

    /** Consumes one of '=', '+=', '-=', '*=' or returns null. '==' is not an operator. */
    public Token operator() {
        int line0 = line, col0 = column();
        char c = peek();
        String op = null;
        if (c == '=' && peekAt(current + 1) != '=') {
            op = "=";
        } else if ((c == '+' || c == '-' || c == '*') && peekAt(current + 1) == '=') {
            op = c + "=";
        }
        if (op == null) return null;
        for (int i = 0; i < op.length(); i++) advance();
        return new Token(TokenType.OPERATOR, op, OpKind.fromSymbol(op), line0, col0);
    }

    // -------------------------
    // Parenthesized runs
    // -------------------------

    /** Index just past the ')' balancing the '(' at pos, or -1. Quoted strings are opaque. */
    private int balancedEnd(int pos, char open, char close) {
        if (peekAt(pos) != open) return -1;
        int depth = 0;
        int p = pos;
        while (p < source.length()) {
            char c = source.charAt(p);
            if (c == '"') {
                p = quotedEnd(p);
                if (p < 0) return -1;
                continue;
            }
            if (c == '\n') return -1;
            if (c == open) depth++;
            else if (c == close) {
                depth--;
                if (depth == 0) return p + 1;
            }
            p++;
        }
        return -1;
    }

    private int quotedEnd(int pos) {
        int p = pos + 1;
        while (p < source.length()) {
            char c = source.charAt(p);
            if (c == '\\') { p += 2; continue; }
            if (c == '"') return p + 1;
            if (c == '\n') return -1;
            p++;
        }
        return -1;
    }

    /**
     * Call arguments "( ... )". Literal is the inner text with whitespace outside
     * quotes removed, which is how include/load/option arguments are read.
     */
    public Token callArgs() {
        int line0 = line, col0 = column();
        int end = balancedEnd(current, '(', ')');
        if (end < 0) throw error("Unbalanced '(' in call arguments.");
        String raw = source.substring(current, end);
        while (current < end) advance();
        String inner = raw.substring(1, raw.length() - 1);
        return new Token(TokenType.CALL_ARGS, raw, squeeze(inner), line0, col0);
    }

    /** Skips a brace-delimited body, used for discarded function and loop definitions. */
    public void skipBracedBody() {
        consume('{', "Expect '{'.");
        int depth = 1;
        while (!isAtEnd()) {
            char c = advance();
            if (c == '{') depth++;
            else if (c == '}' && --depth == 0) return;
        }
        throw error("Expect '}' after body.");
    }

    static String squeeze(String text) {
        StringBuilder out = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' && (i == 0 || text.charAt(i - 1) != '\\')) quoted = !quoted;
            if (!quoted && Character.isWhitespace(c)) continue;
            out.append(c);
        }
        return out.toString();
    }

    // -------------------------
    // Values
    // -------------------------

    public boolean atValueEnd() {
        skipBlanks();
        char c = peek();
        return isAtEnd() || c == '\n' || c == '}' || checkKeyword("else");
    }

    /** A double-quoted string; the literal has quotes removed and escapes resolved. */
    public Token quoted() {
        int line0 = line, col0 = column();
        int end = quotedEnd(current);
        if (end < 0) throw error("Unterminated string.");
        String raw = source.substring(current, end);
        while (current < end) advance();
        StringBuilder value = new StringBuilder();
        for (int i = 1; i < raw.length() - 1; i++) {
            char c = raw.charAt(i);
            if (c == '\\' && i + 1 < raw.length() - 1) {
                c = raw.charAt(++i);
            }
            value.append(c);
        }
        return new Token(TokenType.STRING, raw, value.toString(), line0, col0);
    }

    /** True at "$$name(" which starts a function-call value. */
    public boolean checkFunctionValue() {
        if (peek() != '$' || peekAt(current + 1) != '$') return false;
        int end = identifierEnd(current + 2);
        return end > 0 && peekAt(end) == '(';
    }

    public Token functionValue() {
        int line0 = line, col0 = column();
        int nameEnd = identifierEnd(current + 2);
        String name = source.substring(current + 2, nameEnd);
        int end = balancedEnd(nameEnd, '(', ')');
        if (end < 0) throw error("Unbalanced '(' in $$" + name + "().");
        String raw = source.substring(current, end);
        String args = source.substring(nameEnd + 1, end - 1);
        while (current < end) advance();
        String value = FunctionValues.resolve(name, args, line0, col0);
        return new Token(TokenType.FUNCTION_VALUE, raw, value, line0, col0);
    }

    /**
     * A parenthesized literal list. The literal is the flattened item list with
     * "(" and ")" markers around every nesting level.
     */
    public Token bracedValue() {
        int line0 = line, col0 = column();
        int end = balancedEnd(current, '(', ')');
        if (end < 0) throw error("Unbalanced '('.");
        String raw = source.substring(current, end);
        while (current < end) advance();

        List<String> items = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '"') {
                int q = raw.indexOf('"', i + 1);
                if (q < 0) q = raw.length() - 1;
                word.append(raw, i, q + 1);
                i = q;
            } else if (c == '(' || c == ')' || Character.isWhitespace(c)) {
                if (word.length() > 0) {
                    items.add(word.toString());
                    word.setLength(0);
                }
                if (!Character.isWhitespace(c)) items.add(String.valueOf(c));
            } else {
                word.append(c);
            }
        }
        return new Token(TokenType.BRACED_VALUE, raw, items, line0, col0);
    }

    @SuppressWarnings("unchecked")
    static List<String> items(Token braced) {
        return (List<String>) braced.literal;
    }

    /**
     * The maximal run of literal characters and substitutions with no
     * intervening whitespace, e.g. "$$PWD/foo_$${NAME}.cpp".
     */
    public Token valueRun() {
        int line0 = line, col0 = column();
        int start = current;
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) break;
            if (c == '$') {
                int end = substitutionEnd(current);
                if (end < 0) end = current + 1;
                while (current < end) advance();
                continue;
            }
            if (VALUE_STOP_CHARS.indexOf(c) >= 0) break;
            advance();
        }
        if (current == start) throw error("Unexpected character '" + peek() + "' in value.");
        String text = source.substring(start, current);
        return new Token(TokenType.VALUE, text, text, line0, col0);
    }

    /**
     * End of a substitution starting at pos, or -1. Recognized forms:
     * $$name, $$name(args), $${name}, $$[name], $(name), ${name}.
     */
    private int substitutionEnd(int pos) {
        if (peekAt(pos) != '$') return -1;
        char c1 = peekAt(pos + 1);
        if (c1 == '(') {
            int end = identifierEnd(pos + 2);
            return end > 0 && peekAt(end) == ')' ? end + 1 : -1;
        }
        if (c1 == '{') {
            int end = identifierEnd(pos + 2);
            return end > 0 && peekAt(end) == '}' ? end + 1 : -1;
        }
        if (c1 != '$') return -1;

        char c2 = peekAt(pos + 2);
        if (c2 == '[') {
            int end = identifierEnd(pos + 3);
            return end > 0 && peekAt(end) == ']' ? end + 1 : -1;
        }
        if (c2 == '{') {
            int end = identifierEnd(pos + 3);
            if (end < 0) return -1;
            if (peekAt(end) == '(') {
                end = balancedEnd(end, '(', ')');
                if (end < 0) return -1;
            }
            return peekAt(end) == '}' ? end + 1 : -1;
        }
        int end = identifierEnd(pos + 2);
        if (end < 0) return -1;
        if (peekAt(end) == '(') {
            int call = balancedEnd(end, '(', ')');
            if (call > 0) return call;
        }
        return end;
    }

    // -------------------------
    // Conditions
    // -------------------------

    /**
     * Lookahead: end of a condition atom starting at pos, or -1 when the text at
     * pos is not an atom followed (after optional blanks) by ':', '{' or '|'.
     *
     * Two atom shapes compete and the longer wins: an optionally negated
     * identifier with an optional parenthesized argument list, or a run of
     * characters outside "#{}|:=\\\n".
     */
    public int conditionAtomEnd(int pos) {
        int functionEnd = -1;
        int p = pos;
        if (peekAt(p) == '!') p++;
        int identEnd = identifierEnd(p);
        if (identEnd > 0) {
            functionEnd = identEnd;
            if (peekAt(identEnd) == '(') {
                int call = balancedEnd(identEnd, '(', ')');
                if (call > 0) functionEnd = call;
            }
        }

        int runEnd = pos;
        while (runEnd < source.length() && CONDITION_STOP_CHARS.indexOf(source.charAt(runEnd)) < 0) {
            runEnd++;
        }

        int end = Math.max(functionEnd, runEnd);
        if (end <= pos || source.substring(pos, end).isBlank()) return -1;

        int follow = end;
        while (peekAt(follow) == ' ' || peekAt(follow) == '\t') follow++;
        char c = peekAt(follow);
        return (c == ':' || c == '{' || c == '|') ? end : -1;
    }

    /** Position after skipping spaces and tabs from pos. */
    public int skipSpacesFrom(int pos) {
        int p = pos;
        while (peekAt(p) == ' ' || peekAt(p) == '\t') p++;
        return p;
    }

    public int position() { return current; }

    public Token conditionAtom() {
        int line0 = line, col0 = column();
        int end = conditionAtomEnd(current);
        if (end < 0) throw error("Expect condition or statement.");
        String raw = source.substring(current, end);
        while (current < end) advance();

        String text = raw.trim();
        int paren = text.indexOf('(');
        if (paren > 0 && text.endsWith(")")) {
            text = text.substring(0, paren) + squeeze(text.substring(paren));
        }
        return new Token(TokenType.CONDITION_ATOM, raw, text, line0, col0);
    }

    public ParseError error(String msg) {
        return new ParseError(line, column(), msg);
    }
}
