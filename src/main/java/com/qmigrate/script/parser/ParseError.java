package com.qmigrate.script.parser;

/**
 * Raised when the grammar cannot consume the whole input.
 * Line and column are 1-based and refer to the normalized source text.
 */
public class ParseError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;
    private final String reason;

    public ParseError(int line, int column, String reason) {
        super("[line " + line + ", col " + column + "] " + reason);
        this.line = line;
        this.column = column;
        this.reason = reason;
    }

    public int line() { return line; }
    public int column() { return column; }
    public String reason() { return reason; }
}
