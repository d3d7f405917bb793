package com.qmigrate.script.parser;

/** Variable mutation kinds, keyed by their qmake operator. */
public enum OpKind {
    SET("="),
    ADD("+="),
    UNIQUE_ADD("*="),
    REMOVE("-=");

    private final String symbol;

    OpKind(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static OpKind fromSymbol(String symbol) {
        for (OpKind kind : values()) {
            if (kind.symbol.equals(symbol)) return kind;
        }
        throw new IllegalArgumentException("Unknown operator: " + symbol);
    }
}
