package com.qmigrate.script.parser;

public enum TokenType {
    IDENTIFIER,
    OPERATOR,
    ELSE,

    // values
    STRING,
    VALUE,
    FUNCTION_VALUE,
    BRACED_VALUE,

    CALL_ARGS,
    CONDITION_ATOM
}
