package com.actiongate.rules;

public enum TokenType {
    IDENT,
    NUMBER,
    STRING,
    BOOLEAN,
    OPERATOR,
    AND,
    OR,
    NOT,
    LPAREN,
    RPAREN,
    EOF
}
