package io.formulainline.core.grammar;

/** Lexical categories of the formula language. */
public enum TokenType {
    NUMBER,
    STRING,
    CELL,
    RANGE,
    IDENT,
    OPERATOR,
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    COMMA,
    SEMICOLON,
    EOF
}
