package org.tacc.compiler.frontend.lexer;

/**
 * The closed set of token kinds produced by the {@link Lexer}.
 */
public enum TokenType {
    IF,
    ELSE,
    NUMBER,
    ID,
    /** One of the comparison operators {@code == != <= >= < >}. */
    OP,
    ASSIGN,
    SEMI,
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    /** Sentinel terminating every token sequence; carries no text. */
    EOF
}
