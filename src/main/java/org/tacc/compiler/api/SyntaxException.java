package org.tacc.compiler.api;

import org.tacc.compiler.frontend.lexer.TokenType;

/**
 * Thrown by the parser when the next token's kind differs from the kind the grammar requires.
 */
public class SyntaxException extends CompilationException {

    private final TokenType expected;
    private final TokenType found;

    /**
     * @param expected The token kind required by the current grammar rule.
     * @param found    The token kind actually present in the stream.
     */
    public SyntaxException(TokenType expected, TokenType found) {
        super(CompilationPhase.SYNTAX, "Syntax error: expected " + expected + ", found " + found);
        this.expected = expected;
        this.found = found;
    }

    public TokenType getExpected() {
        return expected;
    }

    public TokenType getFound() {
        return found;
    }
}
