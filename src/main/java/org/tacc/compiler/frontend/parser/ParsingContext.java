package org.tacc.compiler.frontend.parser;

import org.tacc.compiler.api.SyntaxException;
import org.tacc.compiler.frontend.lexer.Token;
import org.tacc.compiler.frontend.lexer.TokenType;

/**
 * Cursor over the token stream with one token of lookahead.
 * This interface decouples the grammar rules from the concrete {@link Parser} implementation.
 */
public interface ParsingContext {

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Consumes the current token and returns it. The cursor never moves past EOF.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Consumes the current token if it is of the expected type.
     * @param type The expected token type.
     * @return The consumed token.
     * @throws SyntaxException If the current token is of another type.
     */
    Token consume(TokenType type) throws SyntaxException;

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if the current token is EOF, false otherwise.
     */
    boolean isAtEnd();
}
