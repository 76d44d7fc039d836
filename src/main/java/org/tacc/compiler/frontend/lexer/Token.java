package org.tacc.compiler.frontend.lexer;

/**
 * A classified lexeme.
 *
 * @param type     The token kind.
 * @param text     The matched source text, or {@code null} for {@link TokenType#EOF}.
 * @param position Zero-based offset of the first character in the source; for EOF the source length.
 */
public record Token(TokenType type, String text, int position) {

    /**
     * Creates the EOF sentinel for a source of the given length.
     */
    public static Token eof(int position) {
        return new Token(TokenType.EOF, null, position);
    }

    @Override
    public String toString() {
        return text == null ? type.name() : type + "(" + text + ")";
    }
}
