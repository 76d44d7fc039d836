package org.tacc.compiler.api;

/**
 * Thrown by the lexer when a character matches none of the lexical classes.
 */
public class LexicalException extends CompilationException {

    private final String character;
    private final int position;

    /**
     * @param character The offending character (a full code point, so never a lone surrogate).
     * @param position  Zero-based offset of the character in the source text.
     */
    public LexicalException(String character, int position) {
        super(CompilationPhase.LEXICAL,
                "Lexical error: unexpected character '" + character + "' at position " + position);
        this.character = character;
        this.position = position;
    }

    public String getCharacter() {
        return character;
    }

    public int getPosition() {
        return position;
    }
}
