package org.tacc.compiler.api;

/**
 * The pipeline stage a {@link CompilationException} originated from.
 */
public enum CompilationPhase {
    /** Unrecognized character in the source text. */
    LEXICAL,
    /** Token stream does not match the grammar. */
    SYNTAX,
    /** Variable referenced before definition, or an incomplete expression. */
    SEMANTIC,
    /** Internal failure of the code generator on a tree it cannot emit. */
    CODEGEN
}
