package org.tacc.compiler.api;

/**
 * Base class for errors detected by the semantic analyzer.
 */
public class SemanticException extends CompilationException {

    public SemanticException(String message) {
        super(CompilationPhase.SEMANTIC, message);
    }
}
