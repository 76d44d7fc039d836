package org.tacc.compiler.api;

/**
 * Base class of every error raised by the compilation pipeline.
 * <p>
 * Each subclass belongs to exactly one {@link CompilationPhase}. A failure in any phase
 * aborts the run; no partial instruction output is ever produced alongside it.
 * <p>
 * This is a checked exception: every caller of the compiler has to decide how to
 * present the error (CLI exit code, shell history entry, ...).
 */
public class CompilationException extends Exception {

    private final CompilationPhase phase;

    /**
     * Creates a CompilationException for the given phase.
     *
     * @param phase   The pipeline stage that failed.
     * @param message Human-readable description, already prefixed with the error kind.
     */
    public CompilationException(CompilationPhase phase, String message) {
        super(message);
        this.phase = phase;
    }

    /**
     * @return The pipeline stage that raised this error.
     */
    public CompilationPhase getPhase() {
        return phase;
    }
}
