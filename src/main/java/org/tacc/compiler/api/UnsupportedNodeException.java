package org.tacc.compiler.api;

/**
 * Thrown by the code generator for a node it has no emission rule for.
 * <p>
 * Unreachable for trees that passed semantic analysis; seeing it means an internal
 * invariant was violated.
 */
public class UnsupportedNodeException extends CompilationException {

    private final String nodeKind;

    public UnsupportedNodeException(String nodeKind) {
        super(CompilationPhase.CODEGEN, "Internal error: no code generation rule for " + nodeKind);
        this.nodeKind = nodeKind;
    }

    public String getNodeKind() {
        return nodeKind;
    }
}
