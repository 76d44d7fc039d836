package org.tacc.compiler.api;

/**
 * Thrown when the tree contains an expression whose operand the parser left absent,
 * e.g. {@code if (x > ) {}} or {@code y = ;}.
 */
public class IncompleteExpressionException extends SemanticException {

    private final String context;

    /**
     * @param context Short description of where the operand is missing
     *                (e.g. "right operand of '>'" or "value assigned to 'y'").
     */
    public IncompleteExpressionException(String context) {
        super("Semantic error: missing " + context);
        this.context = context;
    }

    public String getContext() {
        return context;
    }
}
