package org.tacc.compiler.api;

/**
 * Thrown when a variable is referenced before it has been assigned or pre-declared.
 */
public class UndefinedVariableException extends SemanticException {

    private final String name;

    public UndefinedVariableException(String name) {
        super("Semantic error: variable '" + name + "' is not defined");
        this.name = name;
    }

    /**
     * @return The name of the undefined variable.
     */
    public String getName() {
        return name;
    }
}
