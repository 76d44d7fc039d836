package org.tacc.compiler.frontend.parser.ast;

import java.util.Objects;

/**
 * A reference to a variable by name.
 *
 * @param name The variable name.
 */
public record VariableNode(String name) implements AstNode {

    public VariableNode {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public <R, E extends Exception> R accept(AstVisitor<R, E> visitor) throws E {
        return visitor.visitVariable(this);
    }
}
