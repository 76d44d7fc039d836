package org.tacc.compiler.frontend.parser.ast;

import java.util.Objects;

/**
 * An assignment {@code name = value;}.
 *
 * @param name  The assigned variable.
 * @param value The assigned expression, or {@code null} if the parser found no valid value.
 */
public record AssignmentNode(String name, AstNode value) implements AstNode {

    public AssignmentNode {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public <R, E extends Exception> R accept(AstVisitor<R, E> visitor) throws E {
        return visitor.visitAssignment(this);
    }
}
