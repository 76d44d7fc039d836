package org.tacc.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The root of every program: {@code if (condition) { thenBody } [else { elseBody }]}.
 *
 * @param condition The condition.
 * @param thenBody  Statements of the then-branch, possibly empty.
 * @param elseBody  Statements of the else-branch, or {@code null} when there is no else clause.
 *                  An empty else clause ({@code else {}}) is an empty list, not {@code null}.
 */
public record IfStatementNode(BinaryOpNode condition, List<AssignmentNode> thenBody,
                              List<AssignmentNode> elseBody) implements AstNode {

    public IfStatementNode {
        Objects.requireNonNull(condition, "condition");
        thenBody = List.copyOf(thenBody);
        elseBody = elseBody == null ? null : List.copyOf(elseBody);
    }

    /**
     * @return The else-branch, empty if the statement has no else clause.
     */
    public Optional<List<AssignmentNode>> elseBranch() {
        return Optional.ofNullable(elseBody);
    }

    public boolean hasElse() {
        return elseBody != null;
    }

    @Override
    public <R, E extends Exception> R accept(AstVisitor<R, E> visitor) throws E {
        return visitor.visitIfStatement(this);
    }
}
