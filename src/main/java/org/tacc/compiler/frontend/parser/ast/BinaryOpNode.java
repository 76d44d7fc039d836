package org.tacc.compiler.frontend.parser.ast;

import java.util.Objects;

/**
 * A binary operation {@code left operator right}. Conditions are always of this kind.
 *
 * @param left     The left operand.
 * @param operator The operator text, e.g. {@code ">"} or {@code "=="}.
 * @param right    The right operand, or {@code null} if the parser found no valid operand.
 *                 Such a tree is rejected during semantic analysis.
 */
public record BinaryOpNode(AstNode left, String operator, AstNode right) implements AstNode {

    public BinaryOpNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operator, "operator");
    }

    @Override
    public <R, E extends Exception> R accept(AstVisitor<R, E> visitor) throws E {
        return visitor.visitBinaryOp(this);
    }
}
