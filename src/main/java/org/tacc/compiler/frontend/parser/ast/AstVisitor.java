package org.tacc.compiler.frontend.parser.ast;

/**
 * Visitor over the closed set of {@link AstNode} kinds.
 *
 * @param <R> The result type of each visit.
 * @param <E> The checked exception a visit may throw.
 */
public interface AstVisitor<R, E extends Exception> {

    R visitNumber(NumberNode node) throws E;

    R visitVariable(VariableNode node) throws E;

    R visitBinaryOp(BinaryOpNode node) throws E;

    R visitAssignment(AssignmentNode node) throws E;

    R visitIfStatement(IfStatementNode node) throws E;
}
