package org.tacc.compiler.frontend.parser.ast;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * The set of node kinds is closed. Every consumer dispatches through {@link AstVisitor},
 * which has one method per permitted subtype, so adding a node kind fails compilation of
 * every visitor until it handles the new kind.
 * <p>
 * Nodes are immutable and own their children exclusively.
 */
public sealed interface AstNode
        permits NumberNode, VariableNode, BinaryOpNode, AssignmentNode, IfStatementNode {

    /**
     * Dispatches to the visitor method for this node kind.
     *
     * @param visitor The visitor.
     * @param <R>     The visitor's result type.
     * @param <E>     The checked exception the visitor may raise.
     * @return The visitor's result for this node.
     * @throws E If the visitor rejects this node.
     */
    <R, E extends Exception> R accept(AstVisitor<R, E> visitor) throws E;

    /**
     * @return A short name for this node kind, used in diagnostics.
     */
    default String kind() {
        return getClass().getSimpleName();
    }
}
