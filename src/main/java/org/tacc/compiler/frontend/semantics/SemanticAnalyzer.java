package org.tacc.compiler.frontend.semantics;

import org.tacc.compiler.api.IncompleteExpressionException;
import org.tacc.compiler.api.SemanticException;
import org.tacc.compiler.api.UndefinedVariableException;
import org.tacc.compiler.frontend.parser.ast.AssignmentNode;
import org.tacc.compiler.frontend.parser.ast.AstNode;
import org.tacc.compiler.frontend.parser.ast.AstVisitor;
import org.tacc.compiler.frontend.parser.ast.BinaryOpNode;
import org.tacc.compiler.frontend.parser.ast.IfStatementNode;
import org.tacc.compiler.frontend.parser.ast.NumberNode;
import org.tacc.compiler.frontend.parser.ast.VariableNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Checks definition-before-use of variables and records assigned variables in the symbol table.
 * <p>
 * The tree is walked pre-order, depth first. An assignment checks its value first and only then
 * defines its target, so {@code y = y;} fails unless {@code y} was already known. Both branches of
 * a conditional share the one table: a variable assigned only in the then-branch counts as
 * defined while checking the else-branch and after the statement.
 */
public class SemanticAnalyzer implements AstVisitor<Void, SemanticException> {

    private static final Logger log = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final SymbolTable symbolTable;

    /**
     * @param symbolTable The table to check against and define into. It is mutated in place.
     */
    public SemanticAnalyzer(SymbolTable symbolTable) {
        this.symbolTable = symbolTable;
    }

    /**
     * Analyzes a tree.
     *
     * @param root The AST root.
     * @return The symbol table passed at construction, updated with every assigned variable.
     * @throws SemanticException If a variable is used before definition or an operand is missing.
     */
    public SymbolTable analyze(AstNode root) throws SemanticException {
        root.accept(this);
        log.debug("Semantic analysis passed, symbols: {}", symbolTable);
        return symbolTable;
    }

    @Override
    public Void visitNumber(NumberNode node) {
        return null;
    }

    @Override
    public Void visitVariable(VariableNode node) throws SemanticException {
        if (!symbolTable.isDefined(node.name())) {
            throw new UndefinedVariableException(node.name());
        }
        return null;
    }

    @Override
    public Void visitBinaryOp(BinaryOpNode node) throws SemanticException {
        node.left().accept(this);
        if (node.right() == null) {
            throw new IncompleteExpressionException("right operand of '" + node.operator() + "'");
        }
        node.right().accept(this);
        return null;
    }

    @Override
    public Void visitAssignment(AssignmentNode node) throws SemanticException {
        if (node.value() == null) {
            throw new IncompleteExpressionException("value assigned to '" + node.name() + "'");
        }
        node.value().accept(this);
        symbolTable.define(node.name());
        return null;
    }

    @Override
    public Void visitIfStatement(IfStatementNode node) throws SemanticException {
        node.condition().accept(this);
        visitAll(node.thenBody());
        if (node.hasElse()) {
            visitAll(node.elseBody());
        }
        return null;
    }

    private void visitAll(List<AssignmentNode> statements) throws SemanticException {
        for (AssignmentNode statement : statements) {
            statement.accept(this);
        }
    }
}
