package org.tacc.compiler.backend.codegen;

import org.tacc.compiler.api.UnsupportedNodeException;
import org.tacc.compiler.frontend.parser.ast.AssignmentNode;
import org.tacc.compiler.frontend.parser.ast.AstNode;
import org.tacc.compiler.frontend.parser.ast.AstVisitor;
import org.tacc.compiler.frontend.parser.ast.BinaryOpNode;
import org.tacc.compiler.frontend.parser.ast.IfStatementNode;
import org.tacc.compiler.frontend.parser.ast.NumberNode;
import org.tacc.compiler.frontend.parser.ast.VariableNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits three-address code for a semantically valid AST.
 *
 * <p><strong>Accumulator convention:</strong> the target machine has one implicit accumulator.
 * Every expression rule leaves its value there; statement rules consume it. No register is
 * modelled in this class, the convention only fixes the order in which rules emit:
 * <ul>
 *   <li>{@code Number v} emits {@code LOADI v}, {@code Variable n} emits {@code LOAD n}.</li>
 *   <li>{@code Assignment n = v} emits {@code v}, then {@code STORE n}.</li>
 *   <li>{@code BinaryOp l op r} emits {@code r}, stores it into a fresh temporary, emits {@code l},
 *       then applies the operator's opcode to the temporary.</li>
 *   <li>{@code If} emits the condition, {@code JMP_FALSE else}, the then-branch, {@code JMP end},
 *       the else label, the else-branch (if any) and the end label. The else label is emitted even
 *       without an else-branch.</li>
 * </ul>
 *
 * <p>Temporaries ({@code temp_N}) and the two label families ({@code else_label_N},
 * {@code end_label_N}) are numbered by counters owned by this instance. They are never reset or
 * reused; two generators never share numbering.
 */
public class CodeGenerator implements AstVisitor<Void, UnsupportedNodeException> {

    private static final String TEMP_PREFIX = "temp_";
    private static final String ELSE_LABEL_PREFIX = "else_label_";
    private static final String END_LABEL_PREFIX = "end_label_";

    private List<String> instructions = new ArrayList<>();
    private int tempCounter = 0;
    private int elseLabelCounter = 0;
    private int endLabelCounter = 0;

    /**
     * Generates code for a tree.
     * <p>
     * Numbering continues from earlier calls on the same instance.
     *
     * @param root The AST root.
     * @return The instructions emitted for {@code root}, in order.
     * @throws UnsupportedNodeException If the tree contains an absent operand.
     */
    public List<String> generate(AstNode root) throws UnsupportedNodeException {
        instructions = new ArrayList<>();
        emitNode(root);
        return List.copyOf(instructions);
    }

    @Override
    public Void visitNumber(NumberNode node) {
        emit(Opcode.LOADI.format(node.value()));
        return null;
    }

    @Override
    public Void visitVariable(VariableNode node) {
        emit(Opcode.LOAD.format(node.name()));
        return null;
    }

    @Override
    public Void visitAssignment(AssignmentNode node) throws UnsupportedNodeException {
        emitNode(node.value());
        emit(Opcode.STORE.format(node.name()));
        return null;
    }

    @Override
    public Void visitBinaryOp(BinaryOpNode node) throws UnsupportedNodeException {
        Opcode opcode = Opcode.forOperator(node.operator())
                .orElseThrow(() -> new UnsupportedNodeException("operator '" + node.operator() + "'"));

        emitNode(node.right());
        String temp = newTemp();
        emit(Opcode.STORE.format(temp));
        emitNode(node.left());
        emit(opcode.format(temp));
        return null;
    }

    @Override
    public Void visitIfStatement(IfStatementNode node) throws UnsupportedNodeException {
        String elseLabel = ELSE_LABEL_PREFIX + (++elseLabelCounter);
        String endLabel = END_LABEL_PREFIX + (++endLabelCounter);

        emitNode(node.condition());
        emit(Opcode.JMP_FALSE.format(elseLabel));

        for (AssignmentNode statement : node.thenBody()) {
            emitNode(statement);
        }
        emit(Opcode.JMP.format(endLabel));

        emit(label(elseLabel));
        if (node.hasElse()) {
            for (AssignmentNode statement : node.elseBody()) {
                emitNode(statement);
            }
        }
        emit(label(endLabel));
        return null;
    }

    private void emitNode(AstNode node) throws UnsupportedNodeException {
        if (node == null) {
            throw new UnsupportedNodeException("missing operand");
        }
        node.accept(this);
    }

    private String newTemp() {
        return TEMP_PREFIX + (++tempCounter);
    }

    private static String label(String name) {
        return name + ":";
    }

    private void emit(String instruction) {
        instructions.add(instruction);
    }
}
