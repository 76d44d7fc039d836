package org.tacc.compiler.frontend.parser;

import org.tacc.compiler.api.CompilationException;
import org.tacc.compiler.api.CompilationPhase;
import org.tacc.compiler.api.SyntaxException;
import org.tacc.compiler.frontend.lexer.Lexer;
import org.tacc.compiler.frontend.lexer.Token;
import org.tacc.compiler.frontend.lexer.TokenType;
import org.tacc.compiler.frontend.parser.ast.AssignmentNode;
import org.tacc.compiler.frontend.parser.ast.BinaryOpNode;
import org.tacc.compiler.frontend.parser.ast.IfStatementNode;
import org.tacc.compiler.frontend.parser.ast.NumberNode;
import org.tacc.compiler.frontend.parser.ast.VariableNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Parser}.
 */
@Tag("unit")
class ParserTest {

    private static IfStatementNode parse(String source) throws CompilationException {
        return new Parser(new Lexer(source).tokenize()).parse();
    }

    @Test
    void parsesIfElseIntoTree() throws CompilationException {
        IfStatementNode ast = parse("if (x > 10) { y = 5; } else { y = 0; }");

        assertThat(ast.condition()).isEqualTo(new BinaryOpNode(new VariableNode("x"), ">", new NumberNode(10)));
        assertThat(ast.thenBody()).containsExactly(new AssignmentNode("y", new NumberNode(5)));
        assertThat(ast.elseBody()).containsExactly(new AssignmentNode("y", new NumberNode(0)));
    }

    @Test
    void elseClauseIsOptional() throws CompilationException {
        IfStatementNode ast = parse("if (a == b) { result = 1; }");

        assertThat(ast.condition()).isEqualTo(new BinaryOpNode(new VariableNode("a"), "==", new VariableNode("b")));
        assertThat(ast.hasElse()).isFalse();
        assertThat(ast.elseBranch()).isEmpty();
    }

    @Test
    void emptyBlocksAreValid() throws CompilationException {
        IfStatementNode ast = parse("if (a < 1) { } else { }");

        assertThat(ast.thenBody()).isEmpty();
        assertThat(ast.hasElse()).isTrue();
        assertThat(ast.elseBody()).isEmpty();
    }

    @Test
    void blockKeepsStatementOrder() throws CompilationException {
        IfStatementNode ast = parse("if (a != 0) { y = 5; z = y; w = a; }");

        assertThat(ast.thenBody()).extracting(AssignmentNode::name).containsExactly("y", "z", "w");
        assertThat(ast.thenBody().get(1).value()).isEqualTo(new VariableNode("y"));
    }

    @Test
    void numbersBeyondIntRangeAreKeptExactly() throws CompilationException {
        IfStatementNode ast = parse("if (a <= 99999999999999999999) { }");

        assertThat(ast.condition().right()).isEqualTo(new NumberNode(new java.math.BigInteger("99999999999999999999")));
    }

    @Test
    void missingClosingBraceReportsExpectedRbraceFoundEof() {
        assertThatThrownBy(() -> parse("if (x > 10) { y = 5;"))
                .isInstanceOfSatisfying(SyntaxException.class, e -> {
                    assertThat(e.getExpected()).isEqualTo(TokenType.RBRACE);
                    assertThat(e.getFound()).isEqualTo(TokenType.EOF);
                    assertThat(e.getPhase()).isEqualTo(CompilationPhase.SYNTAX);
                    assertThat(e.getMessage()).isEqualTo("Syntax error: expected RBRACE, found EOF");
                });
    }

    @Test
    void emptySourceExpectsIf() {
        assertThatThrownBy(() -> parse(""))
                .isInstanceOfSatisfying(SyntaxException.class, e -> {
                    assertThat(e.getExpected()).isEqualTo(TokenType.IF);
                    assertThat(e.getFound()).isEqualTo(TokenType.EOF);
                });
    }

    @Test
    void conditionMustStartWithIdentifier() {
        assertThatThrownBy(() -> parse("if (10 > x) { }"))
                .isInstanceOfSatisfying(SyntaxException.class, e -> {
                    assertThat(e.getExpected()).isEqualTo(TokenType.ID);
                    assertThat(e.getFound()).isEqualTo(TokenType.NUMBER);
                });
    }

    @Test
    void conditionRequiresComparisonOperator() {
        assertThatThrownBy(() -> parse("if (x = 1) { }"))
                .isInstanceOfSatisfying(SyntaxException.class, e -> {
                    assertThat(e.getExpected()).isEqualTo(TokenType.OP);
                    assertThat(e.getFound()).isEqualTo(TokenType.ASSIGN);
                });
    }

    @Test
    void missingConditionOperandIsLeftForSemanticAnalysis() throws CompilationException {
        IfStatementNode ast = parse("if (x > ) { }");

        assertThat(ast.condition().right()).isNull();
    }

    @Test
    void missingAssignmentValueIsLeftForSemanticAnalysis() throws CompilationException {
        IfStatementNode ast = parse("if (x > 1) { y = ; }");

        assertThat(ast.thenBody().get(0).value()).isNull();
    }

    @Test
    void statementMustEndWithSemicolon() {
        assertThatThrownBy(() -> parse("if (x > 1) { y = 2 }"))
                .isInstanceOfSatisfying(SyntaxException.class, e -> {
                    assertThat(e.getExpected()).isEqualTo(TokenType.SEMI);
                    assertThat(e.getFound()).isEqualTo(TokenType.RBRACE);
                });
    }

    @Test
    void nonAssignmentInBlockEndsTheBlock() {
        assertThatThrownBy(() -> parse("if (x > 1) { 5; }"))
                .isInstanceOfSatisfying(SyntaxException.class, e -> {
                    assertThat(e.getExpected()).isEqualTo(TokenType.RBRACE);
                    assertThat(e.getFound()).isEqualTo(TokenType.NUMBER);
                });
    }

    @Test
    void elseWithoutBlockIsRejected() {
        assertThatThrownBy(() -> parse("if (x > 1) { } else y = 1;"))
                .isInstanceOfSatisfying(SyntaxException.class, e -> {
                    assertThat(e.getExpected()).isEqualTo(TokenType.LBRACE);
                    assertThat(e.getFound()).isEqualTo(TokenType.ID);
                });
    }

    @Test
    void trailingTokensAfterStatementAreIgnored() throws CompilationException {
        IfStatementNode ast = parse("if (x > 1) { y = 2; } z = 3;");

        assertThat(ast.thenBody()).hasSize(1);
        assertThat(ast.hasElse()).isFalse();
    }

    @Test
    void cursorNeverMovesPastEof() {
        Parser parser = new Parser(List.of(Token.eof(0)));

        assertThat(parser.advance().type()).isEqualTo(TokenType.EOF);
        assertThat(parser.advance().type()).isEqualTo(TokenType.EOF);
        assertThat(parser.isAtEnd()).isTrue();
    }

    @Test
    void rejectsTokenStreamWithoutEof() {
        assertThatThrownBy(() -> new Parser(List.of(new Token(TokenType.IF, "if", 0))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
