package org.tacc.compiler;

import org.tacc.compiler.api.CompilationException;
import org.tacc.compiler.api.CompilationPhase;
import org.tacc.compiler.api.CompilationResult;
import org.tacc.compiler.api.LexicalException;
import org.tacc.compiler.api.SyntaxException;
import org.tacc.compiler.api.UndefinedVariableException;
import org.tacc.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * End-to-end tests running all four phases through {@link Compiler}.
 */
@Tag("integration")
class CompilerTest {

    private Compiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new Compiler();
    }

    @Test
    void compilesIfElseProgram() throws CompilationException {
        CompilationResult result = compiler.compile("if (x > 10) { y = 5; } else { y = 0; }", Map.of("x", "int"));

        assertThat(result.instructions()).containsExactly(
                "LOADI 10",
                "STORE temp_1",
                "LOAD x",
                "CMP temp_1",
                "JMP_FALSE else_label_1",
                "LOADI 5",
                "STORE y",
                "JMP end_label_1",
                "else_label_1:",
                "LOADI 0",
                "STORE y",
                "end_label_1:");
        assertThat(result.symbols()).containsExactly(entry("x", "int"), entry("y", "int"));
        assertThat(result.tokenCount()).isEqualTo(19);
    }

    @Test
    void assemblyJoinsInstructionsWithNewlines() throws CompilationException {
        CompilationResult result = compiler.compile("if (a == b) { result = 1; }", Map.of("a", "int", "b", "int"));

        assertThat(result.assembly()).isEqualTo(String.join("\n",
                "LOAD b",
                "STORE temp_1",
                "LOAD a",
                "CMP temp_1",
                "JMP_FALSE else_label_1",
                "LOADI 1",
                "STORE result",
                "JMP end_label_1",
                "else_label_1:",
                "end_label_1:"));
    }

    @Test
    void ifWithoutElseEmitsAdjacentLabelsAfterTheJump() throws CompilationException {
        List<String> code = compiler.compile("if (a == b) { result = 1; }", Map.of("a", "int", "b", "int")).instructions();

        int elseLabel = code.indexOf("else_label_1:");
        assertThat(code.get(elseLabel + 1)).isEqualTo("end_label_1:");
        assertThat(code.get(elseLabel - 1)).isEqualTo("JMP end_label_1");
    }

    @Test
    void undefinedVariableInBlockIsReportedByName() {
        assertThatThrownBy(() -> compiler.compile("if (x > 10) { y = z; }", Map.of("x", "int")))
                .isInstanceOfSatisfying(UndefinedVariableException.class, e -> assertThat(e.getName()).isEqualTo("z"));
    }

    @Test
    void undefinedConditionVariableFailsWithoutSeed() {
        assertThatThrownBy(() -> compiler.compile("if (x > 10) { y = 5; }"))
                .isInstanceOfSatisfying(UndefinedVariableException.class, e -> assertThat(e.getName()).isEqualTo("x"));
    }

    @Test
    void unterminatedBlockIsASyntaxError() {
        assertThatThrownBy(() -> compiler.compile("if (x > 10) { y = 5;", Map.of("x", "int")))
                .isInstanceOfSatisfying(SyntaxException.class, e -> {
                    assertThat(e.getExpected()).isEqualTo(TokenType.RBRACE);
                    assertThat(e.getFound()).isEqualTo(TokenType.EOF);
                });
    }

    @Test
    void unknownCharacterIsALexicalError() {
        assertThatThrownBy(() -> compiler.compile("if (x > 10) { y = 5; } #", Map.of("x", "int")))
                .isInstanceOfSatisfying(LexicalException.class, e -> assertThat(e.getCharacter()).isEqualTo("#"));
    }

    @Test
    void lexicalErrorWinsOverLaterSyntaxAndSemanticErrors() {
        assertThatThrownBy(() -> compiler.compile("if (q > ) { y = z; @"))
                .isInstanceOfSatisfying(CompilationException.class,
                        e -> assertThat(e.getPhase()).isEqualTo(CompilationPhase.LEXICAL));
    }

    @Test
    void incompleteConditionIsASemanticError() {
        assertThatThrownBy(() -> compiler.compile("if (x > ) { y = 1; }", Map.of("x", "int")))
                .isInstanceOfSatisfying(CompilationException.class,
                        e -> assertThat(e.getPhase()).isEqualTo(CompilationPhase.SEMANTIC));
    }

    @Test
    void blankSourceIsASyntaxError() {
        assertThatThrownBy(() -> compiler.compile("   "))
                .isInstanceOfSatisfying(SyntaxException.class, e -> {
                    assertThat(e.getExpected()).isEqualTo(TokenType.IF);
                    assertThat(e.getFound()).isEqualTo(TokenType.EOF);
                });
    }

    @Test
    void callerSymbolMapIsNotModified() throws CompilationException {
        Map<String, String> seed = new HashMap<>(Map.of("x", "int"));

        CompilationResult result = compiler.compile("if (x > 1) { y = 2; }", seed);

        assertThat(seed).containsOnlyKeys("x");
        assertThat(result.symbols()).containsOnlyKeys("x", "y");
    }

    @Test
    void symbolsThreadAcrossRuns() throws CompilationException {
        CompilationResult first = compiler.compile("if (x > 1) { y = 2; }", Map.of("x", "int"));
        CompilationResult second = compiler.compile("if (y < 3) { z = y; }", first.symbols());

        assertThat(second.symbols()).containsOnlyKeys("x", "y", "z");
    }

    @Test
    void eachRunNumbersTemporariesAndLabelsFromOne() throws CompilationException {
        Map<String, String> seed = Map.of("x", "int");
        compiler.compile("if (x > 1) { y = 2; }", seed);

        List<String> second = compiler.compile("if (x > 1) { y = 2; }", seed).instructions();

        assertThat(second).contains("STORE temp_1", "JMP_FALSE else_label_1", "end_label_1:");
    }

    @Test
    void multilineSourceCompiles() throws CompilationException {
        String source = """
                if (temperature >= 30) {
                    status = 1;
                    alert = status;
                } else {
                    status = 0;
                    alert = 0;
                }
                """;

        CompilationResult result = compiler.compile(source, Map.of("temperature", "int"));

        assertThat(result.symbols()).containsOnlyKeys("temperature", "status", "alert");
        assertThat(result.instructions()).contains("LOAD status", "STORE alert");
    }
}
