package org.tacc.cli.shell;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tacc.compiler.Compiler;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Drives {@link InteractiveShell} with scripted input.
 */
@Tag("unit")
class InteractiveShellTest {

    private final CompilerSession session = new CompilerSession(new Compiler(), List.of(), 10);
    private final StringWriter out = new StringWriter();

    private String run(String script) throws IOException {
        InteractiveShell shell = new InteractiveShell(session, new SampleCatalog(),
                new BufferedReader(new StringReader(script)), new PrintWriter(out), 20);
        shell.run();
        return out.toString();
    }

    @Test
    void exitOptionSaysGoodbye() throws IOException {
        assertThat(run("8\n")).contains("Select an option:", "Goodbye!");
    }

    @Test
    void invalidOptionIsReported() throws IOException {
        assertThat(run("9\n8\n")).contains("Invalid option! Please select 1-8.");
    }

    @Test
    void pastedCodeCompilesWithNumberedListing() throws IOException {
        String output = run("6\nx\n1\nif (x > 10) {\ny = 5;\n}\n\n8\n");

        assertThat(output)
                .contains("Total tokens generated: 12")
                .contains("  1| LOADI 10")
                .contains("  4| CMP temp_1")
                .contains("COMPILATION SUCCESSFUL");
        assertThat(session.symbols()).containsOnlyKeys("x", "y");
    }

    @Test
    void failureShowsPhaseAndMessage() throws IOException {
        String output = run("1\nif (x > 10) { y = 5; }\n\n5\n8\n");

        assertThat(output)
                .contains("COMPILATION FAILED (SEMANTIC)")
                .contains("Error: Semantic error: variable 'x' is not defined")
                .contains("Status: FAILED");
    }

    @Test
    void emptyPasteIsRejected() throws IOException {
        assertThat(run("1\n\n8\n")).contains("Error: No code provided!");
        assertThat(session.history()).isEmpty();
    }

    @Test
    void multilineModeReadsUntilEnd() throws IOException {
        String output = run("6\na, b\n2\nif (a == b) {\nr = 1;\n}\nEND\n8\n");

        assertThat(output).contains("COMPILATION SUCCESSFUL");
    }

    @Test
    void multilineModeCanBeCancelled() throws IOException {
        assertThat(run("2\nif (a == b) {\nCANCEL\n8\n")).contains("Input cancelled.");
        assertThat(session.history()).isEmpty();
    }

    @Test
    void sampleIsShownAndCompiledOnConfirmation() throws IOException {
        String output = run("6\ntemperature\n3\n3\ny\n5\n8\n");

        assertThat(output)
                .contains("Temperature monitoring system")
                .contains("if (temperature >= 30) {")
                .contains("COMPILATION SUCCESSFUL")
                .contains("Status: SUCCESS");
    }

    @Test
    void unknownSampleIsReported() throws IOException {
        assertThat(run("3\n42\n8\n")).contains("No such sample: 42");
    }

    @Test
    void symbolTableAndHistoryReportEmptyState() throws IOException {
        assertThat(run("4\n5\n8\n")).contains("No variables defined yet.", "No compilation history yet.");
    }

    @Test
    void defineVariablesReportsRejectedNamesAndClear() throws IOException {
        String output = run("6\nx, 9z, else\n4\n6\nclear\n8\n");

        assertThat(output)
                .contains("Ignored invalid names: [9z, else]")
                .contains("Variables defined: [x]")
                .contains("Symbol table cleared!");
        assertThat(session.symbols()).isEmpty();
    }

    @Test
    void helpPrintsLanguageReference() throws IOException {
        assertThat(run("7\n8\n")).contains("LANGUAGE REFERENCE:", "Comparison: ==, !=, <, >, <=, >=");
    }

    @Test
    void nonPositivePreviewLengthIsRejected() {
        assertThatThrownBy(() -> new InteractiveShell(session, new SampleCatalog(),
                new BufferedReader(new StringReader("")), new PrintWriter(out), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("previewLength");
    }
}
