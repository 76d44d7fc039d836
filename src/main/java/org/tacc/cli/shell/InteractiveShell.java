package org.tacc.cli.shell;

import org.tacc.compiler.api.CompilationException;
import org.tacc.compiler.api.CompilationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Line-oriented menu shell around a {@link CompilerSession}.
 * <p>
 * Reads menu choices and program text from {@code in} and writes everything to {@code out}.
 * End of input at any prompt ends the shell as if "Exit" had been chosen.
 */
public class InteractiveShell {

    private static final Logger log = LoggerFactory.getLogger(InteractiveShell.class);

    private static final String RULE = "=".repeat(63);
    private static final String THIN_RULE = "-".repeat(63);

    private static final String LANGUAGE_REFERENCE = """
            LANGUAGE REFERENCE:

            Keywords:
            - if
            - else

            Operators:
            - Comparison: ==, !=, <, >, <=, >=
            - Assignment: =

            Syntax:
            - Statements end with a semicolon (;)
            - Blocks are enclosed in curly braces ({ })
            - A program is a single if statement with an optional else block
            - A condition compares a variable with a variable or a number

            Example:
            if (x > 10) {
                y = 5;
                z = y;
            } else {
                y = 0;
                z = 3;
            }
            """;

    private final CompilerSession session;
    private final SampleCatalog catalog;
    private final BufferedReader in;
    private final PrintWriter out;
    private final int previewLength;

    /**
     * @param session       The session to compile in.
     * @param catalog       Sample programs offered by the "Load Sample Code" option.
     * @param in            Source of user input.
     * @param out           Destination of all output.
     * @param previewLength Number of source characters shown per history entry; must be positive.
     */
    public InteractiveShell(CompilerSession session, SampleCatalog catalog,
                            BufferedReader in, PrintWriter out, int previewLength) {
        if (previewLength < 1) {
            throw new IllegalArgumentException("previewLength must be positive: " + previewLength);
        }
        this.session = session;
        this.catalog = catalog;
        this.in = in;
        this.out = out;
        this.previewLength = previewLength;
    }

    /**
     * Runs the menu loop until the user exits or input ends.
     *
     * @throws IOException If reading input fails.
     */
    public void run() throws IOException {
        printBanner();
        while (true) {
            printMenu();
            String choice = prompt("Select an option (1-8): ");
            if (choice == null) {
                printGoodbye();
                return;
            }
            switch (choice.trim()) {
                case "1" -> readPastedCode().ifPresent(this::compile);
                case "2" -> readMultilineCode().ifPresent(this::compile);
                case "3" -> loadSample();
                case "4" -> showSymbolTable();
                case "5" -> showHistory();
                case "6" -> defineVariables();
                case "7" -> out.println(LANGUAGE_REFERENCE);
                case "8" -> {
                    printGoodbye();
                    return;
                }
                default -> out.println("\nInvalid option! Please select 1-8.");
            }
            out.flush();
        }
    }

    /**
     * Compiles a program and prints the outcome.
     *
     * @param source The program text.
     * @return true if compilation succeeded.
     */
    boolean compile(String source) {
        if (source.isBlank()) {
            out.println("\nError: No code provided!");
            return false;
        }

        printSection("COMPILATION PROCESS");
        out.println("Pre-defined variables: " + describeNames(session.symbols()));
        try {
            CompilationResult result = session.compile(source);
            out.println("Total tokens generated: " + result.tokenCount());
            out.println("Symbol table updated: " + describeNames(result.symbols()));
            out.println("\nGenerated Three-Address Code:");
            out.println(THIN_RULE);
            List<String> instructions = result.instructions();
            for (int i = 0; i < instructions.size(); i++) {
                out.printf("%3d| %s%n", i + 1, instructions.get(i));
            }
            out.println(RULE);
            out.println("COMPILATION SUCCESSFUL");
            out.println(RULE);
            return true;
        } catch (CompilationException e) {
            out.println(RULE);
            out.println("COMPILATION FAILED (" + e.getPhase() + ")");
            out.println(RULE);
            out.println("\nError: " + e.getMessage());
            return false;
        }
    }

    private Optional<String> readPastedCode() throws IOException {
        out.println("\nEnter code (single line or paste multiple lines, then an empty line):");
        out.println(THIN_RULE);
        out.flush();
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = in.readLine()) != null && !line.isBlank()) {
            lines.add(line);
        }
        return Optional.of(String.join("\n", lines));
    }

    private Optional<String> readMultilineCode() throws IOException {
        out.println("\nMULTILINE MODE - Enter your code");
        out.println("  Type 'END' on a new line when finished");
        out.println("  Type 'CANCEL' to abort");
        List<String> lines = new ArrayList<>();
        while (true) {
            String line = prompt(String.format("%3d| ", lines.size() + 1));
            if (line == null || line.trim().equalsIgnoreCase("END")) {
                break;
            }
            if (line.trim().equalsIgnoreCase("CANCEL")) {
                out.println("Input cancelled.");
                return Optional.empty();
            }
            lines.add(line);
        }
        return Optional.of(String.join("\n", lines));
    }

    private void loadSample() throws IOException {
        printSection("SAMPLE PROGRAMS");
        for (SampleCatalog.Sample sample : catalog.samples()) {
            out.println("  " + sample.number() + ". " + sample.title());
        }
        String choice = prompt("\nSelect sample (1-" + catalog.samples().size() + ") or 'b' to go back: ");
        if (choice == null || choice.trim().equalsIgnoreCase("b")) {
            return;
        }

        Optional<SampleCatalog.Sample> sample;
        try {
            sample = catalog.find(Integer.parseInt(choice.trim()));
        } catch (NumberFormatException e) {
            sample = Optional.empty();
        }
        if (sample.isEmpty()) {
            out.println("\nNo such sample: " + choice.trim());
            return;
        }

        String code = catalog.load(sample.get());
        out.println("\nSample code loaded:");
        out.println(THIN_RULE);
        out.print(code);
        out.println(THIN_RULE);
        String confirm = prompt("\nCompile this code? (y/n): ");
        if (confirm != null && confirm.trim().equalsIgnoreCase("y")) {
            compile(code);
        }
    }

    private void showSymbolTable() {
        printSection("SYMBOL TABLE");
        Map<String, String> symbols = session.symbols();
        if (symbols.isEmpty()) {
            out.println("\n  No variables defined yet.");
            return;
        }
        out.println("\n  Variable         Type");
        out.println("  " + "-".repeat(30));
        symbols.forEach((name, type) -> out.printf("  %-15s  %s%n", name, type));
    }

    private void showHistory() {
        printSection("COMPILATION HISTORY");
        List<HistoryEntry> history = session.history();
        if (history.isEmpty()) {
            out.println("\n  No compilation history yet.");
            return;
        }
        for (int i = 0; i < history.size(); i++) {
            HistoryEntry entry = history.get(i);
            out.println("\n  [" + (i + 1) + "] Status: " + entry.status());
            out.println("      Code Preview: " + entry.preview(previewLength));
            if (entry.status() == HistoryEntry.Status.SUCCESS) {
                out.println("      Instructions: " + entry.instructionCount() + " lines");
            } else {
                out.println("      Error: " + entry.error());
            }
        }
    }

    private void defineVariables() throws IOException {
        printSection("DEFINE VARIABLES");
        out.println("\nCurrent symbol table: " + describeNames(session.symbols()));
        out.println("\nEnter variable names (comma-separated) or 'clear' to reset:");
        out.println("Example: x, y, z");
        String input = prompt("\n> ");
        if (input == null || input.isBlank()) {
            return;
        }
        if (input.trim().equalsIgnoreCase("clear")) {
            session.clearSymbols();
            out.println("\nSymbol table cleared!");
            return;
        }
        List<String> rejected = session.defineVariables(Arrays.asList(input.split(",")));
        if (!rejected.isEmpty()) {
            out.println("\nIgnored invalid names: " + rejected);
        }
        out.println("\nVariables defined: " + describeNames(session.symbols()));
    }

    private String prompt(String text) throws IOException {
        out.print(text);
        out.flush();
        String line = in.readLine();
        if (line == null) {
            log.debug("End of input reached at prompt '{}'", text.trim());
        }
        return line;
    }

    private void printBanner() {
        out.println(RULE);
        out.println("  tacc - if/else to three-address code compiler");
        out.println(RULE);
    }

    private void printMenu() {
        out.println("""

                Select an option:
                1. Compile Code
                2. Compile Code (Multiline)
                3. Load Sample Code
                4. View Symbol Table
                5. View Compilation History
                6. Define Variables
                7. Help & Language Reference
                8. Exit
                """);
    }

    private void printSection(String title) {
        out.println("\n" + RULE);
        out.println(title);
        out.println(RULE);
    }

    private void printGoodbye() {
        out.println("\n" + RULE);
        out.println("  Goodbye!");
        out.println(RULE);
        out.flush();
    }

    private static String describeNames(Map<String, String> symbols) {
        return symbols.isEmpty() ? "None" : symbols.keySet().toString();
    }
}
