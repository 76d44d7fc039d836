package org.tacc.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.typesafe.config.Config;
import org.tacc.cli.CommandLineInterface;
import org.tacc.compiler.Compiler;
import org.tacc.compiler.api.CompilationException;
import org.tacc.compiler.api.CompilationResult;
import org.tacc.compiler.frontend.io.SourceLoader;
import org.tacc.compiler.frontend.lexer.Lexer;
import org.tacc.compiler.frontend.semantics.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command compiling one program to three-address code.
 * <p>
 * Exit codes: 0 on success, 1 on a compilation error, 2 if the source file cannot be read.
 */
@Command(
    name = "compile",
    mixinStandardHelpOptions = true,
    description = "Compile a program to three-address code"
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    static final int EXIT_COMPILATION_ERROR = 1;
    static final int EXIT_IO_ERROR = 2;

    /**
     * Mutually exclusive program sources: exactly one of --file or --expr.
     */
    static class SourceOptions {
        @Option(
            names = {"-f", "--file"},
            description = "Source file to compile"
        )
        File file;

        @Option(
            names = {"-e", "--expr"},
            description = "Program text to compile, e.g. \"if (x > 1) { y = 2; }\""
        )
        String expression;
    }

    enum OutputFormat { TEXT, JSON }

    @ArgGroup(exclusive = true, multiplicity = "1")
    SourceOptions source;

    @Option(
        names = {"-D", "--define"},
        split = ",",
        description = "Variables to declare before compiling (comma-separated)"
    )
    private List<String> defines = new ArrayList<>();

    @Option(
        names = {"--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})"
    )
    private OutputFormat format = OutputFormat.TEXT;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String program;
        try {
            program = source.file != null
                    ? SourceLoader.loadFile(source.file.toPath()).content()
                    : source.expression;
        } catch (IOException e) {
            err.println("Error: cannot read source file " + source.file + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        Map<String, String> symbols = initialSymbols(parent.getConfig(), err);
        try {
            CompilationResult result = new Compiler().compile(program, symbols);
            if (format == OutputFormat.JSON) {
                out.println(toJson(result));
            } else {
                result.instructions().forEach(out::println);
            }
            out.flush();
            return 0;
        } catch (CompilationException e) {
            log.debug("Compilation failed in phase {}", e.getPhase(), e);
            err.println(e.getMessage());
            err.flush();
            return EXIT_COMPILATION_ERROR;
        }
    }

    /**
     * Collects the configured and {@code -D} names. Blank entries are skipped; names that are not
     * identifiers are reported on {@code err} and left out.
     */
    private Map<String, String> initialSymbols(Config config, PrintWriter err) {
        List<String> candidates = new ArrayList<>(config.getStringList("tacc.compiler.predefined-variables"));
        candidates.addAll(defines);

        Map<String, String> symbols = new LinkedHashMap<>();
        List<String> rejected = new ArrayList<>();
        for (String raw : candidates) {
            String name = raw.trim();
            if (name.isEmpty()) {
                continue;
            }
            if (Lexer.isIdentifier(name)) {
                symbols.put(name, SymbolTable.DEFAULT_TYPE);
            } else {
                rejected.add(name);
            }
        }
        if (!rejected.isEmpty()) {
            log.debug("Rejected variable names: {}", rejected);
            err.println("Ignored invalid variable names: " + rejected);
        }
        return symbols;
    }

    static String toJson(CompilationResult result) {
        JsonObject json = new JsonObject();
        JsonArray instructions = new JsonArray();
        result.instructions().forEach(instructions::add);
        json.add("instructions", instructions);
        JsonObject symbols = new JsonObject();
        result.symbols().forEach(symbols::addProperty);
        json.add("symbols", symbols);
        json.addProperty("tokenCount", result.tokenCount());
        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        return gson.toJson(json);
    }
}
