package org.tacc.cli.shell;

import com.typesafe.config.Config;
import org.tacc.compiler.Compiler;
import org.tacc.compiler.api.CompilationException;
import org.tacc.compiler.api.CompilationResult;
import org.tacc.compiler.frontend.lexer.Lexer;
import org.tacc.compiler.frontend.semantics.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * State shared by the compilations of one interactive session.
 * <p>
 * Owns the session symbol table, which seeds every compilation and accumulates the variables
 * each successful run assigns, and a bounded history of compilation attempts. A failed
 * compilation leaves the symbol table untouched.
 * <p>
 * Not thread-safe; a session serves one user.
 */
public class CompilerSession {

    private static final Logger log = LoggerFactory.getLogger(CompilerSession.class);

    private final Compiler compiler;
    private final int historyLimit;
    private SymbolTable symbols = new SymbolTable();
    private final Deque<HistoryEntry> history = new ArrayDeque<>();

    /**
     * @param compiler     The compiler to run.
     * @param predefined   Variables declared before the first compilation.
     * @param historyLimit Maximum number of history entries kept; the oldest are dropped first.
     */
    public CompilerSession(Compiler compiler, Collection<String> predefined, int historyLimit) {
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be positive: " + historyLimit);
        }
        this.compiler = compiler;
        this.historyLimit = historyLimit;
        defineVariables(predefined);
    }

    /**
     * Creates a session from the {@code tacc.compiler} and {@code tacc.shell} configuration blocks.
     *
     * @param config The resolved application configuration.
     * @return A new session.
     */
    public static CompilerSession fromConfig(Config config) {
        return new CompilerSession(
                new Compiler(),
                config.getStringList("tacc.compiler.predefined-variables"),
                config.getInt("tacc.shell.history-limit"));
    }

    /**
     * Compiles a program against the session symbol table and records the attempt.
     *
     * @param source The program text.
     * @return The compilation result.
     * @throws CompilationException If compilation fails; the attempt is still recorded.
     */
    public CompilationResult compile(String source) throws CompilationException {
        try {
            CompilationResult result = compiler.compile(source, symbols.asMap());
            symbols = new SymbolTable(result.symbols());
            record(HistoryEntry.success(source, result.instructions().size()));
            return result;
        } catch (CompilationException e) {
            log.debug("Compilation failed in phase {}: {}", e.getPhase(), e.getMessage());
            record(HistoryEntry.failure(source, e.getMessage()));
            throw e;
        }
    }

    /**
     * Declares variables so programs may reference them before assigning them.
     *
     * @param names Candidate names; surrounding whitespace is ignored, blanks are skipped.
     * @return The names that were rejected because they are not valid identifiers or are keywords.
     */
    public List<String> defineVariables(Collection<String> names) {
        List<String> rejected = new ArrayList<>();
        for (String raw : names) {
            String name = raw.trim();
            if (name.isEmpty()) {
                continue;
            }
            if (!Lexer.isIdentifier(name)) {
                rejected.add(name);
                continue;
            }
            symbols.define(name);
        }
        return rejected;
    }

    public void clearSymbols() {
        symbols = new SymbolTable();
    }

    /**
     * @return A snapshot of the session symbol table, in definition order.
     */
    public Map<String, String> symbols() {
        return symbols.asMap();
    }

    /**
     * @return A snapshot of the history, oldest first.
     */
    public List<HistoryEntry> history() {
        return List.copyOf(history);
    }

    private void record(HistoryEntry entry) {
        history.addLast(entry);
        while (history.size() > historyLimit) {
            history.removeFirst();
        }
    }
}
