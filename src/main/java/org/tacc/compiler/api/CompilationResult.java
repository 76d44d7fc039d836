package org.tacc.compiler.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The output of a successful compilation run.
 *
 * @param instructions The generated three-address code, one instruction or label per element.
 * @param symbols      The symbol table after the run (seed plus every variable assigned by the program),
 *                     in insertion order.
 * @param tokenCount   Number of tokens produced by the lexer, excluding the trailing EOF.
 */
public record CompilationResult(List<String> instructions, Map<String, String> symbols, int tokenCount) {

    public CompilationResult {
        instructions = List.copyOf(instructions);
        symbols = Collections.unmodifiableMap(new LinkedHashMap<>(symbols));
    }

    /**
     * @return The instructions joined with newlines, the textual form consumed by downstream tools.
     */
    public String assembly() {
        return String.join("\n", instructions);
    }
}
