package org.tacc.compiler;

import org.tacc.compiler.api.CompilationException;
import org.tacc.compiler.api.CompilationResult;
import org.tacc.compiler.backend.codegen.CodeGenerator;
import org.tacc.compiler.frontend.lexer.Lexer;
import org.tacc.compiler.frontend.lexer.Token;
import org.tacc.compiler.frontend.parser.Parser;
import org.tacc.compiler.frontend.parser.ast.IfStatementNode;
import org.tacc.compiler.frontend.semantics.SemanticAnalyzer;
import org.tacc.compiler.frontend.semantics.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Entry point of the compilation pipeline.
 * <p>
 * Runs the phases strictly in sequence, each to completion:
 * <ol>
 *   <li>Lexing: source text to tokens.</li>
 *   <li>Parsing: tokens to an AST rooted at an if statement.</li>
 *   <li>Semantic analysis: definition-before-use check against a copy of the seed symbols.</li>
 *   <li>Code generation: AST to three-address code.</li>
 * </ol>
 * The first failing phase aborts the run with its {@link CompilationException}.
 * <p>
 * Every call builds fresh phase objects, so temporaries and labels are numbered from 1 in each
 * result and no state leaks between calls. The only carried state is the symbol table, which
 * callers thread through explicitly.
 */
public class Compiler {

    private static final Logger log = LoggerFactory.getLogger(Compiler.class);

    /**
     * Compiles a program with no pre-declared variables.
     *
     * @see #compile(String, Map)
     */
    public CompilationResult compile(String source) throws CompilationException {
        return compile(source, Map.of());
    }

    /**
     * Compiles a program.
     *
     * @param source         The program text.
     * @param initialSymbols Variables known before the run (name to type). Not modified.
     * @return The generated instructions and the symbol table after the run.
     * @throws CompilationException If any phase fails.
     */
    public CompilationResult compile(String source, Map<String, String> initialSymbols) throws CompilationException {
        List<Token> tokens = new Lexer(source).tokenize();
        log.debug("Lexing produced {} token(s)", tokens.size() - 1);

        IfStatementNode ast = new Parser(tokens).parse();
        log.debug("Parsed {}", ast.kind());

        SymbolTable symbols = new SemanticAnalyzer(new SymbolTable(initialSymbols)).analyze(ast);

        List<String> instructions = new CodeGenerator().generate(ast);
        log.debug("Generated {} instruction(s)", instructions.size());

        return new CompilationResult(instructions, symbols.asMap(), tokens.size() - 1);
    }
}
