package org.tacc.compiler.frontend.parser;

import org.tacc.compiler.api.SyntaxException;
import org.tacc.compiler.frontend.lexer.Token;
import org.tacc.compiler.frontend.lexer.TokenType;
import org.tacc.compiler.frontend.parser.ast.AssignmentNode;
import org.tacc.compiler.frontend.parser.ast.AstNode;
import org.tacc.compiler.frontend.parser.ast.BinaryOpNode;
import org.tacc.compiler.frontend.parser.ast.IfStatementNode;
import org.tacc.compiler.frontend.parser.ast.NumberNode;
import org.tacc.compiler.frontend.parser.ast.VariableNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the conditional language.
 * <p>
 * Grammar:
 * <pre>
 *   program      := if_statement
 *   if_statement := IF LPAREN condition RPAREN LBRACE block RBRACE (ELSE LBRACE block RBRACE)?
 *   condition    := ID OP (ID | NUMBER)
 *   block        := (ID ASSIGN (NUMBER | ID) SEMI)*
 * </pre>
 * Single pass, one token of lookahead, no backtracking. The first token that does not match
 * the rule being parsed raises a {@link SyntaxException}.
 */
public class Parser implements ParsingContext {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private final List<Token> tokens;
    private int current = 0;

    /**
     * @param tokens The token stream from the lexer. Must end with an EOF token.
     */
    public Parser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token stream must be terminated by EOF");
        }
        this.tokens = List.copyOf(tokens);
    }

    /**
     * Parses the whole program.
     *
     * @return The root of the AST.
     * @throws SyntaxException If the token stream does not match the grammar.
     */
    public IfStatementNode parse() throws SyntaxException {
        IfStatementNode program = parseIfStatement();
        if (!isAtEnd()) {
            // Only the leading if statement is compiled.
            log.warn("Ignoring {} trailing token(s) after the if statement, starting at {}",
                    tokens.size() - 1 - current, peek());
        }
        return program;
    }

    private IfStatementNode parseIfStatement() throws SyntaxException {
        consume(TokenType.IF);
        consume(TokenType.LPAREN);
        BinaryOpNode condition = parseCondition();
        consume(TokenType.RPAREN);

        consume(TokenType.LBRACE);
        List<AssignmentNode> thenBody = parseBlock();
        consume(TokenType.RBRACE);

        List<AssignmentNode> elseBody = null;
        if (check(TokenType.ELSE)) {
            advance();
            consume(TokenType.LBRACE);
            elseBody = parseBlock();
            consume(TokenType.RBRACE);
        }

        return new IfStatementNode(condition, thenBody, elseBody);
    }

    private BinaryOpNode parseCondition() throws SyntaxException {
        Token left = consume(TokenType.ID);
        Token operator = consume(TokenType.OP);
        // Anything other than ID or NUMBER leaves the operand absent; semantic analysis rejects it.
        AstNode right = parseOperand();
        return new BinaryOpNode(new VariableNode(left.text()), operator.text(), right);
    }

    private List<AssignmentNode> parseBlock() throws SyntaxException {
        List<AssignmentNode> statements = new ArrayList<>();
        while (check(TokenType.ID)) {
            Token name = advance();
            consume(TokenType.ASSIGN);
            AstNode value = parseOperand();
            consume(TokenType.SEMI);
            statements.add(new AssignmentNode(name.text(), value));
        }
        return statements;
    }

    private AstNode parseOperand() {
        if (check(TokenType.ID)) {
            return new VariableNode(advance().text());
        }
        if (check(TokenType.NUMBER)) {
            return new NumberNode(new BigInteger(advance().text()));
        }
        return null;
    }

    @Override
    public boolean check(TokenType type) {
        return peek().type() == type;
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token advance() {
        Token token = peek();
        if (!isAtEnd()) {
            current++;
        }
        return token;
    }

    @Override
    public Token consume(TokenType type) throws SyntaxException {
        if (check(type)) {
            return advance();
        }
        throw new SyntaxException(type, peek().type());
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }
}
