package org.tacc.compiler.frontend.lexer;

import org.tacc.compiler.api.LexicalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts source text into a list of tokens.
 * <p>
 * The source is scanned left to right with a single alternation of named groups. The
 * alternatives are tried in a fixed priority order (first match wins, not longest), so the
 * order of {@link #RULES} is part of the language definition:
 * <ul>
 *   <li>keywords before identifiers, guarded by word boundaries so {@code iffy} stays an identifier,</li>
 *   <li>two-character operators before their one-character prefixes,</li>
 *   <li>{@code ==} as an operator before {@code =} as assignment.</li>
 * </ul>
 * Whitespace is discarded. Any other character aborts scanning with a {@link LexicalException}.
 */
public class Lexer {

    private static final Logger log = LoggerFactory.getLogger(Lexer.class);

    private record Rule(String group, TokenType type, String regex) {}

    private static final String WHITESPACE_GROUP = "SKIP";
    private static final String IDENTIFIER_REGEX = "[a-zA-Z_]\\w*";

    // \d, \w and \b follow Unicode, so "café" is one identifier.
    private static final int FLAGS = Pattern.UNICODE_CHARACTER_CLASS;

    private static final List<Rule> RULES = List.of(
            new Rule("IF", TokenType.IF, "\\bif\\b"),
            new Rule("ELSE", TokenType.ELSE, "\\belse\\b"),
            new Rule("NUMBER", TokenType.NUMBER, "\\d+"),
            new Rule("ID", TokenType.ID, IDENTIFIER_REGEX),
            new Rule("OP", TokenType.OP, "==|!=|<=|>=|<|>"),
            new Rule("ASSIGN", TokenType.ASSIGN, "="),
            new Rule("SEMI", TokenType.SEMI, ";"),
            new Rule("LPAREN", TokenType.LPAREN, "\\("),
            new Rule("RPAREN", TokenType.RPAREN, "\\)"),
            new Rule("LBRACE", TokenType.LBRACE, "\\{"),
            new Rule("RBRACE", TokenType.RBRACE, "\\}"),
            new Rule(WHITESPACE_GROUP, null, "[ \\t\\r\\n]+")
    );

    private static final Pattern TOKEN_PATTERN = compile(RULES);
    private static final Pattern IDENTIFIER = Pattern.compile(IDENTIFIER_REGEX, FLAGS);
    private static final Set<String> KEYWORDS = Set.of("if", "else");

    private final String source;

    /**
     * @param source The program text to scan.
     */
    public Lexer(String source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Scans the whole source.
     *
     * @return The tokens in source order, always terminated by a single {@link TokenType#EOF} token.
     * @throws LexicalException If a character matches none of the lexical classes.
     */
    public List<Token> tokenize() throws LexicalException {
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = TOKEN_PATTERN.matcher(source);
        // Word boundaries must see the characters before the region, as a whole-string scan would.
        matcher.useTransparentBounds(true);

        int pos = 0;
        while (pos < source.length()) {
            matcher.region(pos, source.length());
            if (!matcher.lookingAt()) {
                int codePoint = source.codePointAt(pos);
                throw new LexicalException(new String(Character.toChars(codePoint)), pos);
            }
            Rule rule = matchedRule(matcher);
            if (rule.type() != null) {
                Token token = new Token(rule.type(), matcher.group(), pos);
                log.debug("Found token: type={}, text={}", token.type(), token.text());
                tokens.add(token);
            }
            pos = matcher.end();
        }

        tokens.add(Token.eof(source.length()));
        return tokens;
    }

    /**
     * Tells whether {@code text} would scan as exactly one {@link TokenType#ID} token.
     *
     * @param text Candidate variable name.
     * @return false for keywords, for text that is not a single identifier and for {@code null}.
     */
    public static boolean isIdentifier(String text) {
        return text != null && IDENTIFIER.matcher(text).matches() && !KEYWORDS.contains(text);
    }

    private static Rule matchedRule(Matcher matcher) {
        for (Rule rule : RULES) {
            if (matcher.group(rule.group()) != null) {
                return rule;
            }
        }
        throw new IllegalStateException("Token pattern matched without any rule group: '" + matcher.group() + "'");
    }

    private static Pattern compile(List<Rule> rules) {
        StringBuilder regex = new StringBuilder();
        for (Rule rule : rules) {
            if (regex.length() > 0) {
                regex.append('|');
            }
            regex.append("(?<").append(rule.group()).append('>').append(rule.regex()).append(')');
        }
        return Pattern.compile(regex.toString(), FLAGS);
    }
}
