package org.pragmatica.ontology.dsl;

import org.pragmatica.ontology.error.LexicalError;
import org.pragmatica.ontology.tree.SourceLocation;
import org.pragmatica.ontology.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for the ontology DSL.
 *
 * <p>Single pass over the input. Spaces, tabs, carriage returns, newlines and
 * {@code #} comments produce no tokens. The returned list always ends with
 * {@link TokenKind#END_OF_INPUT}.
 */
public final class DslLexer {
    /**
     * Largest source accepted when no other limit is given, in characters.
     */
    public static final int MAX_INPUT_SIZE = 1_000_000;

    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private final String input;
    private int pos;
    private int line;
    private int column;

    private DslLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    /**
     * Split source text into tokens.
     *
     * @throws LexicalError on the first character that cannot start a token
     */
    public static List<DslToken> tokenize(String input) {
        return tokenize(input, MAX_INPUT_SIZE);
    }

    /**
     * Split source text into tokens, rejecting input longer than {@code maxInputSize} characters.
     *
     * @throws LexicalError at the first character past the limit, or on the first character
     *                      that cannot start a token
     */
    public static List<DslToken> tokenize(String input, int maxInputSize) {
        var lexer = new DslLexer(input);
        lexer.checkSize(maxInputSize);
        return lexer.tokenizeAll();
    }

    private void checkSize(int maxInputSize) {
        if (input.length() <= maxInputSize) {
            return;
        }
        // walk up to the limit so the error points at the first rejected character
        while (pos < maxInputSize) {
            advance();
        }
        var start = currentLocation();
        advance();
        throw LexicalError.inputTooLarge(maxInputSize, span(start));
    }

    private List<DslToken> tokenizeAll() {
        var tokens = new ArrayList<DslToken>();
        while (!isAtEnd()) {
            skipWhitespaceAndComments();
            if (!isAtEnd()) {
                tokens.add(nextToken());
            }
        }
        tokens.add(new DslToken(TokenKind.END_OF_INPUT, "", currentSpan()));
        return List.copyOf(tokens);
    }

    private DslToken nextToken() {
        var start = currentLocation();
        char c = peek();
        if (c == '"') {
            return scanString(start);
        }
        if (isDigit(c)) {
            return scanNumber(start);
        }
        if (isIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        return scanPunctuation(start);
    }

    private DslToken scanString(SourceLocation start) {
        // opening quote
        advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\') {
                // backslash takes the next character literally
                advance();
                if (!isAtEnd()) {
                    sb.append(advance());
                }
            } else {
                sb.append(advance());
            }
        }
        if (isAtEnd()) {
            throw LexicalError.unterminatedString(span(start));
        }
        // closing quote
        advance();
        return new DslToken(TokenKind.STRING, sb.toString(), span(start));
    }

    private DslToken scanNumber(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        boolean seenPoint = false;
        while (!isAtEnd()) {
            char c = peek();
            if (isDigit(c)) {
                sb.append(advance());
            } else if (c == '.' && !seenPoint) {
                seenPoint = true;
                sb.append(advance());
            } else {
                break;
            }
        }
        return new DslToken(TokenKind.NUMBER, sb.toString(), span(start));
    }

    private DslToken scanIdentifier(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek()) && !isArrowAhead()) {
            sb.append(advance());
        }
        var word = sb.toString();
        var kind = TokenKind.keyword(word)
                            .orElse(TokenKind.IDENTIFIER);
        return new DslToken(kind, word, span(start));
    }

    private DslToken scanPunctuation(SourceLocation start) {
        char c = advance();
        var kind = switch (c) {
            case '{' -> TokenKind.LBRACE;
            case '}' -> TokenKind.RBRACE;
            case '[' -> TokenKind.LBRACKET;
            case ']' -> TokenKind.RBRACKET;
            case '(' -> TokenKind.LPAREN;
            case ')' -> TokenKind.RPAREN;
            case ',' -> TokenKind.COMMA;
            case ':' -> TokenKind.COLON;
            case '.' -> TokenKind.DOT;
            case '+' -> TokenKind.PLUS;
            case '*' -> TokenKind.STAR;
            case '/' -> TokenKind.SLASH;
            case '-' -> {
                if (!isAtEnd() && peek() == '>') {
                    advance();
                    yield TokenKind.ARROW;
                }
                yield TokenKind.MINUS;
            }
            default -> throw LexicalError.unexpectedCharacter(c, span(start));
        };
        return new DslToken(kind, input.substring(start.offset(), pos), span(start));
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else if (c == '#') {
                // Line comment
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    // a hyphen that starts "->" belongs to the arrow, not to the identifier
    private boolean isArrowAhead() {
        return peek() == '-' && pos + 1 < input.length() && input.charAt(pos + 1) == '>';
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan currentSpan() {
        return SourceSpan.at(currentLocation());
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }
}
