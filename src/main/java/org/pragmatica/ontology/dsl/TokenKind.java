package org.pragmatica.ontology.dsl;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;

/**
 * Kinds of DSL tokens. Each kind carries the text used for it in error messages.
 */
public enum TokenKind {
    // Keywords
    LOAD_CSV("LOAD_CSV", true),
    MAP_COLUMNS("MAP_COLUMNS", true),
    NORMALIZE("NORMALIZE", true),
    AGGREGATE("AGGREGATE", true),
    BY("BY", true),
    INTO("INTO", true),
    AGG_SUM("AGG_SUM", true),
    AGG_COUNT("AGG_COUNT", true),
    TAKE_FIRST("TAKE_FIRST", true),
    TIME_WINDOW("TIME_WINDOW", true),
    FROM("FROM", true),
    TO("TO", true),
    UNIT_CONVERT("UNIT_CONVERT", true),
    USING("USING", true),
    ENRICH("ENRICH", true),
    WITH("WITH", true),
    MATCH("MATCH", true),
    ON("ON", true),
    OUTPUT("OUTPUT", true),
    AS("AS", true),
    COMPUTE("COMPUTE", true),
    FOR("FOR", true),
    GROUP("GROUP", true),
    VALIDATE("VALIDATE", true),

    // Literals and identifiers
    IDENTIFIER("identifier", false),
    NUMBER("number", false),
    STRING("string", false),

    // Punctuation and operators
    LBRACE("'{'", false),
    RBRACE("'}'", false),
    LBRACKET("'['", false),
    RBRACKET("']'", false),
    LPAREN("'('", false),
    RPAREN("')'", false),
    COMMA("','", false),
    COLON("':'", false),
    ARROW("'->'", false),
    DOT("'.'", false),
    PLUS("'+'", false),
    MINUS("'-'", false),
    STAR("'*'", false),
    SLASH("'/'", false),

    END_OF_INPUT("end of input", false);

    /**
     * Keywords that may open a statement.
     */
    public static final ImmutableSet<TokenKind> STATEMENT_KEYWORDS =
        Sets.immutableEnumSet(LOAD_CSV, NORMALIZE, AGGREGATE, UNIT_CONVERT, ENRICH, COMPUTE, VALIDATE);

    private static final ImmutableMap<String, TokenKind> KEYWORDS =
        Arrays.stream(values())
              .filter(TokenKind::isKeyword)
              .collect(ImmutableMap.toImmutableMap(TokenKind::display, Function.identity()));

    private final String display;
    private final boolean keyword;

    TokenKind(String display, boolean keyword) {
        this.display = display;
        this.keyword = keyword;
    }

    public String display() {
        return display;
    }

    public boolean isKeyword() {
        return keyword;
    }

    /**
     * Exact, case-sensitive keyword lookup.
     */
    public static Optional<TokenKind> keyword(String word) {
        return Optional.ofNullable(KEYWORDS.get(word));
    }
}
