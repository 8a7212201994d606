package org.pragmatica.ontology.dsl;

import java.util.Arrays;

/**
 * Aggregation functions available in an {@code AGGREGATE} statement, keyed by the keyword
 * that introduces them.
 */
public enum AggregateFunction {
    SUM(TokenKind.AGG_SUM),
    COUNT(TokenKind.AGG_COUNT),
    FIRST(TokenKind.TAKE_FIRST);

    private final TokenKind keyword;

    AggregateFunction(TokenKind keyword) {
        this.keyword = keyword;
    }

    public TokenKind keyword() {
        return keyword;
    }

    public static boolean isAggregateKeyword(TokenKind kind) {
        return Arrays.stream(values())
                     .anyMatch(function -> function.keyword() == kind);
    }

    public static AggregateFunction fromKeyword(TokenKind kind) {
        return Arrays.stream(values())
                     .filter(function -> function.keyword() == kind)
                     .findFirst()
                     .orElseThrow(() -> new IllegalArgumentException("Not an aggregation keyword: " + kind));
    }
}
