package org.pragmatica.ontology.dsl;

import org.pragmatica.ontology.error.SyntaxError;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent parser for the ontology DSL.
 * Converts a token list into a {@link Program}; stops at the first unexpected token.
 */
public final class DslParser {
    private static final Set<TokenKind> VALUE_LITERAL = EnumSet.of(TokenKind.IDENTIFIER, TokenKind.STRING);
    private static final Set<TokenKind> CONCATENATION_PART = EnumSet.of(TokenKind.IDENTIFIER, TokenKind.STRING);
    private static final Set<TokenKind> PRIMARY = EnumSet.of(TokenKind.IDENTIFIER, TokenKind.STRING, TokenKind.NUMBER);

    private final List<DslToken> tokens;
    private int pos;

    private DslParser(List<DslToken> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parse DSL text into a program.
     */
    public static Program parse(String source) {
        return parse(DslLexer.tokenize(source));
    }

    /**
     * Parse a token list produced by {@link DslLexer}. The list must end with
     * {@link TokenKind#END_OF_INPUT}.
     *
     * @throws SyntaxError on the first token that does not fit the grammar
     */
    public static Program parse(List<DslToken> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenKind.END_OF_INPUT)) {
            throw new IllegalArgumentException("Token list must end with " + TokenKind.END_OF_INPUT);
        }
        return new DslParser(tokens).parseProgram();
    }

    private Program parseProgram() {
        var statements = new ArrayList<Statement>();
        while (!isAtEnd()) {
            statements.add(parseStatement());
        }
        return new Program(statements);
    }

    private Statement parseStatement() {
        var token = peek();
        return switch (token.kind()) {
            case LOAD_CSV -> parseLoad();
            case NORMALIZE -> parseNormalize();
            case AGGREGATE -> parseAggregate();
            case UNIT_CONVERT -> parseUnitConvert();
            case ENRICH -> parseEnrich();
            case COMPUTE -> parseCompute();
            case VALIDATE -> parseValidate();
            default -> throw unexpected(TokenKind.STATEMENT_KEYWORDS);
        };
    }

    // LOAD_CSV <string> AS <ident> [MAP_COLUMNS { <ident> -> <ident> (, ...)* }]
    private Statement.Load parseLoad() {
        expect(TokenKind.LOAD_CSV);
        var path = expect(TokenKind.STRING).text();
        expect(TokenKind.AS);
        var nodeLabel = expect(TokenKind.IDENTIFIER).text();

        var columnMap = new LinkedHashMap<String, String>();
        if (check(TokenKind.MAP_COLUMNS)) {
            advance();
            expect(TokenKind.LBRACE);
            while (!check(TokenKind.RBRACE)) {
                var source = expect(TokenKind.IDENTIFIER).text();
                expect(TokenKind.ARROW);
                var target = expect(TokenKind.IDENTIFIER).text();
                columnMap.put(source, target);
                skipComma();
            }
            expect(TokenKind.RBRACE);
        }
        return new Statement.Load(path, nodeLabel, columnMap);
    }

    // NORMALIZE <ident> { <ident> : { <value> : <value> (, ...)* } (, ...)* }
    private Statement.Normalize parseNormalize() {
        expect(TokenKind.NORMALIZE);
        var nodeLabel = expect(TokenKind.IDENTIFIER).text();
        expect(TokenKind.LBRACE);

        var normalizations = new LinkedHashMap<String, Map<String, String>>();
        while (!check(TokenKind.RBRACE)) {
            var property = expect(TokenKind.IDENTIFIER).text();
            expect(TokenKind.COLON);
            expect(TokenKind.LBRACE);

            var mappings = new LinkedHashMap<String, String>();
            while (!check(TokenKind.RBRACE)) {
                var oldValue = parseValueLiteral();
                expect(TokenKind.COLON);
                var newValue = parseValueLiteral();
                mappings.put(oldValue, newValue);
                skipComma();
            }
            expect(TokenKind.RBRACE);
            normalizations.put(property, mappings);
            skipComma();
        }
        expect(TokenKind.RBRACE);
        return new Statement.Normalize(nodeLabel, normalizations);
    }

    // AGGREGATE <ident> BY [ids] INTO <ident> (AGG_*( [ident] ) AS <ident>)* [TIME_WINDOW ...]
    private Statement.Aggregate parseAggregate() {
        expect(TokenKind.AGGREGATE);
        var sourceLabel = expect(TokenKind.IDENTIFIER).text();
        expect(TokenKind.BY);
        var groupBy = parseIdentifierList();
        expect(TokenKind.INTO);
        var targetLabel = expect(TokenKind.IDENTIFIER).text();

        var aggregations = new ArrayList<AggregationClause>();
        while (AggregateFunction.isAggregateKeyword(peek().kind())) {
            aggregations.add(parseAggregationClause());
        }

        Optional<TimeWindow> timeWindow = Optional.empty();
        if (check(TokenKind.TIME_WINDOW)) {
            advance();
            var mode = expect(TokenKind.IDENTIFIER).text();
            expect(TokenKind.FROM);
            var sourceField = expect(TokenKind.IDENTIFIER).text();
            expect(TokenKind.INTO);
            var targetField = expect(TokenKind.IDENTIFIER).text();
            timeWindow = Optional.of(new TimeWindow(mode, sourceField, targetField));
        }
        return new Statement.Aggregate(sourceLabel, groupBy, targetLabel, aggregations, timeWindow);
    }

    private AggregationClause parseAggregationClause() {
        var function = AggregateFunction.fromKeyword(peek().kind());
        advance();
        expect(TokenKind.LPAREN);
        Optional<String> field = Optional.empty();
        if (check(TokenKind.IDENTIFIER)) {
            field = Optional.of(expect(TokenKind.IDENTIFIER).text());
        }
        expect(TokenKind.RPAREN);
        expect(TokenKind.AS);
        var alias = expect(TokenKind.IDENTIFIER).text();
        return new AggregationClause(function, field, alias);
    }

    // UNIT_CONVERT <ident> . <ident> FROM <value> TO <value> USING <string>
    private Statement.UnitConvert parseUnitConvert() {
        expect(TokenKind.UNIT_CONVERT);
        var nodeLabel = expect(TokenKind.IDENTIFIER).text();
        expect(TokenKind.DOT);
        var field = expect(TokenKind.IDENTIFIER).text();
        expect(TokenKind.FROM);
        var fromUnit = parseValueLiteral();
        expect(TokenKind.TO);
        var toUnit = parseValueLiteral();
        expect(TokenKind.USING);
        var conversionTable = expect(TokenKind.STRING).text();
        return new Statement.UnitConvert(nodeLabel, field, fromUnit, toUnit, conversionTable);
    }

    // ENRICH <ident> WITH <value> MATCH ON <ident> OUTPUT <ident> AS { <ident> : <expr> (, ...)* }
    private Statement.Enrich parseEnrich() {
        expect(TokenKind.ENRICH);
        var sourceLabel = expect(TokenKind.IDENTIFIER).text();
        expect(TokenKind.WITH);
        var factorTable = parseValueLiteral();
        expect(TokenKind.MATCH);
        expect(TokenKind.ON);
        var matchKey = expect(TokenKind.IDENTIFIER).text();
        expect(TokenKind.OUTPUT);
        var targetLabel = expect(TokenKind.IDENTIFIER).text();
        expect(TokenKind.AS);
        expect(TokenKind.LBRACE);

        var outputFields = new LinkedHashMap<String, Expression>();
        while (!check(TokenKind.RBRACE)) {
            var fieldName = expect(TokenKind.IDENTIFIER).text();
            expect(TokenKind.COLON);
            outputFields.put(fieldName, parseExpression());
            skipComma();
        }
        expect(TokenKind.RBRACE);
        return new Statement.Enrich(sourceLabel, factorTable, matchKey, targetLabel, outputFields);
    }

    // COMPUTE <ident> FOR <ident> GROUP BY (<ident> | [ids]) INTO <ident> AS <expr>
    private Statement.Compute parseCompute() {
        expect(TokenKind.COMPUTE);
        var fieldName = expect(TokenKind.IDENTIFIER).text();
        expect(TokenKind.FOR);
        var sourceLabel = expect(TokenKind.IDENTIFIER).text();
        expect(TokenKind.GROUP);
        expect(TokenKind.BY);

        List<String> groupBy;
        if (check(TokenKind.LBRACKET)) {
            groupBy = parseIdentifierList();
        } else {
            groupBy = List.of(expect(TokenKind.IDENTIFIER).text());
        }

        expect(TokenKind.INTO);
        var targetLabel = expect(TokenKind.IDENTIFIER).text();
        expect(TokenKind.AS);
        var expression = parseExpression();
        return new Statement.Compute(fieldName, sourceLabel, groupBy, targetLabel, expression);
    }

    // VALIDATE <ident> WITH <string>
    private Statement.Validate parseValidate() {
        expect(TokenKind.VALIDATE);
        var nodeLabel = expect(TokenKind.IDENTIFIER).text();
        expect(TokenKind.WITH);
        var ruleName = expect(TokenKind.STRING).text();
        return new Statement.Validate(nodeLabel, ruleName);
    }

    // [ <ident> (, <ident>)* ]
    private List<String> parseIdentifierList() {
        expect(TokenKind.LBRACKET);
        var identifiers = new ArrayList<String>();
        while (!check(TokenKind.RBRACKET)) {
            identifiers.add(expect(TokenKind.IDENTIFIER).text());
            skipComma();
        }
        expect(TokenKind.RBRACKET);
        return identifiers;
    }

    private String parseValueLiteral() {
        var token = peek();
        if (token.is(TokenKind.IDENTIFIER) || token.is(TokenKind.STRING)) {
            advance();
            return token.text();
        }
        throw unexpected(VALUE_LITERAL);
    }

    // === Expressions ===

    private Expression parseExpression() {
        return parseAdditive();
    }

    private Expression parseAdditive() {
        var left = parseMultiplicative();
        while (check(TokenKind.PLUS) || check(TokenKind.MINUS)) {
            var operator = check(TokenKind.PLUS)
                           ? Expression.Operator.PLUS
                           : Expression.Operator.MINUS;
            advance();
            var right = parseMultiplicative();
            left = new Expression.BinaryOp(left, operator, right);
        }
        return left;
    }

    private Expression parseMultiplicative() {
        var left = parsePrimary();
        while (check(TokenKind.STAR) || check(TokenKind.SLASH)) {
            var operator = check(TokenKind.STAR)
                           ? Expression.Operator.MULTIPLY
                           : Expression.Operator.DIVIDE;
            advance();
            var right = parsePrimary();
            left = new Expression.BinaryOp(left, operator, right);
        }
        return left;
    }

    private Expression parsePrimary() {
        var token = peek();

        // Function call: name '(' ident ')'
        if (token.is(TokenKind.IDENTIFIER) && peekNext().is(TokenKind.LPAREN)) {
            advance();
            expect(TokenKind.LPAREN);
            var argument = expect(TokenKind.IDENTIFIER).text();
            expect(TokenKind.RPAREN);
            return new Expression.FunctionCall(token.text(), argument);
        }

        // Identifier or string, possibly starting a concatenation chain
        if (token.is(TokenKind.IDENTIFIER)) {
            return parseConcatenation(parseIdentifier());
        }
        if (token.is(TokenKind.STRING)) {
            advance();
            return parseConcatenation(new Expression.StringLiteral(token.text()));
        }

        if (token.is(TokenKind.NUMBER)) {
            advance();
            return parseNumber(token.text());
        }

        throw unexpected(PRIMARY);
    }

    /**
     * Once the first operand is an identifier or a string, every following '+' joins
     * another identifier or string; arithmetic on such operands is not part of the grammar.
     */
    private Expression parseConcatenation(Expression.Part first) {
        var parts = new ArrayList<Expression.Part>();
        parts.add(first);
        while (check(TokenKind.PLUS)) {
            advance();
            if (check(TokenKind.IDENTIFIER)) {
                parts.add(parseIdentifier());
            } else if (check(TokenKind.STRING)) {
                parts.add(new Expression.StringLiteral(advance().text()));
            } else {
                throw unexpected(CONCATENATION_PART);
            }
        }
        return parts.size() == 1
               ? first
               : new Expression.Concatenation(parts);
    }

    // <ident> [ . <ident> ]
    private Expression.Identifier parseIdentifier() {
        var name = expect(TokenKind.IDENTIFIER).text();
        if (check(TokenKind.DOT)) {
            advance();
            var field = expect(TokenKind.IDENTIFIER).text();
            return Expression.Identifier.dotted(name, field);
        }
        return new Expression.Identifier(name);
    }

    private static Expression.NumberLiteral parseNumber(String text) {
        if (text.indexOf('.') >= 0) {
            return Expression.NumberLiteral.floating(Double.parseDouble(text));
        }
        try {
            return Expression.NumberLiteral.integral(Long.parseLong(text));
        } catch (NumberFormatException e) {
            // digits only, so the literal is just too large for a long
            return new Expression.NumberLiteral(new BigInteger(text));
        }
    }

    // === Token navigation ===

    private boolean isAtEnd() {
        return peek().is(TokenKind.END_OF_INPUT);
    }

    private DslToken peek() {
        return tokens.get(pos);
    }

    private DslToken peekNext() {
        return pos + 1 < tokens.size()
               ? tokens.get(pos + 1)
               : tokens.get(tokens.size() - 1);
    }

    private boolean check(TokenKind kind) {
        return peek().is(kind);
    }

    private DslToken advance() {
        var token = peek();
        if (!isAtEnd()) {
            pos++;
        }
        return token;
    }

    private DslToken expect(TokenKind kind) {
        if (!check(kind)) {
            throw unexpected(EnumSet.of(kind));
        }
        return advance();
    }

    private void skipComma() {
        if (check(TokenKind.COMMA)) {
            advance();
        }
    }

    private SyntaxError unexpected(Set<TokenKind> expected) {
        var token = peek();
        return new SyntaxError(expected, token.kind(), token.span());
    }
}
