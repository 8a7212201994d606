package org.pragmatica.ontology.dsl;

import org.junit.jupiter.api.Test;
import org.pragmatica.ontology.error.SyntaxError;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DslParserTest {

    private static Statement single(String source) {
        var program = DslParser.parse(source);
        assertEquals(1, program.size());
        return program.statements().get(0);
    }

    private static Expression computeExpression(String expression) {
        var compute = (Statement.Compute) single("COMPUTE r FOR s GROUP BY k INTO t AS " + expression);
        return compute.expression();
    }

    // === Statements ===

    @Test
    void parse_emptySource_producesEmptyProgram() {
        var program = DslParser.parse("  # nothing here\n");

        assertTrue(program.isEmpty());
    }

    @Test
    void parse_load_capturesPathLabelAndColumnMap() {
        var statement = single("""
            LOAD_CSV "level1.csv" AS measurement
              MAP_COLUMNS { factory -> factory_id, product -> product_id }
            """);

        var load = assertInstanceOf(Statement.Load.class, statement);
        assertEquals("level1.csv", load.path());
        assertEquals("measurement", load.nodeLabel());
        assertThat(load.columnMap()).containsExactly(Map.entry("factory", "factory_id"),
                                                     Map.entry("product", "product_id"));
    }

    @Test
    void parse_loadWithoutMapColumns_hasEmptyColumnMap() {
        var load = (Statement.Load) single("LOAD_CSV \"plain.csv\" AS row_node");

        assertTrue(load.columnMap().isEmpty());
    }

    @Test
    void parse_loadDuplicateSourceColumn_keepsLastMappingInFirstPosition() {
        var load = (Statement.Load) single("""
            LOAD_CSV "a.csv" AS m MAP_COLUMNS { a -> x, b -> y, a -> z }
            """);

        assertThat(load.columnMap()).containsExactly(Map.entry("a", "z"),
                                                     Map.entry("b", "y"));
    }

    @Test
    void parse_listsWithoutCommasOrWithTrailingComma_areAccepted() {
        var load = (Statement.Load) single("LOAD_CSV \"a.csv\" AS m MAP_COLUMNS { a -> x b -> y, }");
        var aggregate = (Statement.Aggregate) single("AGGREGATE m BY [a b,] INTO t");

        assertThat(load.columnMap()).containsOnlyKeys("a", "b");
        assertThat(aggregate.groupBy()).containsExactly("a", "b");
    }

    @Test
    void parse_normalize_capturesNestedMappingsInOrder() {
        var statement = single("""
            NORMALIZE measurement {
              fuel: { "gass": "gas", "electricty": "electricity" },
              unit: { kwh: "kWh" }
            }
            """);

        var normalize = assertInstanceOf(Statement.Normalize.class, statement);
        assertEquals("measurement", normalize.nodeLabel());
        assertThat(normalize.normalizations()).containsOnlyKeys("fuel", "unit");
        assertThat(normalize.normalizations().keySet()).containsExactly("fuel", "unit");
        assertThat(normalize.normalizations().get("fuel"))
            .containsExactly(Map.entry("gass", "gas"), Map.entry("electricty", "electricity"));
        assertThat(normalize.normalizations().get("unit")).containsExactly(Map.entry("kwh", "kWh"));
    }

    @Test
    void parse_aggregate_capturesClausesAndTimeWindow() {
        var statement = single("""
            AGGREGATE measurement
              BY [factory_id, product_id]
              INTO activity
              AGG_SUM(value) AS value
              AGG_COUNT() AS readings
              TAKE_FIRST(unit) AS unit
              TIME_WINDOW monthly FROM time INTO time_window
            """);

        var aggregate = assertInstanceOf(Statement.Aggregate.class, statement);
        assertEquals("measurement", aggregate.sourceLabel());
        assertThat(aggregate.groupBy()).containsExactly("factory_id", "product_id");
        assertEquals("activity", aggregate.targetLabel());
        assertThat(aggregate.aggregations()).containsExactly(
            AggregationClause.of(AggregateFunction.SUM, "value", "value"),
            AggregationClause.withoutField(AggregateFunction.COUNT, "readings"),
            AggregationClause.of(AggregateFunction.FIRST, "unit", "unit"));
        assertEquals(Optional.of(new TimeWindow("monthly", "time", "time_window")), aggregate.timeWindow());
    }

    @Test
    void parse_aggregateWithoutClauses_isValid() {
        var aggregate = (Statement.Aggregate) single("AGGREGATE measurement BY [product_id] INTO product_group");

        assertTrue(aggregate.aggregations().isEmpty());
        assertTrue(aggregate.timeWindow().isEmpty());
    }

    @Test
    void parse_unitConvert_acceptsIdentifierOrStringUnits() {
        var statement = single("UNIT_CONVERT activity.value FROM unit TO \"kwh\" USING \"conv_table.csv\"");

        assertEquals(new Statement.UnitConvert("activity", "value", "unit", "kwh", "conv_table.csv"), statement);
    }

    @Test
    void parse_enrich_capturesOutputExpressions() {
        var statement = single("""
            ENRICH activity WITH emission_factor
              MATCH ON fuel
              OUTPUT emission AS {
                id: "em_" + activity.id,
                scope: emission_factor.scope
              }
            """);

        var enrich = assertInstanceOf(Statement.Enrich.class, statement);
        assertEquals("activity", enrich.sourceLabel());
        assertEquals("emission_factor", enrich.factorTable());
        assertEquals("fuel", enrich.matchKey());
        assertEquals("emission", enrich.targetLabel());
        assertThat(enrich.outputFields().keySet()).containsExactly("id", "scope");
        assertEquals(new Expression.Concatenation(List.of(new Expression.StringLiteral("em_"),
                                                          new Expression.Identifier("activity.id"))),
                     enrich.outputFields().get("id"));
        assertEquals(new Expression.Identifier("emission_factor.scope"), enrich.outputFields().get("scope"));
    }

    @Test
    void parse_compute_singleGroupKey() {
        var statement = single("""
            COMPUTE total_emission
              FOR emission
              GROUP BY scope
              INTO ghg_report
              AS sum(value)
            """);

        assertEquals(new Statement.Compute("total_emission",
                                           "emission",
                                           List.of("scope"),
                                           "ghg_report",
                                           new Expression.FunctionCall("sum", "value")),
                     statement);
    }

    @Test
    void parse_compute_bracketedGroupKeys() {
        var compute = (Statement.Compute) single("COMPUTE t FOR e GROUP BY [scope, year] INTO r AS sum(value)");

        assertThat(compute.groupBy()).containsExactly("scope", "year");
    }

    @Test
    void parse_validate_capturesRuleName() {
        var statement = single("VALIDATE ghg_report WITH \"total_equals_sum\"");

        assertEquals(new Statement.Validate("ghg_report", "total_equals_sum"), statement);
    }

    @Test
    void parse_multipleStatements_keepSourceOrder() {
        var program = DslParser.parse("""
            VALIDATE a WITH "r1"
            LOAD_CSV "x.csv" AS b
            VALIDATE c WITH "r2"
            """);

        assertThat(program.statements()).hasSize(3);
        assertInstanceOf(Statement.Validate.class, program.statements().get(0));
        assertInstanceOf(Statement.Load.class, program.statements().get(1));
        assertEquals("c", ((Statement.Validate) program.statements().get(2)).nodeLabel());
    }

    @Test
    void parse_sameSourceTwice_producesEqualTrees() {
        var source = """
            AGGREGATE m BY [a] INTO t AGG_SUM(v) AS v
            ENRICH t WITH f MATCH ON a OUTPUT o AS { x: "p" + t.a, y: 2 * t.v }
            """;

        assertEquals(DslParser.parse(source), DslParser.parse(source));
    }

    // === Expressions ===

    @Test
    void expression_stringPlusString_isConcatenation() {
        var expression = computeExpression("\"a\" + \"b\"");

        assertEquals(new Expression.Concatenation(List.of(new Expression.StringLiteral("a"),
                                                          new Expression.StringLiteral("b"))),
                     expression);
    }

    @Test
    void expression_numberPlusNumber_isBinaryOp() {
        var expression = computeExpression("1 + 2");

        assertEquals(new Expression.BinaryOp(Expression.NumberLiteral.integral(1),
                                             Expression.Operator.PLUS,
                                             Expression.NumberLiteral.integral(2)),
                     expression);
    }

    @Test
    void expression_multiplicationBindsTighterThanAddition() {
        var expression = computeExpression("1 + 2 * 3");

        var sum = assertInstanceOf(Expression.BinaryOp.class, expression);
        assertEquals(Expression.Operator.PLUS, sum.operator());
        var product = assertInstanceOf(Expression.BinaryOp.class, sum.right());
        assertEquals(Expression.Operator.MULTIPLY, product.operator());
    }

    @Test
    void expression_sameLevelOperators_associateLeft() {
        var expression = computeExpression("8 / 4 / 2");

        var outer = assertInstanceOf(Expression.BinaryOp.class, expression);
        assertEquals(Expression.NumberLiteral.integral(2), outer.right());
        assertInstanceOf(Expression.BinaryOp.class, outer.left());
    }

    @Test
    void expression_subtractionOfIdentifiers_isBinaryOp() {
        var expression = computeExpression("a - b");

        assertEquals(new Expression.BinaryOp(new Expression.Identifier("a"),
                                             Expression.Operator.MINUS,
                                             new Expression.Identifier("b")),
                     expression);
    }

    @Test
    void expression_identifierPlusIdentifier_isConcatenation() {
        var expression = computeExpression("activity.site + \"-\" + activity.id");

        var concatenation = assertInstanceOf(Expression.Concatenation.class, expression);
        assertThat(concatenation.parts()).containsExactly(new Expression.Identifier("activity.site"),
                                                          new Expression.StringLiteral("-"),
                                                          new Expression.Identifier("activity.id"));
    }

    @Test
    void expression_numberPlusIdentifier_isArithmetic() {
        var expression = computeExpression("1 + a");

        assertEquals(new Expression.BinaryOp(Expression.NumberLiteral.integral(1),
                                             Expression.Operator.PLUS,
                                             new Expression.Identifier("a")),
                     expression);
    }

    @Test
    void expression_functionCall_takesSingleIdentifierArgument() {
        assertEquals(new Expression.FunctionCall("avg", "value"), computeExpression("avg(value)"));
    }

    @Test
    void expression_functionCallInArithmetic() {
        var expression = computeExpression("sum(value) * 1000");

        assertEquals(new Expression.BinaryOp(new Expression.FunctionCall("sum", "value"),
                                             Expression.Operator.MULTIPLY,
                                             Expression.NumberLiteral.integral(1000)),
                     expression);
    }

    @Test
    void expression_numbers_keepIntegralAndFloatingApart() {
        var integral = (Expression.NumberLiteral) computeExpression("2");
        var floating = (Expression.NumberLiteral) computeExpression("2.0");

        assertFalse(integral.isFloating());
        assertEquals(2L, integral.value());
        assertTrue(floating.isFloating());
        assertEquals(2.0, floating.value());
    }

    @Test
    void expression_hugeInteger_keptExactly() {
        var number = (Expression.NumberLiteral) computeExpression("123456789012345678901234567890");

        assertEquals(new BigInteger("123456789012345678901234567890"), number.value());
    }

    // === Errors ===

    @Test
    void parse_unknownLeadingToken_failsWithStatementKeywords() {
        var error = assertThrows(SyntaxError.class, () -> DslParser.parse("MATCH x"));

        assertEquals(TokenKind.MATCH, error.actual());
        assertEquals(TokenKind.STATEMENT_KEYWORDS, error.expected());
        assertEquals(1, error.line());
        assertEquals(1, error.column());
    }

    @Test
    void parse_wrongToken_reportsExpectedAndActualKinds() {
        var error = assertThrows(SyntaxError.class,
                                 () -> DslParser.parse("LOAD_CSV \"a.csv\"\n  AS 42"));

        assertEquals(java.util.Set.of(TokenKind.IDENTIFIER), error.expected());
        assertEquals(TokenKind.NUMBER, error.actual());
        assertEquals(2, error.line());
        assertEquals(6, error.column());
        assertEquals("Expected identifier but found number at 2:6", error.getMessage());
    }

    @Test
    void parse_missingClosingBrace_failsAtEndOfInput() {
        var error = assertThrows(SyntaxError.class,
                                 () -> DslParser.parse("LOAD_CSV \"a.csv\" AS m MAP_COLUMNS { a -> b"));

        assertEquals(TokenKind.END_OF_INPUT, error.actual());
        assertEquals(java.util.Set.of(TokenKind.IDENTIFIER), error.expected());
    }

    @Test
    void parse_valueLiteral_rejectsNumbers() {
        var error = assertThrows(SyntaxError.class,
                                 () -> DslParser.parse("UNIT_CONVERT a.v FROM 1 TO kwh USING \"t.csv\""));

        assertEquals(java.util.Set.of(TokenKind.IDENTIFIER, TokenKind.STRING), error.expected());
        assertEquals(TokenKind.NUMBER, error.actual());
    }

    @Test
    void parse_concatenationFollowedByNumber_isRejected() {
        var error = assertThrows(SyntaxError.class, () -> computeExpression("\"x\" + 1"));

        assertEquals(java.util.Set.of(TokenKind.IDENTIFIER, TokenKind.STRING), error.expected());
        assertEquals(TokenKind.NUMBER, error.actual());
    }

    @Test
    void parse_functionCallWithDottedArgument_isRejected() {
        var error = assertThrows(SyntaxError.class, () -> computeExpression("sum(e.value)"));

        assertEquals(TokenKind.DOT, error.actual());
        assertEquals(java.util.Set.of(TokenKind.RPAREN), error.expected());
    }

    @Test
    void parse_tokenListWithoutEndMarker_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> DslParser.parse(List.<DslToken>of()));
    }
}
