package org.pragmatica.ontology.generator;

import org.junit.jupiter.api.Test;
import org.pragmatica.ontology.dsl.Expression;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ExpressionRendererTest {

    private static Expression.Identifier id(String name) {
        return new Expression.Identifier(name);
    }

    @Test
    void identifier_knownPrefixes_mapToQueryVariables() {
        assertEquals("a.id", ExpressionRenderer.render(id("activity.id")));
        assertEquals("a.id", ExpressionRenderer.render(id("a.id")));
        assertEquals("ef.scope", ExpressionRenderer.render(id("emission_factor.scope")));
        assertEquals("ef.scope", ExpressionRenderer.render(id("factor.scope")));
        assertEquals("e.value", ExpressionRenderer.render(id("emission.value")));
    }

    @Test
    void identifier_unknownPrefix_isKept() {
        assertEquals("site.code", ExpressionRenderer.render(id("site.code")));
    }

    @Test
    void identifier_plain_isQualifiedOnlyWithContext() {
        assertEquals("value", ExpressionRenderer.render(id("value")));
        assertEquals("e.value", ExpressionRenderer.render(id("value"), "e"));
    }

    @Test
    void identifier_dotted_ignoresContext() {
        assertEquals("ef.factor", ExpressionRenderer.render(id("emission_factor.factor"), "e"));
    }

    @Test
    void numbers_renderInDecimalForm() {
        assertEquals("42", ExpressionRenderer.render(Expression.NumberLiteral.integral(42)));
        assertEquals("0.5", ExpressionRenderer.render(Expression.NumberLiteral.floating(0.5)));
    }

    @Test
    void numbers_smallAndLargeFloating_avoidExponentNotation() {
        assertEquals("0.0001", ExpressionRenderer.render(Expression.NumberLiteral.floating(0.0001)));
        assertEquals("12345678.5", ExpressionRenderer.render(Expression.NumberLiteral.floating(12345678.5)));
        assertEquals("0.000000125", ExpressionRenderer.render(Expression.NumberLiteral.floating(1.25e-7)));
    }

    @Test
    void numbers_wholeFloating_keepFractionalDigit() {
        assertEquals("2.0", ExpressionRenderer.render(Expression.NumberLiteral.floating(2.0)));
        assertEquals("100.0", ExpressionRenderer.render(Expression.NumberLiteral.floating(100.0)));
        assertEquals("0.0", ExpressionRenderer.render(Expression.NumberLiteral.floating(0.0)));
    }

    @Test
    void binaryOp_isAlwaysParenthesized() {
        var expression = new Expression.BinaryOp(
            new Expression.BinaryOp(id("activity.value"), Expression.Operator.MULTIPLY, id("ef.factor")),
            Expression.Operator.DIVIDE,
            Expression.NumberLiteral.integral(1000));

        assertEquals("((a.value * ef.factor) / 1000)", ExpressionRenderer.render(expression));
    }

    @Test
    void binaryOp_longLeftChain_rendersWithoutRecursionLimit() {
        int terms = 50_000;
        Expression expression = Expression.NumberLiteral.integral(1);
        for (int i = 1; i < terms; i++) {
            expression = new Expression.BinaryOp(expression,
                                                 Expression.Operator.PLUS,
                                                 Expression.NumberLiteral.integral(1));
        }

        var text = ExpressionRenderer.render(expression);

        assertEquals(1 + 6 * (terms - 1), text.length());
        assertThat(text).startsWith("(".repeat(terms - 1) + "1 + 1) + 1)")
                        .endsWith(" + 1) + 1)");
    }

    @Test
    void binaryOp_nestedOnTheRight_keepsGrouping() {
        var expression = new Expression.BinaryOp(
            Expression.NumberLiteral.integral(1),
            Expression.Operator.MINUS,
            new Expression.BinaryOp(id("a"), Expression.Operator.MINUS, id("b")));

        assertEquals("(1 - (e.a - e.b))", ExpressionRenderer.render(expression, "e"));
    }

    @Test
    void functionCall_uppercasesNameAndQualifiesArgument() {
        var call = new Expression.FunctionCall("sum", "value");

        assertEquals("SUM(value)", ExpressionRenderer.render(call));
        assertEquals("SUM(e.value)", ExpressionRenderer.render(call, "e"));
    }

    @Test
    void concatenation_joinsPartsWithPlus() {
        var concatenation = new Expression.Concatenation(List.of(new Expression.StringLiteral("em_"),
                                                                 id("activity.id"),
                                                                 new Expression.StringLiteral("_"),
                                                                 id("emission_factor.scope")));

        assertEquals("'em_' + a.id + '_' + ef.scope", ExpressionRenderer.render(concatenation));
    }

    @Test
    void quote_escapesBackslashAndSingleQuote() {
        assertEquals("'plain'", ExpressionRenderer.quote("plain"));
        assertEquals("'it\\'s'", ExpressionRenderer.quote("it's"));
        assertEquals("'a\\\\b'", ExpressionRenderer.quote("a\\b"));
        assertThat(ExpressionRenderer.quote("")).isEqualTo("''");
    }

    @Test
    void aliasTable_lookup() {
        assertThat(AliasTable.forPrefix("emission_factor")).contains(AliasTable.FACTOR);
        assertThat(AliasTable.forPrefix("unknown")).isEmpty();
        assertEquals("unknown", AliasTable.resolve("unknown"));
    }

    @Test
    void timeWindowMode_matchesCaseInsensitively() {
        assertEquals(TimeWindowMode.DAY, TimeWindowMode.fromMode("Daily"));
        assertEquals(TimeWindowMode.YEAR, TimeWindowMode.fromMode("year"));
        assertEquals(TimeWindowMode.MONTH, TimeWindowMode.fromMode("quarterly"));
        assertEquals("date.truncate('week', datetime(m.t))", TimeWindowMode.WEEK.truncate("m.t"));
    }
}
