package org.pragmatica.ontology.generator;

import org.pragmatica.ontology.dsl.Expression;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Renders DSL expressions as Cypher expression text.
 *
 * <p>Dotted identifiers go through {@link AliasTable}. When a context variable is given,
 * plain identifiers and function arguments are qualified with it.
 */
public final class ExpressionRenderer implements Expression.Visitor<String> {
    private static final String CONCATENATION_OPERATOR = " + ";

    private final Optional<String> contextVariable;

    private ExpressionRenderer(Optional<String> contextVariable) {
        this.contextVariable = contextVariable;
    }

    public static String render(Expression expression) {
        return expression.accept(new ExpressionRenderer(Optional.empty()));
    }

    public static String render(Expression expression, String contextVariable) {
        Objects.requireNonNull(contextVariable, "contextVariable");
        return expression.accept(new ExpressionRenderer(Optional.of(contextVariable)));
    }

    /**
     * Single-quoted Cypher string literal.
     */
    public static String quote(String value) {
        return "'" + value.replace("\\", "\\\\")
                          .replace("'", "\\'") + "'";
    }

    @Override
    public String visitIdentifier(Expression.Identifier identifier) {
        return identifier.qualifier()
                         .map(prefix -> AliasTable.resolve(prefix) + "." + identifier.field())
                         .orElseGet(() -> qualify(identifier.name()));
    }

    @Override
    public String visitNumber(Expression.NumberLiteral number) {
        if (number.value() instanceof Double value && Double.isFinite(value)) {
            return plainDecimal(value);
        }
        return String.valueOf(number.value());
    }

    @Override
    public String visitString(Expression.StringLiteral string) {
        return quote(string.value());
    }

    /**
     * Every operation is parenthesized. The left spine of a chain such as {@code a + b + c}
     * is walked in a loop, so chain length is not bounded by stack depth.
     */
    @Override
    public String visitBinaryOp(Expression.BinaryOp binaryOp) {
        var chain = new ArrayDeque<Expression.BinaryOp>();
        Expression leftmost = binaryOp;
        while (leftmost instanceof Expression.BinaryOp op) {
            chain.push(op);
            leftmost = op.left();
        }

        var sb = new StringBuilder();
        sb.append("(".repeat(chain.size()))
          .append(leftmost.accept(this));
        while (!chain.isEmpty()) {
            var op = chain.pop();
            sb.append(" ")
              .append(op.operator().symbol())
              .append(" ")
              .append(op.right().accept(this))
              .append(")");
        }
        return sb.toString();
    }

    @Override
    public String visitFunctionCall(Expression.FunctionCall call) {
        var argument = new Expression.Identifier(call.argument()).accept(this);
        return call.functionName().toUpperCase(Locale.ROOT) + "(" + argument + ")";
    }

    @Override
    public String visitConcatenation(Expression.Concatenation concatenation) {
        return concatenation.parts()
                            .stream()
                            .map(part -> part.accept(this))
                            .collect(Collectors.joining(CONCATENATION_OPERATOR));
    }

    // decimal notation with at least one fractional digit: 0.0001, 12345678.5, 2.0
    private static String plainDecimal(double value) {
        var text = BigDecimal.valueOf(value)
                             .stripTrailingZeros()
                             .toPlainString();
        return text.indexOf('.') < 0
               ? text + ".0"
               : text;
    }

    private String qualify(String name) {
        return contextVariable.map(variable -> variable + "." + name)
                              .orElse(name);
    }
}
