package org.pragmatica.ontology.dsl;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Value expressions used by {@code ENRICH} output fields and {@code COMPUTE}.
 *
 * <p>Every variant is dispatched through {@link Visitor}, so adding a variant breaks each
 * dispatch site at compile time.
 */
public sealed interface Expression {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitIdentifier(Identifier identifier);

        R visitNumber(NumberLiteral number);

        R visitString(StringLiteral string);

        R visitBinaryOp(BinaryOp binaryOp);

        R visitFunctionCall(FunctionCall call);

        R visitConcatenation(Concatenation concatenation);
    }

    /**
     * Expressions allowed inside a concatenation chain.
     */
    sealed interface Part extends Expression permits Identifier, StringLiteral {}

    // === Terminals ===

    /**
     * Identifier, plain ({@code value}) or dotted ({@code activity.id}).
     */
    record Identifier(String name) implements Part {
        public Identifier {
            Objects.requireNonNull(name, "name");
        }

        public static Identifier dotted(String qualifier, String field) {
            return new Identifier(qualifier + "." + field);
        }

        /**
         * Prefix before the first dot, if the identifier is dotted.
         */
        public Optional<String> qualifier() {
            int dot = name.indexOf('.');
            return dot < 0
                   ? Optional.empty()
                   : Optional.of(name.substring(0, dot));
        }

        /**
         * Name after the first dot, or the whole name when not dotted.
         */
        public String field() {
            return name.substring(name.indexOf('.') + 1);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    /**
     * Numeric literal: {@link Long} (or {@link java.math.BigInteger} when too large) when written
     * without a decimal point, {@link Double} otherwise.
     */
    record NumberLiteral(java.lang.Number value) implements Expression {
        public NumberLiteral {
            Objects.requireNonNull(value, "value");
        }

        public static NumberLiteral integral(long value) {
            return new NumberLiteral(value);
        }

        public static NumberLiteral floating(double value) {
            return new NumberLiteral(value);
        }

        public boolean isFloating() {
            return value instanceof Double;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    /**
     * String literal, escapes already resolved.
     */
    record StringLiteral(String value) implements Part {
        public StringLiteral {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    // === Composites ===

    /**
     * Arithmetic: left op right.
     */
    record BinaryOp(Expression left, Operator operator, Expression right) implements Expression {
        public BinaryOp {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryOp(this);
        }
    }

    /**
     * Function applied to one identifier argument: {@code sum(value)}.
     */
    record FunctionCall(String functionName, String argument) implements Expression {
        public FunctionCall {
            Objects.requireNonNull(functionName, "functionName");
            Objects.requireNonNull(argument, "argument");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }
    }

    /**
     * String concatenation: {@code "em_" + activity.id}.
     */
    record Concatenation(List<Part> parts) implements Expression {
        public Concatenation {
            parts = ImmutableList.copyOf(parts);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConcatenation(this);
        }
    }

    enum Operator {
        PLUS("+"),
        MINUS("-"),
        MULTIPLY("*"),
        DIVIDE("/");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }
}
