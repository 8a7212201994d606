package org.pragmatica.ontology.dsl;

import java.util.Objects;
import java.util.Optional;

/**
 * One aggregation term: {@code AGG_SUM(value) AS value}, {@code AGG_COUNT() AS n}.
 */
public record AggregationClause(AggregateFunction function, Optional<String> field, String alias) {
    public AggregationClause {
        Objects.requireNonNull(function, "function");
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(alias, "alias");
    }

    public static AggregationClause of(AggregateFunction function, String field, String alias) {
        return new AggregationClause(function, Optional.of(field), alias);
    }

    public static AggregationClause withoutField(AggregateFunction function, String alias) {
        return new AggregationClause(function, Optional.empty(), alias);
    }
}
