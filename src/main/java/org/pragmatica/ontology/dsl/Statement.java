package org.pragmatica.ontology.dsl;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Top-level DSL statements. All collections are immutable and keep declaration order.
 */
public sealed interface Statement {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitLoad(Load load);

        R visitNormalize(Normalize normalize);

        R visitAggregate(Aggregate aggregate);

        R visitUnitConvert(UnitConvert unitConvert);

        R visitEnrich(Enrich enrich);

        R visitCompute(Compute compute);

        R visitValidate(Validate validate);
    }

    /**
     * {@code LOAD_CSV "level1.csv" AS measurement MAP_COLUMNS { factory -> factory_id }}
     *
     * @param columnMap source column to target field
     */
    record Load(String path, String nodeLabel, Map<String, String> columnMap) implements Statement {
        public Load {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(nodeLabel, "nodeLabel");
            columnMap = ImmutableMap.copyOf(columnMap);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLoad(this);
        }
    }

    /**
     * {@code NORMALIZE measurement { fuel: { "gass": "gas" } }}
     *
     * @param normalizations property name to (old value to new value)
     */
    record Normalize(String nodeLabel, Map<String, Map<String, String>> normalizations) implements Statement {
        public Normalize {
            Objects.requireNonNull(nodeLabel, "nodeLabel");
            var builder = ImmutableMap.<String, Map<String, String>>builder();
            normalizations.forEach((property, values) -> builder.put(property, ImmutableMap.copyOf(values)));
            normalizations = builder.build();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNormalize(this);
        }
    }

    /**
     * {@code AGGREGATE measurement BY [factory_id] INTO activity AGG_SUM(value) AS value ...}
     */
    record Aggregate(String sourceLabel,
                     List<String> groupBy,
                     String targetLabel,
                     List<AggregationClause> aggregations,
                     Optional<TimeWindow> timeWindow) implements Statement {
        public Aggregate {
            Objects.requireNonNull(sourceLabel, "sourceLabel");
            Objects.requireNonNull(targetLabel, "targetLabel");
            Objects.requireNonNull(timeWindow, "timeWindow");
            groupBy = ImmutableList.copyOf(groupBy);
            aggregations = ImmutableList.copyOf(aggregations);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAggregate(this);
        }
    }

    /**
     * {@code UNIT_CONVERT activity.value FROM unit TO "kwh" USING "conv_table.csv"}
     */
    record UnitConvert(String nodeLabel,
                       String field,
                       String fromUnit,
                       String toUnit,
                       String conversionTable) implements Statement {
        public UnitConvert {
            Objects.requireNonNull(nodeLabel, "nodeLabel");
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(fromUnit, "fromUnit");
            Objects.requireNonNull(toUnit, "toUnit");
            Objects.requireNonNull(conversionTable, "conversionTable");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnitConvert(this);
        }
    }

    /**
     * {@code ENRICH activity WITH emission_factor MATCH ON fuel OUTPUT emission AS { ... }}
     *
     * @param outputFields output field name to value expression
     */
    record Enrich(String sourceLabel,
                  String factorTable,
                  String matchKey,
                  String targetLabel,
                  Map<String, Expression> outputFields) implements Statement {
        public Enrich {
            Objects.requireNonNull(sourceLabel, "sourceLabel");
            Objects.requireNonNull(factorTable, "factorTable");
            Objects.requireNonNull(matchKey, "matchKey");
            Objects.requireNonNull(targetLabel, "targetLabel");
            outputFields = ImmutableMap.copyOf(outputFields);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEnrich(this);
        }
    }

    /**
     * {@code COMPUTE total FOR emission GROUP BY scope INTO ghg_report AS sum(value)}
     */
    record Compute(String fieldName,
                   String sourceLabel,
                   List<String> groupBy,
                   String targetLabel,
                   Expression expression) implements Statement {
        public Compute {
            Objects.requireNonNull(fieldName, "fieldName");
            Objects.requireNonNull(sourceLabel, "sourceLabel");
            Objects.requireNonNull(targetLabel, "targetLabel");
            Objects.requireNonNull(expression, "expression");
            groupBy = ImmutableList.copyOf(groupBy);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCompute(this);
        }
    }

    /**
     * {@code VALIDATE ghg_report WITH "total_equals_sum"}. The rule name is opaque.
     */
    record Validate(String nodeLabel, String ruleName) implements Statement {
        public Validate {
            Objects.requireNonNull(nodeLabel, "nodeLabel");
            Objects.requireNonNull(ruleName, "ruleName");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitValidate(this);
        }
    }
}
