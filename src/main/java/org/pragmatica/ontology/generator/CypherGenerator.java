package org.pragmatica.ontology.generator;

import org.pragmatica.ontology.dsl.AggregationClause;
import org.pragmatica.ontology.dsl.Program;
import org.pragmatica.ontology.dsl.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Generates Cypher query text from a parsed {@link Program}.
 *
 * <p>Each statement becomes one self-contained block opening with a {@code //} comment
 * naming the statement. Generation never fails for a parsed program. Unit conversion and
 * validation produce skeleton blocks only: the conversion table is never read and the
 * validation rule is never evaluated.
 */
public final class CypherGenerator implements Statement.Visitor<String> {
    private static final String FACTORY_COLUMN = "factory";
    private static final String FACTORY_KEY = "factory_id";
    private static final String FIELD_SEPARATOR = ",\n";
    private static final String INDENT = "  ";

    // Variables bound by the generated clauses
    private static final String ROW = "row";
    private static final String LOADED = "m";
    private static final String FACTORY = "f";
    private static final String AGGREGATED = "a";
    private static final String NODE = "n";
    private static final String COMPUTE_SOURCE = "e";
    private static final String COMPUTE_TARGET = "g";

    private final CompilerConfig config;

    private CypherGenerator(CompilerConfig config) {
        this.config = config;
    }

    public static CypherGenerator create() {
        return new CypherGenerator(CompilerConfig.DEFAULT);
    }

    public static CypherGenerator create(CompilerConfig config) {
        return new CypherGenerator(Objects.requireNonNull(config, "config"));
    }

    /**
     * Generate the whole program: one block per statement, joined by the configured separator.
     */
    public String generate(Program program) {
        return String.join(config.blockSeparator(), generateBlocks(program));
    }

    /**
     * Generate one block per statement, in statement order.
     */
    public List<String> generateBlocks(Program program) {
        return program.statements()
                      .stream()
                      .map(this::generate)
                      .toList();
    }

    public String generate(Statement statement) {
        return statement.accept(this);
    }

    // LOAD_CSV

    @Override
    public String visitLoad(Statement.Load load) {
        var lines = new ArrayList<String>();
        lines.add("// LOAD_CSV: " + load.path() + " AS " + load.nodeLabel());
        lines.add("LOAD CSV WITH HEADERS FROM \"" + config.csvLocationPrefix() + load.path() + "\" AS " + ROW);
        lines.add("WITH " + ROW);

        boolean atFactory = mentionsFactory(load);
        if (atFactory) {
            lines.add("MERGE (" + FACTORY + ":factory { id: " + ROW + "." + FACTORY_COLUMN + " })");
        }

        var fields = load.columnMap()
                         .entrySet()
                         .stream()
                         .map(entry -> INDENT + entry.getValue() + ": " + ROW + "." + entry.getKey())
                         .collect(Collectors.joining(FIELD_SEPARATOR));
        lines.add("CREATE (" + LOADED + ":" + load.nodeLabel() + " {");
        lines.add(fields);
        lines.add("})");

        lines.add(atFactory
                  ? "MERGE (" + LOADED + ")-[:AT_FACTORY]->(" + FACTORY + ");"
                  : ";");
        return String.join("\n", lines);
    }

    /**
     * Loaded rows belong to a factory when a column named {@code factory} is read, or some
     * column is mapped onto {@code factory_id}.
     */
    private static boolean mentionsFactory(Statement.Load load) {
        return load.columnMap().containsKey(FACTORY_COLUMN)
               || load.columnMap().containsValue(FACTORY_KEY);
    }

    // NORMALIZE

    @Override
    public String visitNormalize(Statement.Normalize normalize) {
        var blocks = new ArrayList<String>();
        blocks.add("// NORMALIZE: " + normalize.nodeLabel());
        normalize.normalizations()
                 .forEach((property, mappings) -> mappings.forEach((oldValue, newValue) -> {
                     var reference = NODE + "." + property;
                     blocks.add(String.join("\n",
                                            "MATCH (" + NODE + ":" + normalize.nodeLabel() + ")",
                                            "WHERE " + reference + " = " + ExpressionRenderer.quote(oldValue),
                                            "SET " + reference + " = " + ExpressionRenderer.quote(newValue) + ";"));
                 }));
        // header directly above the first update, updates separated by a blank line
        if (blocks.size() == 1) {
            return blocks.get(0);
        }
        return blocks.get(0) + "\n" + String.join("\n\n", blocks.subList(1, blocks.size()));
    }

    // AGGREGATE

    @Override
    public String visitAggregate(Statement.Aggregate aggregate) {
        var lines = new ArrayList<String>();
        lines.add("// AGGREGATE: " + aggregate.sourceLabel() + " -> " + aggregate.targetLabel());
        lines.add("MATCH (" + LOADED + ":" + aggregate.sourceLabel() + ")");

        var projections = new ArrayList<String>();
        for (var key : aggregate.groupBy()) {
            projections.add(INDENT + LOADED + "." + key + " AS " + key);
        }
        aggregate.timeWindow()
                 .ifPresent(window -> projections.add(INDENT
                                                      + TimeWindowMode.fromMode(window.mode())
                                                                      .truncate(LOADED + "." + window.sourceField())
                                                      + " AS " + window.targetField()));
        for (var clause : aggregate.aggregations()) {
            projections.add(INDENT + aggregationTerm(clause) + " AS " + clause.alias());
        }
        lines.add("WITH");
        lines.add(String.join(FIELD_SEPARATOR, projections));

        var fields = new ArrayList<String>();
        for (var key : aggregate.groupBy()) {
            fields.add(INDENT + key + ": " + key);
        }
        for (var clause : aggregate.aggregations()) {
            fields.add(INDENT + clause.alias() + ": " + clause.alias());
        }
        aggregate.timeWindow()
                 .ifPresent(window -> fields.add(INDENT + window.targetField() + ": " + window.targetField()));
        lines.add("CREATE (" + AGGREGATED + ":" + aggregate.targetLabel() + " {");
        lines.add(String.join(FIELD_SEPARATOR, fields));
        lines.add("})");

        if (aggregate.groupBy().contains(FACTORY_KEY)) {
            lines.add("WITH " + AGGREGATED);
            lines.add("MATCH (" + FACTORY + ":factory { id: " + AGGREGATED + "." + FACTORY_KEY + " })");
            lines.add("MERGE (" + AGGREGATED + ")-[:AT_FACTORY]->(" + FACTORY + ");");
        } else {
            lines.add(";");
        }
        return String.join("\n", lines);
    }

    private static String aggregationTerm(AggregationClause clause) {
        // sum and first without a field aggregate the property named like the alias
        var field = LOADED + "." + clause.field().orElse(clause.alias());
        return switch (clause.function()) {
            case SUM -> "SUM(" + field + ")";
            case COUNT -> clause.field().isPresent()
                          ? "COUNT(" + field + ")"
                          : "COUNT(*)";
            case FIRST -> "COLLECT(" + field + ")[0]";
        };
    }

    // UNIT_CONVERT

    @Override
    public String visitUnitConvert(Statement.UnitConvert convert) {
        var value = NODE + "." + convert.field();
        return String.join("\n",
                           "// UNIT_CONVERT: " + convert.nodeLabel() + "." + convert.field()
                           + " FROM " + convert.fromUnit() + " TO " + convert.toUnit(),
                           "// Note: Load conversion factors from " + convert.conversionTable(),
                           "// This is a placeholder - actual implementation requires loading the conversion table",
                           "MATCH (" + NODE + ":" + convert.nodeLabel() + ")",
                           "WHERE " + NODE + ".unit = " + ExpressionRenderer.quote(convert.fromUnit()),
                           "// MERGE with conversion factor table here",
                           "// SET " + value + " = " + value + " * conversion_factor",
                           "SET " + NODE + ".unit = " + ExpressionRenderer.quote(convert.toUnit()) + ";");
    }

    // ENRICH

    @Override
    public String visitEnrich(Statement.Enrich enrich) {
        var source = AliasTable.SOURCE.variable();
        var factor = AliasTable.FACTOR.variable();
        var result = AliasTable.RESULT.variable();

        var lines = new ArrayList<String>();
        lines.add("// ENRICH: " + enrich.sourceLabel() + " WITH " + enrich.factorTable());
        lines.add("MATCH (" + source + ":" + enrich.sourceLabel() + "), (" + factor + ":" + enrich.factorTable() + ")");
        lines.add("WHERE " + source + "." + enrich.matchKey() + " = " + factor + "." + enrich.matchKey());

        var fields = enrich.outputFields()
                           .entrySet()
                           .stream()
                           .map(entry -> INDENT + entry.getKey() + ": " + ExpressionRenderer.render(entry.getValue()))
                           .collect(Collectors.joining(FIELD_SEPARATOR));
        lines.add("CREATE (" + result + ":" + enrich.targetLabel() + " {");
        lines.add(fields);
        lines.add("})");
        lines.add("MERGE (" + result + ")-[:FROM_ACTIVITY]->(" + source + ");");
        return String.join("\n", lines);
    }

    // COMPUTE

    @Override
    public String visitCompute(Statement.Compute compute) {
        var lines = new ArrayList<String>();
        lines.add("// COMPUTE: " + compute.fieldName() + " FOR " + compute.sourceLabel());
        lines.add("MATCH (" + COMPUTE_SOURCE + ":" + compute.sourceLabel() + ")");

        var projections = new ArrayList<String>();
        for (var key : compute.groupBy()) {
            projections.add(COMPUTE_SOURCE + "." + key);
        }
        projections.add(ExpressionRenderer.render(compute.expression(), COMPUTE_SOURCE) + " AS " + compute.fieldName());
        lines.add("WITH " + String.join(", ", projections));

        // the merge key is the first group-by field only
        if (compute.groupBy().isEmpty()) {
            lines.add("MERGE (" + COMPUTE_TARGET + ":" + compute.targetLabel() + ")");
        } else {
            var key = compute.groupBy().get(0);
            lines.add("MERGE (" + COMPUTE_TARGET + ":" + compute.targetLabel()
                      + " { " + key + ": " + COMPUTE_SOURCE + "." + key + " })");
        }
        lines.add("SET " + COMPUTE_TARGET + "." + compute.fieldName() + " = " + compute.fieldName() + ";");
        return String.join("\n", lines);
    }

    // VALIDATE

    @Override
    public String visitValidate(Statement.Validate validate) {
        return String.join("\n",
                           "// VALIDATE: " + validate.nodeLabel() + " WITH " + validate.ruleName(),
                           "// Validation rule: " + validate.ruleName(),
                           "MATCH (" + NODE + ":" + validate.nodeLabel() + ")",
                           "// Add validation logic based on rule: " + validate.ruleName(),
                           "RETURN " + NODE + ";");
    }
}
