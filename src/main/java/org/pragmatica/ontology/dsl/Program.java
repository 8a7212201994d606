package org.pragmatica.ontology.dsl;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A parsed DSL program: statements in source order.
 */
public record Program(List<Statement> statements) {
    public Program {
        statements = ImmutableList.copyOf(statements);
    }

    public int size() {
        return statements.size();
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }
}
