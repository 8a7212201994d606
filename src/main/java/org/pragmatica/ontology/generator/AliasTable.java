package org.pragmatica.ontology.generator;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed mapping from identifier prefixes to the variables bound in generated queries.
 * {@code activity.id} becomes {@code a.id}, {@code emission_factor.scope} becomes {@code ef.scope}.
 */
public enum AliasTable {
    SOURCE("a", Set.of("activity", "a")),
    FACTOR("ef", Set.of("emission_factor", "ef", "factor")),
    RESULT("e", Set.of("emission", "e"));

    private final String variable;
    private final Set<String> prefixes;

    AliasTable(String variable, Set<String> prefixes) {
        this.variable = variable;
        this.prefixes = prefixes;
    }

    public String variable() {
        return variable;
    }

    public static Optional<AliasTable> forPrefix(String prefix) {
        return Arrays.stream(values())
                     .filter(role -> role.prefixes.contains(prefix))
                     .findFirst();
    }

    /**
     * Variable for a prefix; unknown prefixes map to themselves.
     */
    public static String resolve(String prefix) {
        return forPrefix(prefix).map(AliasTable::variable)
                                .orElse(prefix);
    }
}
