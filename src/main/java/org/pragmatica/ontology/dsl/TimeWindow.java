package org.pragmatica.ontology.dsl;

import java.util.Objects;

/**
 * {@code TIME_WINDOW monthly FROM time INTO time_window}. The mode is kept as written;
 * its interpretation belongs to the generator.
 */
public record TimeWindow(String mode, String sourceField, String targetField) {
    public TimeWindow {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(sourceField, "sourceField");
        Objects.requireNonNull(targetField, "targetField");
    }
}
