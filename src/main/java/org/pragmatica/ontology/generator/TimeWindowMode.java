package org.pragmatica.ontology.generator;

import java.util.Arrays;
import java.util.Locale;

/**
 * Truncation templates for {@code TIME_WINDOW} modes. Modes match case-insensitively in
 * adjective or noun form; anything unrecognised is treated as monthly.
 */
public enum TimeWindowMode {
    MONTH("monthly", "month", "date"),
    DAY("daily", "day", "date"),
    YEAR("yearly", "year", "date"),
    WEEK("weekly", "week", "date"),
    HOUR("hourly", "hour", "datetime");

    private final String adjective;
    private final String unit;
    private final String function;

    TimeWindowMode(String adjective, String unit, String function) {
        this.adjective = adjective;
        this.unit = unit;
        this.function = function;
    }

    public static TimeWindowMode fromMode(String mode) {
        var normalized = mode.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                     .filter(m -> m.adjective.equals(normalized) || m.unit.equals(normalized))
                     .findFirst()
                     .orElse(MONTH);
    }

    /**
     * Truncation expression over an already-rendered field reference.
     */
    public String truncate(String fieldExpression) {
        return function + ".truncate('" + unit + "', datetime(" + fieldExpression + "))";
    }
}
