package com.humasol.followup.domain.followup;

import com.humasol.followup.domain.exceptions.InvalidFieldException;
import java.util.Locale;

/**
 * Unit in which the interval of a {@link Period} is counted.
 */
public enum TimeUnit {
    WEEK("week"),
    MONTH("month"),
    YEAR("year");

    private final String label;

    TimeUnit(String label) {
        this.label = label;
    }

    public static TimeUnit fromString(String unit) {
        if (unit == null) {
            throw InvalidFieldException.of("unit", "must be one of week, month or year");
        }
        var normalized = unit.trim().toLowerCase(Locale.ROOT);
        for (var candidate : values()) {
            if (candidate.label.equals(normalized)) {
                return candidate;
            }
        }
        throw InvalidFieldException.of("unit", "unknown time unit '" + unit + "'");
    }

    @Override
    public String toString() {
        return label;
    }
}
