package com.stockpulse.model;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;

/**
 * A detected price pattern. {@code anchorDate} is the date the pattern is attributed to when correlating.
 */
public record TechnicalPattern(
        String id,
        PatternKind kind,
        LocalDate startDate,
        LocalDate anchorDate,
        LocalDate endDate,
        Direction direction,
        double magnitude,
        String note
) {
    public TechnicalPattern {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(anchorDate, "anchorDate");
        Objects.requireNonNull(direction, "direction");
        startDate = startDate == null ? anchorDate : startDate;
        endDate = endDate == null ? anchorDate : endDate;
        note = note == null ? "" : note;
        id = id == null || id.isBlank() ? idOf(kind, direction, anchorDate) : id;
    }

    public static TechnicalPattern of(
            PatternKind kind,
            LocalDate startDate,
            LocalDate anchorDate,
            LocalDate endDate,
            Direction direction,
            double magnitude,
            String note
    ) {
        return new TechnicalPattern(null, kind, startDate, anchorDate, endDate, direction, magnitude, note);
    }

    public String label() {
        if (kind == PatternKind.BREAKOUT || kind == PatternKind.REVERSAL) {
            String dir = direction.name().charAt(0) + direction.name().substring(1).toLowerCase(Locale.ROOT);
            return dir + " " + kind.label().toLowerCase(Locale.ROOT);
        }
        return kind.label();
    }

    private static String idOf(PatternKind kind, Direction direction, LocalDate anchorDate) {
        return kind.name().toLowerCase(Locale.ROOT)
                + ":" + direction.name().toLowerCase(Locale.ROOT)
                + "@" + anchorDate;
    }
}
