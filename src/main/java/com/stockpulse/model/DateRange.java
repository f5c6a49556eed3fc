package com.stockpulse.model;

import com.stockpulse.core.error.ConfigurationException;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Inclusive calendar date range.
 */
public record DateRange(LocalDate start, LocalDate end) {
    public DateRange {
        if (start == null || end == null) {
            throw new ConfigurationException("date_range", "start and end are required");
        }
        if (start.isAfter(end)) {
            throw new ConfigurationException("date_range", "start " + start + " is after end " + end);
        }
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }

    public long lengthDays() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
