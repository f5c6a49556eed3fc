package com.stockpulse.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Daily bars sorted ascending by date with unique dates. Calendar gaps (weekends, holidays) are allowed.
 */
public final class PriceSeries {
    private static final PriceSeries EMPTY = new PriceSeries(List.of());

    private final List<PricePoint> points;

    private PriceSeries(List<PricePoint> points) {
        this.points = points;
    }

    public static PriceSeries empty() {
        return EMPTY;
    }

    /**
     * Sorts the input by date; when a date repeats, the later-supplied point wins.
     */
    public static PriceSeries of(List<PricePoint> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        TreeMap<LocalDate, PricePoint> byDate = new TreeMap<>();
        for (PricePoint point : raw) {
            if (point == null || point.date() == null) {
                continue;
            }
            byDate.put(point.date(), point);
        }
        if (byDate.isEmpty()) {
            return EMPTY;
        }
        return new PriceSeries(Collections.unmodifiableList(new ArrayList<>(byDate.values())));
    }

    public List<PricePoint> points() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public PricePoint get(int index) {
        return points.get(index);
    }

    public double[] closes() {
        double[] out = new double[points.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = points.get(i).close();
        }
        return out;
    }

    public PriceSeries within(DateRange range) {
        List<PricePoint> kept = new ArrayList<>();
        for (PricePoint point : points) {
            if (range.contains(point.date())) {
                kept.add(point);
            }
        }
        return kept.size() == points.size() ? this : of(kept);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PriceSeries other)) {
            return false;
        }
        return points.equals(other.points);
    }

    @Override
    public int hashCode() {
        return Objects.hash(points);
    }

    @Override
    public String toString() {
        if (points.isEmpty()) {
            return "PriceSeries[]";
        }
        return "PriceSeries[" + points.size() + " bars " + points.get(0).date() + ".." + points.get(points.size() - 1).date() + "]";
    }
}
