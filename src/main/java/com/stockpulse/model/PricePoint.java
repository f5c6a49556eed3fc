package com.stockpulse.model;

import java.time.LocalDate;

/** Daily OHLCV bar. */
public record PricePoint(
        LocalDate date,
        double open,
        double high,
        double low,
        double close,
        double volume
) {
}
