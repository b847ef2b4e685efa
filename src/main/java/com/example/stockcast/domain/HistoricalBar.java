package com.example.stockcast.domain;

import java.time.LocalDate;

/**
 * One daily OHLCV bar.
 */
public record HistoricalBar(
        LocalDate date,
        double open,
        double high,
        double low,
        double close,
        long volume
) {
    public HistoricalBar {
        if (date == null) throw new IllegalArgumentException("bar date must not be null");
    }
}
