package com.example.stockcast.domain;

import java.time.LocalDate;
import java.util.List;

/**
 * Ordered, immutable sequence of daily bars for one symbol.
 *
 * Bars must be strictly increasing by date; construction fails otherwise so every
 * consumer can rely on the ordering without re-checking it.
 */
public final class HistoricalSeries {
    private final String symbol;
    private final List<HistoricalBar> bars;

    public HistoricalSeries(String symbol, List<HistoricalBar> bars) {
        this.symbol = symbol;
        this.bars = List.copyOf(bars);
        LocalDate previous = null;
        for (HistoricalBar bar : this.bars) {
            if (previous != null && !bar.date().isAfter(previous)) {
                throw new IllegalArgumentException("bars for " + symbol + " are not strictly increasing at " + bar.date());
            }
            previous = bar.date();
        }
    }

    public static HistoricalSeries empty(String symbol) {
        return new HistoricalSeries(symbol, List.of());
    }

    public String getSymbol() {
        return symbol;
    }

    public List<HistoricalBar> getBars() {
        return bars;
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    /**
     * Trailing slice of at most {@code count} bars; the whole series when it is shorter.
     */
    public List<HistoricalBar> tail(int count) {
        if (count >= bars.size()) return bars;
        return bars.subList(bars.size() - count, bars.size());
    }
}
