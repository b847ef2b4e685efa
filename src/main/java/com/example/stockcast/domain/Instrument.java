package com.example.stockcast.domain;

import java.util.Objects;

/**
 * Immutable domain object representing a tradable instrument identified by its ticker symbol.
 *
 * Two instruments are equal when their symbols are equal; the display name is presentation only.
 */
public class Instrument {
    // Ticker symbol (unique id, e.g. AAPL)
    private final String symbol;
    // Human-readable name shown next to the symbol
    private final String displayName;

    public Instrument(String symbol, String displayName) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must not be blank");
        }
        this.symbol = symbol;
        this.displayName = (displayName == null || displayName.isBlank()) ? symbol : displayName;
    }

    /** @return unique ticker symbol */
    public String getSymbol() {
        return symbol;
    }

    /** @return display name, falls back to the symbol */
    public String getDisplayName() {
        return displayName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Instrument other)) return false;
        return symbol.equals(other.symbol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol);
    }

    @Override
    public String toString() {
        return symbol + " (" + displayName + ")";
    }
}
