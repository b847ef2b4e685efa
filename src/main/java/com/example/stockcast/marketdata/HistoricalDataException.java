package com.example.stockcast.marketdata;

/**
 * Raised when price history or quote data cannot be obtained for a symbol.
 */
public class HistoricalDataException extends RuntimeException {
    private final String symbol;

    public HistoricalDataException(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public HistoricalDataException(String symbol, String message, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
