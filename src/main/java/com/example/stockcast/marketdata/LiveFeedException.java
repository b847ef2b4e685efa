package com.example.stockcast.marketdata;

/**
 * Subscription or transport failure of the live feed.
 */
public class LiveFeedException extends RuntimeException {
    private final String symbol;

    public LiveFeedException(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public LiveFeedException(String symbol, String message, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
