package com.example.stockcast.marketdata;

/**
 * Push channel delivering live ticks per symbol. Ticks for one symbol reach its listener
 * in order, possibly more than once.
 */
public interface LiveFeed {
    /**
     * Starts delivering ticks for {@code symbol} to {@code listener}, replacing any listener
     * previously registered for the same symbol.
     *
     * @throws LiveFeedException when the subscription cannot be established
     */
    void subscribe(String symbol, LiveFeedListener listener);

    /**
     * Stops delivery for {@code symbol}. Unknown symbols are ignored.
     */
    void unsubscribe(String symbol);
}
