package com.example.stockcast.marketdata;

import com.example.stockcast.domain.HistoricalBar;
import com.example.stockcast.domain.HistoricalSeries;
import com.example.stockcast.domain.InstrumentInfo;

/**
 * Abstraction for a component that serves price history and quote data for a symbol.
 * Calls are blocking; callers decide which thread they run on.
 */
public interface MarketDataProvider {
    /**
     * Returns the bars of {@code symbol} over {@code period} (e.g. 1y, 6mo) sampled at {@code interval} (e.g. 1d).
     *
     * @throws HistoricalDataException when the upstream call fails or returns no usable bars
     */
    HistoricalSeries getHistory(String symbol, String period, String interval);

    /**
     * Returns the most recent intraday bar of the current session, used to derive live ticks.
     *
     * @throws HistoricalDataException when no bar is available
     */
    HistoricalBar getLatestBar(String symbol);

    /**
     * Returns a quote summary for the instrument detail panel.
     *
     * @throws HistoricalDataException when the quote cannot be fetched
     */
    InstrumentInfo getInfo(String symbol);
}
