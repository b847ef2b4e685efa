package com.example.stockcast.domain;

/**
 * Quote summary for the instrument detail panel. Missing upstream fields are zero.
 */
public record InstrumentInfo(
        String symbol,
        String name,
        String currency,
        double currentPrice,
        double previousClose,
        double open,
        double dayHigh,
        double dayLow,
        double fiftyTwoWeekHigh,
        double fiftyTwoWeekLow,
        long volume,
        long averageVolume,
        double marketCap,
        double trailingPE,
        double forwardPE,
        double dividendYield
) {}
