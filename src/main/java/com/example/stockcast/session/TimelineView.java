package com.example.stockcast.session;

import java.time.Instant;
import java.util.List;

/**
 * Renderable timeline: a primary price line (history then live tail) and an optional
 * forecast line with its confidence band. The bounds belong to the forecast timeline only.
 */
public record TimelineView(
        List<Instant> primaryDates,
        List<Double> primaryPrices,
        List<Instant> forecastDates,
        List<Double> forecastPrices,
        List<Double> lowerBounds,
        List<Double> upperBounds
) {
    public TimelineView {
        primaryDates = List.copyOf(primaryDates);
        primaryPrices = List.copyOf(primaryPrices);
        forecastDates = List.copyOf(forecastDates);
        forecastPrices = List.copyOf(forecastPrices);
        lowerBounds = List.copyOf(lowerBounds);
        upperBounds = List.copyOf(upperBounds);
    }

    public static TimelineView empty() {
        return new TimelineView(List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }
}
