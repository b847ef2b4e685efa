package com.example.stockcast.domain;

import java.time.LocalDate;
import java.util.List;

/**
 * Forecast produced by one model: a dated price path with a confidence band.
 * All four lists have the same length and dates are strictly increasing.
 */
public record ForecastSet(
        ForecastModel model,
        List<LocalDate> dates,
        List<Double> predictedPrices,
        List<Double> lowerBounds,
        List<Double> upperBounds
) {
    public ForecastSet {
        if (model == null) throw new IllegalArgumentException("forecast model must not be null");
        dates = List.copyOf(dates);
        predictedPrices = List.copyOf(predictedPrices);
        lowerBounds = List.copyOf(lowerBounds);
        upperBounds = List.copyOf(upperBounds);
        int n = dates.size();
        if (predictedPrices.size() != n || lowerBounds.size() != n || upperBounds.size() != n) {
            throw new IllegalArgumentException("forecast arrays for " + model.id() + " differ in length");
        }
        for (int i = 1; i < n; i++) {
            if (!dates.get(i).isAfter(dates.get(i - 1))) {
                throw new IllegalArgumentException("forecast dates for " + model.id() + " are not strictly increasing at " + dates.get(i));
            }
        }
    }

    public int size() {
        return dates.size();
    }

    /**
     * Change from the first to the last predicted price, in percent of the first.
     * Zero for an empty forecast or a zero starting price.
     */
    public double predictedChangePercent() {
        if (predictedPrices.isEmpty()) return 0.0;
        double first = predictedPrices.get(0);
        double last = predictedPrices.get(predictedPrices.size() - 1);
        return first == 0.0 ? 0.0 : (last - first) / first * 100.0;
    }

    // Mean of (upper - lower) / predicted over all points, in percent; zero prices are skipped
    public double averageBandWidthPercent() {
        double sum = 0.0;
        int counted = 0;
        for (int i = 0; i < predictedPrices.size(); i++) {
            double price = predictedPrices.get(i);
            if (price == 0.0) continue;
            sum += (upperBounds.get(i) - lowerBounds.get(i)) / price * 100.0;
            counted++;
        }
        return counted == 0 ? 0.0 : sum / counted;
    }
}
