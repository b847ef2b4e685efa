package com.example.stockcast.session;

import com.example.stockcast.domain.ForecastModel;
import com.example.stockcast.domain.ForecastSet;
import com.example.stockcast.domain.HistoricalBar;
import com.example.stockcast.domain.HistoricalSeries;
import com.example.stockcast.domain.LiveTick;
import com.example.stockcast.domain.LookbackWindow;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pure merge of history, live tail and one forecast into a {@link TimelineView}.
 *
 * Daily bars sit at the start of their day in the market zone. Live ticks follow in
 * arrival order whatever the lookback. A tick that does not move past the last primary
 * point is dropped, which also absorbs redelivered ticks. Forecast points are kept
 * only when they lie strictly after the last primary point.
 */
public class SeriesAssembler {
    private final ZoneId marketZone;

    public SeriesAssembler(ZoneId marketZone) {
        this.marketZone = marketZone;
    }

    public TimelineView assemble(HistoricalSeries historical,
                                 List<LiveTick> liveTail,
                                 Map<ForecastModel, ForecastSet> predictions,
                                 LookbackWindow lookback,
                                 ForecastModel selectedModel) {
        List<Instant> primaryDates = new ArrayList<>();
        List<Double> primaryPrices = new ArrayList<>();

        if (historical != null) {
            for (HistoricalBar bar : historical.tail(lookback.entries())) {
                primaryDates.add(bar.date().atStartOfDay(marketZone).toInstant());
                primaryPrices.add(bar.close());
            }
        }

        Instant last = primaryDates.isEmpty() ? null : primaryDates.get(primaryDates.size() - 1);
        for (LiveTick tick : liveTail) {
            if (last != null && !tick.timestamp().isAfter(last)) continue;
            primaryDates.add(tick.timestamp());
            primaryPrices.add(tick.price());
            last = tick.timestamp();
        }

        List<Instant> forecastDates = new ArrayList<>();
        List<Double> forecastPrices = new ArrayList<>();
        List<Double> lowerBounds = new ArrayList<>();
        List<Double> upperBounds = new ArrayList<>();

        ForecastSet forecast = selectedModel == null ? null : predictions.get(selectedModel);
        if (forecast != null) {
            for (int i = 0; i < forecast.size(); i++) {
                Instant at = forecast.dates().get(i).atStartOfDay(marketZone).toInstant();
                if (last != null && !at.isAfter(last)) continue;
                forecastDates.add(at);
                forecastPrices.add(forecast.predictedPrices().get(i));
                lowerBounds.add(forecast.lowerBounds().get(i));
                upperBounds.add(forecast.upperBounds().get(i));
            }
        }

        return new TimelineView(primaryDates, primaryPrices, forecastDates, forecastPrices, lowerBounds, upperBounds);
    }
}
