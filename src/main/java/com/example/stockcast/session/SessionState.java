package com.example.stockcast.session;

import com.example.stockcast.domain.ForecastModel;
import com.example.stockcast.domain.ForecastSet;
import com.example.stockcast.domain.HistoricalSeries;
import com.example.stockcast.domain.Instrument;
import com.example.stockcast.domain.LiveTick;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable picture of the session published after every processed event.
 * {@code historical} is null until the current generation's history has arrived.
 */
public record SessionState(
        Instrument instrument,
        long generation,
        SessionStatus status,
        String errorDetail,
        HistoricalSeries historical,
        List<LiveTick> liveTail,
        Map<ForecastModel, ForecastSet> predictions,
        Set<ForecastModel> pendingModels,
        int providerWarnings
) {
    public SessionState {
        liveTail = List.copyOf(liveTail);
        EnumMap<ForecastModel, ForecastSet> predictionsCopy = new EnumMap<>(ForecastModel.class);
        predictionsCopy.putAll(predictions);
        predictions = Collections.unmodifiableMap(predictionsCopy);
        EnumSet<ForecastModel> pendingCopy = EnumSet.noneOf(ForecastModel.class);
        pendingCopy.addAll(pendingModels);
        pendingModels = Collections.unmodifiableSet(pendingCopy);
    }

    public static SessionState idle() {
        return new SessionState(null, 0L, SessionStatus.IDLE, null, null, List.of(), Map.of(), Set.of(), 0);
    }

    public String symbol() {
        return instrument != null ? instrument.getSymbol() : null;
    }
}
