package com.example.stockcast.api.dto;

import com.example.stockcast.domain.ForecastModel;
import com.example.stockcast.domain.ForecastSet;
import com.example.stockcast.session.SessionState;
import com.example.stockcast.session.SessionStatus;
import jakarta.validation.constraints.NotBlank;

import java.time.LocalDate;
import java.util.List;

public class SessionDtos {
    // Body of POST /api/session/select
    public record SelectRequest(
            @NotBlank String symbol
    ) {}

    // Public view of the session, also pushed over the status event stream
    public record SessionStatusResponse(
            String symbol,
            String displayName,
            long generation,
            SessionStatus status,
            String errorDetail,
            List<String> availableModels,
            List<String> pendingModels,
            int providerWarnings,
            int historicalPoints,
            int liveTicks
    ) {
        public static SessionStatusResponse from(SessionState state) {
            return new SessionStatusResponse(
                    state.symbol(),
                    state.instrument() != null ? state.instrument().getDisplayName() : null,
                    state.generation(),
                    state.status(),
                    state.errorDetail(),
                    state.predictions().keySet().stream().map(ForecastModel::id).toList(),
                    state.pendingModels().stream().map(ForecastModel::id).toList(),
                    state.providerWarnings(),
                    state.historical() != null ? state.historical().size() : 0,
                    state.liveTail().size()
            );
        }
    }

    // One model's forecast with the comparison figures shown next to it
    public record ForecastResponse(
            String model,
            List<LocalDate> dates,
            List<Double> predictedPrices,
            List<Double> lowerBounds,
            List<Double> upperBounds,
            double predictedChangePercent,
            double averageBandWidthPercent
    ) {
        public static ForecastResponse from(ForecastSet forecast) {
            return new ForecastResponse(
                    forecast.model().id(),
                    forecast.dates(),
                    forecast.predictedPrices(),
                    forecast.lowerBounds(),
                    forecast.upperBounds(),
                    forecast.predictedChangePercent(),
                    forecast.averageBandWidthPercent()
            );
        }
    }

    // Error payload shared by every endpoint
    public record ApiError(
            String error
    ) {}
}
