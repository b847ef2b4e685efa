package com.example.stockcast.forecast;

import com.example.stockcast.domain.ForecastModel;
import com.example.stockcast.domain.ForecastSet;

/**
 * One forecasting model behind a blocking call. Implementations are invoked concurrently
 * for different models and must not share mutable state across calls.
 */
public interface ForecastProvider {

    ForecastModel model();

    /**
     * Predicts {@code horizonDays} trading days ahead for {@code symbol}.
     *
     * @throws ForecastProviderException when the model cannot produce a forecast
     */
    ForecastSet predict(String symbol, int horizonDays);
}
