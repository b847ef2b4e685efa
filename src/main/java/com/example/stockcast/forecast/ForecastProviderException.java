package com.example.stockcast.forecast;

import com.example.stockcast.domain.ForecastModel;

/**
 * A single provider failed to produce a forecast. Never fatal on its own.
 */
public class ForecastProviderException extends RuntimeException {
    private final ForecastModel model;

    public ForecastProviderException(ForecastModel model, String message) {
        super(message);
        this.model = model;
    }

    public ForecastProviderException(ForecastModel model, String message, Throwable cause) {
        super(message, cause);
        this.model = model;
    }

    public ForecastModel getModel() {
        return model;
    }
}
