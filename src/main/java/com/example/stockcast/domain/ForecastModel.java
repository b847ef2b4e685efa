package com.example.stockcast.domain;

import java.util.Locale;

/**
 * Forecast models known to the system. The wire id is what remote providers and REST
 * clients use; parsing never falls back to a default model.
 */
public enum ForecastModel {
    ARIMA("arima"),
    PROPHET("prophet"),
    ML("ml");

    private final String id;

    ForecastModel(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static ForecastModel fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (ForecastModel model : values()) {
                if (model.id.equals(normalized)) return model;
            }
        }
        throw new IllegalArgumentException("Unknown forecast model: " + id);
    }
}
