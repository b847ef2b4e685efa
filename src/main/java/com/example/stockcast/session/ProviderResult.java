package com.example.stockcast.session;

import com.example.stockcast.domain.ForecastSet;

/**
 * Settled outcome of one forecast provider call.
 */
public interface ProviderResult {

    boolean isSuccess();

    static ProviderResult success(ForecastSet forecast) {
        return new Success(forecast);
    }

    static ProviderResult failure(String reason) {
        return new Failure(reason, false);
    }

    static ProviderResult timeout(String reason) {
        return new Failure(reason, true);
    }

    record Success(ForecastSet forecast) implements ProviderResult {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    // timedOut separates "provider never answered" from "provider answered with an error"
    record Failure(String reason, boolean timedOut) implements ProviderResult {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
