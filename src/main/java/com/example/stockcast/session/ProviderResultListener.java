package com.example.stockcast.session;

import com.example.stockcast.domain.ForecastModel;

@FunctionalInterface
public interface ProviderResultListener {

    void onProviderResult(ForecastModel model, long generation, ProviderResult result);
}
