package com.example.stockcast.forecast;

import com.example.stockcast.domain.ForecastModel;
import com.example.stockcast.domain.ForecastSet;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Forecast provider backed by the prediction service's {@code POST /api/predict} endpoint.
 * One instance serves exactly one model.
 */
public class RemoteForecastProvider implements ForecastProvider {
    private static final Logger log = LoggerFactory.getLogger(RemoteForecastProvider.class);

    static final String PREDICT_PATH = "/api/predict";

    private final ForecastModel model;
    private final RestClient http;

    public RemoteForecastProvider(ForecastModel model, RestClient http) {
        this.model = model;
        this.http = http;
    }

    @Override
    public ForecastModel model() {
        return model;
    }

    @Override
    public ForecastSet predict(String symbol, int horizonDays) {
        PredictResponse resp;
        try {
            resp = http.post()
                    .uri(PREDICT_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("symbol", symbol, "model", model.id(), "days", horizonDays))
                    .retrieve()
                    .body(PredictResponse.class);
        } catch (RestClientException e) {
            throw new ForecastProviderException(model, model.id() + " request for " + symbol + " failed: " + e.getMessage(), e);
        }
        if (resp == null) {
            throw new ForecastProviderException(model, model.id() + " returned an empty response for " + symbol);
        }
        if (!resp.success()) {
            throw new ForecastProviderException(model, model.id() + " prediction failed for " + symbol + ": " + resp.error());
        }
        if (resp.data() == null || resp.data().predictions() == null) {
            throw new ForecastProviderException(model, model.id() + " response for " + symbol + " carries no predictions");
        }
        return toForecastSet(symbol, resp.data().predictions());
    }

    private ForecastSet toForecastSet(String symbol, Predictions p) {
        if (p.dates() == null || p.predictedPrices() == null || p.lowerBounds() == null || p.upperBounds() == null) {
            throw new ForecastProviderException(model, model.id() + " response for " + symbol + " is missing forecast arrays");
        }
        int n = p.dates().size();
        if (p.predictedPrices().size() != n || p.lowerBounds().size() != n || p.upperBounds().size() != n) {
            throw new ForecastProviderException(model, model.id() + " response for " + symbol + " has arrays of unequal length");
        }
        List<LocalDate> dates = new ArrayList<>(n);
        List<Double> prices = new ArrayList<>(n);
        List<Double> lower = new ArrayList<>(n);
        List<Double> upper = new ArrayList<>(n);
        LocalDate previous = null;
        for (int i = 0; i < n; i++) {
            LocalDate date;
            try {
                date = LocalDate.parse(p.dates().get(i));
            } catch (DateTimeParseException | NullPointerException e) {
                throw new ForecastProviderException(model, model.id() + " response for " + symbol + " has a bad date at " + i, e);
            }
            Double price = p.predictedPrices().get(i);
            if (price == null || p.lowerBounds().get(i) == null || p.upperBounds().get(i) == null) {
                throw new ForecastProviderException(model, model.id() + " response for " + symbol + " has a missing value at " + i);
            }
            // Weekend skipping upstream can repeat a date; keep the first point of each date
            if (previous != null && !date.isAfter(previous)) {
                log.debug("Dropping {} point {} for {}: date {} does not advance", model.id(), i, symbol, date);
                continue;
            }
            dates.add(date);
            prices.add(price);
            lower.add(p.lowerBounds().get(i));
            upper.add(p.upperBounds().get(i));
            previous = date;
        }
        return new ForecastSet(model, dates, prices, lower, upper);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PredictResponse(boolean success, PredictData data, String error) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PredictData(String symbol, String model, Predictions predictions) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Predictions(
            List<String> dates,
            @JsonProperty("predicted_prices") List<Double> predictedPrices,
            @JsonProperty("lower_bounds") List<Double> lowerBounds,
            @JsonProperty("upper_bounds") List<Double> upperBounds
    ) {}
}
