package com.example.stockcast.session;

import com.example.stockcast.domain.ForecastSet;
import com.example.stockcast.forecast.ForecastProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans one forecast request per provider out to the I/O executor and reports each
 * outcome as soon as it settles.
 *
 * There is no fail-fast: a failing or slow provider never cancels or delays its
 * siblings. Nothing is retried. Every call is bounded by {@code timeout}, and a call that
 * exceeds it settles as a timed-out failure.
 */
public class PredictionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PredictionOrchestrator.class);

    private final Executor ioExecutor;
    private final Duration timeout;

    public PredictionOrchestrator(Executor ioExecutor, Duration timeout) {
        this.ioExecutor = ioExecutor;
        this.timeout = timeout;
    }

    public PredictionRun run(String symbol,
                             int horizonDays,
                             List<? extends ForecastProvider> providers,
                             long generation,
                             ProviderResultListener listener) {
        List<CompletableFuture<?>> calls = new ArrayList<>(providers.size());
        for (ForecastProvider provider : providers) {
            CompletableFuture<ForecastSet> call = CompletableFuture
                    .supplyAsync(() -> provider.predict(symbol, horizonDays), ioExecutor)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
            call.handle((forecast, error) -> settle(provider, symbol, forecast, error))
                    .thenAccept(result -> listener.onProviderResult(provider.model(), generation, result));
            calls.add(call);
        }
        log.debug("Started {} forecast calls for {} (generation {})", calls.size(), symbol, generation);
        return new PredictionRun(generation, calls);
    }

    private ProviderResult settle(ForecastProvider provider, String symbol, ForecastSet forecast, Throwable error) {
        if (error == null) {
            if (forecast == null) {
                return ProviderResult.failure(provider.model().id() + " returned no forecast for " + symbol);
            }
            return ProviderResult.success(forecast);
        }
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            return ProviderResult.timeout(provider.model().id() + " timed out after " + timeout.toMillis() + " ms for " + symbol);
        }
        if (cause instanceof CancellationException) {
            return ProviderResult.failure(provider.model().id() + " call for " + symbol + " was cancelled");
        }
        return ProviderResult.failure(cause.getMessage() != null ? cause.getMessage() : cause.toString());
    }

    static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
