package com.example.stockcast.session;

import com.example.stockcast.config.StockcastProperties;
import com.example.stockcast.domain.ForecastModel;
import com.example.stockcast.domain.ForecastSet;
import com.example.stockcast.domain.HistoricalSeries;
import com.example.stockcast.domain.Instrument;
import com.example.stockcast.domain.LiveTick;
import com.example.stockcast.domain.LookbackWindow;
import com.example.stockcast.forecast.ForecastProvider;
import com.example.stockcast.marketdata.LiveFeed;
import com.example.stockcast.marketdata.LiveFeedException;
import com.example.stockcast.marketdata.LiveFeedListener;
import com.example.stockcast.marketdata.MarketDataProvider;
import com.example.stockcast.session.SessionEvent.FeedFailed;
import com.example.stockcast.session.SessionEvent.HistoryFailed;
import com.example.stockcast.session.SessionEvent.HistoryLoaded;
import com.example.stockcast.session.SessionEvent.ProviderSettled;
import com.example.stockcast.session.SessionEvent.RefreshRequested;
import com.example.stockcast.session.SessionEvent.Select;
import com.example.stockcast.session.SessionEvent.TickReceived;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single owner of "which instrument is active" and of everything loaded for it.
 *
 * The session is an actor: public methods only post a {@link SessionEvent} to the
 * mailbox executor, which must run tasks one at a time in submission order. All mutable
 * fields below are touched exclusively from mailbox tasks. After each event an immutable
 * {@link SessionState} is published for readers. Status listeners are called on a
 * separate notifier executor, so a slow listener never holds up the mailbox.
 *
 * Every selection starts a new generation. History, live ticks and forecast results are
 * tagged with the generation that requested them and are dropped when it is no longer
 * current. In-flight calls are never awaited or interrupted.
 *
 * Status moves IDLE -> LOADING -> READY | ERROR and back to LOADING on the next select.
 * History and feed failures are final for a generation. A "no predictions" error can
 * still turn READY when a refreshed provider succeeds.
 */
public class InstrumentSession implements ProviderResultListener {
    private static final Logger log = LoggerFactory.getLogger(InstrumentSession.class);

    private final MarketDataProvider marketData;
    private final LiveFeed liveFeed;
    private final Map<ForecastModel, ForecastProvider> providers;
    private final PredictionOrchestrator orchestrator;
    private final SeriesAssembler assembler;
    private final Executor mailbox;
    private final Executor ioExecutor;
    private final Executor notifier;
    private final String historyPeriod;
    private final String historyInterval;
    private final Duration historyTimeout;
    private final int horizonDays;
    private final List<SessionStatusListener> listeners = new CopyOnWriteArrayList<>();

    // Mailbox-confined state
    private Instrument instrument;
    private long generation;
    private SessionStatus status = SessionStatus.IDLE;
    private String errorDetail;
    private boolean recoverableError;
    private HistoricalSeries historical;
    private final LiveUpdateBuffer liveBuffer;
    private final Map<ForecastModel, ForecastSet> predictions = new EnumMap<>(ForecastModel.class);
    // Outstanding calls per model; a refresh may overlap the model's first call
    private final Map<ForecastModel, Integer> inFlight = new EnumMap<>(ForecastModel.class);
    private int providerWarnings;
    private final List<PredictionRun> runs = new ArrayList<>();

    private volatile SessionState published = SessionState.idle();

    public InstrumentSession(MarketDataProvider marketData,
                             LiveFeed liveFeed,
                             List<? extends ForecastProvider> forecastProviders,
                             StockcastProperties properties,
                             Executor mailbox,
                             Executor ioExecutor,
                             Executor notifier) {
        this.marketData = marketData;
        this.liveFeed = liveFeed;
        this.mailbox = mailbox;
        this.ioExecutor = ioExecutor;
        this.notifier = notifier;
        this.historyPeriod = properties.history().period();
        this.historyInterval = properties.history().interval();
        this.historyTimeout = properties.history().timeout();
        this.horizonDays = properties.forecast().horizonDays();
        this.liveBuffer = new LiveUpdateBuffer(properties.live().capacity());
        this.orchestrator = new PredictionOrchestrator(ioExecutor, properties.forecast().timeout());
        this.assembler = new SeriesAssembler(properties.marketZone());

        Map<ForecastModel, ForecastProvider> byModel = new EnumMap<>(ForecastModel.class);
        for (ForecastProvider provider : forecastProviders) {
            if (byModel.put(provider.model(), provider) != null) {
                throw new IllegalArgumentException("More than one forecast provider for model " + provider.model().id());
            }
        }
        this.providers = Collections.unmodifiableMap(byModel);
    }

    // ---------------------------------------------------------------- public surface

    /**
     * Makes {@code instrument} the active one. Returns immediately; progress is visible
     * through {@link #currentState()} and status listeners.
     */
    public void select(Instrument instrument) {
        Objects.requireNonNull(instrument, "instrument");
        post(new Select(instrument));
    }

    public void onLiveTick(long tickGeneration, LiveTick tick) {
        post(new TickReceived(tickGeneration, tick));
    }

    @Override
    public void onProviderResult(ForecastModel model, long resultGeneration, ProviderResult result) {
        post(new ProviderSettled(resultGeneration, model, result));
    }

    /**
     * Re-runs one provider for the current instrument and generation. Only that model's
     * entry is replaced on success; a failure keeps whatever forecast it had.
     *
     * @throws IllegalArgumentException when no provider is configured for {@code model}
     */
    public void refreshPrediction(ForecastModel model) {
        if (!providers.containsKey(model)) {
            throw new IllegalArgumentException("No forecast provider configured for model " + model.id());
        }
        post(new RefreshRequested(model));
    }

    public SessionState currentState() {
        return published;
    }

    public TimelineView getViewModel(LookbackWindow lookback, ForecastModel selectedModel) {
        SessionState state = published;
        return assembler.assemble(state.historical(), state.liveTail(), state.predictions(), lookback, selectedModel);
    }

    public Set<ForecastModel> configuredModels() {
        return providers.keySet();
    }

    public void addStatusListener(SessionStatusListener listener) {
        listeners.add(listener);
    }

    public void removeStatusListener(SessionStatusListener listener) {
        listeners.remove(listener);
    }

    // ---------------------------------------------------------------- mailbox

    private void post(SessionEvent event) {
        try {
            mailbox.execute(() -> dispatch(event));
        } catch (RejectedExecutionException e) {
            log.warn("Session mailbox closed, dropping {}", event.getClass().getSimpleName());
        }
    }

    private void dispatch(SessionEvent event) {
        try {
            if (event instanceof Select e) {
                handleSelect(e.instrument());
            } else if (event instanceof TickReceived e) {
                handleTick(e.generation(), e.tick());
            } else if (event instanceof HistoryLoaded e) {
                handleHistoryLoaded(e.generation(), e.series());
            } else if (event instanceof HistoryFailed e) {
                handleFailure(e.generation(), e.detail());
            } else if (event instanceof FeedFailed e) {
                handleFailure(e.generation(), e.detail());
            } else if (event instanceof ProviderSettled e) {
                handleProviderSettled(e.generation(), e.model(), e.result());
            } else if (event instanceof RefreshRequested e) {
                handleRefresh(e.model());
            }
        } catch (RuntimeException ex) {
            log.error("Unexpected failure handling {}", event.getClass().getSimpleName(), ex);
            fail("Internal error: " + ex.getMessage(), false);
        }
        publish();
    }

    private void handleSelect(Instrument next) {
        long g = ++generation;
        for (PredictionRun run : runs) {
            run.cancel();
        }
        runs.clear();
        if (instrument != null) {
            try {
                liveFeed.unsubscribe(instrument.getSymbol());
            } catch (RuntimeException e) {
                log.warn("Could not unsubscribe {}: {}", instrument.getSymbol(), e.getMessage());
            }
        }

        instrument = next;
        status = SessionStatus.LOADING;
        errorDetail = null;
        recoverableError = false;
        historical = null;
        liveBuffer.clear();
        predictions.clear();
        inFlight.clear();
        providerWarnings = 0;
        String symbol = next.getSymbol();
        log.info("Selected {} (generation {})", next, g);

        try {
            liveFeed.subscribe(symbol, new GenerationFeedListener(g, symbol));
        } catch (LiveFeedException e) {
            fail("Live feed subscription for " + symbol + " failed: " + e.getMessage(), false);
        }

        CompletableFuture
                .supplyAsync(() -> marketData.getHistory(symbol, historyPeriod, historyInterval), ioExecutor)
                .orTimeout(historyTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((series, error) -> {
                    if (error == null && series != null) {
                        post(new HistoryLoaded(g, series));
                    } else {
                        post(new HistoryFailed(g, describeHistoryFailure(symbol, error)));
                    }
                });

        for (ForecastModel model : providers.keySet()) {
            inFlight.put(model, 1);
        }
        runs.add(orchestrator.run(symbol, horizonDays, new ArrayList<>(providers.values()), g, this));
    }

    private void handleTick(long tickGeneration, LiveTick tick) {
        if (instrument == null || tickGeneration != generation || !instrument.getSymbol().equals(tick.symbol())) {
            log.debug("Discarding stale tick for {} (generation {}, current {})", tick.symbol(), tickGeneration, generation);
            return;
        }
        liveBuffer.push(tick);
    }

    private void handleHistoryLoaded(long resultGeneration, HistoricalSeries series) {
        if (isStale(resultGeneration, "history")) return;
        historical = series;
        log.info("Loaded {} bars for {}", series.size(), instrument.getSymbol());
        settleStatus();
    }

    private void handleFailure(long resultGeneration, String detail) {
        if (isStale(resultGeneration, "failure")) return;
        fail(detail, false);
    }

    private void handleProviderSettled(long resultGeneration, ForecastModel model, ProviderResult result) {
        if (isStale(resultGeneration, model.id() + " forecast")) return;
        inFlight.computeIfPresent(model, (m, calls) -> calls > 1 ? calls - 1 : null);
        if (result instanceof ProviderResult.Success s) {
            predictions.put(model, s.forecast());
            log.info("{} forecast for {} ready ({} points)", model.id(), instrument.getSymbol(), s.forecast().size());
        } else if (result instanceof ProviderResult.Failure f) {
            providerWarnings++;
            log.warn("{} model prediction failed for {}: {}", model.id(), instrument.getSymbol(), f.reason());
        }
        settleStatus();
    }

    private void handleRefresh(ForecastModel model) {
        if (instrument == null) {
            log.warn("Ignoring {} refresh: no instrument selected", model.id());
            return;
        }
        inFlight.merge(model, 1, Integer::sum);
        runs.removeIf(PredictionRun::isDone);
        runs.add(orchestrator.run(instrument.getSymbol(), horizonDays, List.of(providers.get(model)), generation, this));
        log.info("Refreshing {} forecast for {} (generation {})", model.id(), instrument.getSymbol(), generation);
    }

    private boolean isStale(long resultGeneration, String what) {
        if (resultGeneration != generation) {
            log.debug("Discarding stale {} (generation {}, current {})", what, resultGeneration, generation);
            return true;
        }
        return false;
    }

    /**
     * Derives the status after history or a forecast result arrived.
     */
    private void settleStatus() {
        if (status == SessionStatus.ERROR && !recoverableError) return;
        if (!providers.isEmpty() && inFlight.isEmpty() && predictions.isEmpty()) {
            fail("No predictions available for " + instrument.getSymbol()
                    + ": all " + providers.size() + " forecast providers failed", true);
            return;
        }
        if (historical == null) return;
        if (status == SessionStatus.LOADING || (status == SessionStatus.ERROR && !predictions.isEmpty())) {
            status = SessionStatus.READY;
            errorDetail = null;
            recoverableError = false;
            log.info("Session for {} ready (generation {})", instrument.getSymbol(), generation);
        }
    }

    private void fail(String detail, boolean recoverable) {
        // A final error is never replaced within its generation
        if (status == SessionStatus.ERROR && !recoverableError) return;
        status = SessionStatus.ERROR;
        errorDetail = detail;
        recoverableError = recoverable;
        log.warn("Session for {} failed (generation {}): {}",
                instrument != null ? instrument.getSymbol() : "-", generation, detail);
    }

    private void publish() {
        SessionState previous = published;
        SessionState next = new SessionState(
                instrument,
                generation,
                status,
                errorDetail,
                historical,
                liveBuffer.snapshot(),
                predictions,
                inFlight.keySet(),
                providerWarnings);
        published = next;
        if (previous.status() != next.status()
                || previous.generation() != next.generation()
                || !Objects.equals(previous.errorDetail(), next.errorDetail())) {
            notifyListeners(next);
        }
    }

    private void notifyListeners(SessionState state) {
        try {
            notifier.execute(() -> {
                for (SessionStatusListener listener : listeners) {
                    try {
                        listener.onStatusChange(state);
                    } catch (RuntimeException e) {
                        log.warn("Status listener failed: {}", e.getMessage());
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Status notifier closed, dropping {} update", state.status());
        }
    }

    private String describeHistoryFailure(String symbol, Throwable error) {
        Throwable cause = error == null ? null : PredictionOrchestrator.unwrap(error);
        if (cause == null) {
            return "Failed to fetch historical data for " + symbol + ": empty response";
        }
        if (cause instanceof TimeoutException) {
            return "Historical data for " + symbol + " timed out after " + historyTimeout.toMillis() + " ms";
        }
        return "Failed to fetch historical data for " + symbol + ": " + cause.getMessage();
    }

    /**
     * Routes feed callbacks into the mailbox, tagged with the generation that subscribed.
     */
    private final class GenerationFeedListener implements LiveFeedListener {
        private final long feedGeneration;
        private final String symbol;

        GenerationFeedListener(long feedGeneration, String symbol) {
            this.feedGeneration = feedGeneration;
            this.symbol = symbol;
        }

        @Override
        public void onTick(LiveTick tick) {
            onLiveTick(feedGeneration, tick);
        }

        @Override
        public void onError(LiveFeedException error) {
            post(new FeedFailed(feedGeneration, "Live feed for " + symbol + " failed: " + error.getMessage()));
        }
    }
}
