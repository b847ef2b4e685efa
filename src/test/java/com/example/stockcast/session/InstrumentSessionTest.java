package com.example.stockcast.session;

import com.example.stockcast.config.StockcastProperties;
import com.example.stockcast.config.TestProperties;
import com.example.stockcast.domain.ForecastModel;
import com.example.stockcast.domain.ForecastSet;
import com.example.stockcast.domain.HistoricalSeries;
import com.example.stockcast.domain.Instrument;
import com.example.stockcast.domain.LiveTick;
import com.example.stockcast.domain.LookbackWindow;
import com.example.stockcast.forecast.ForecastProvider;
import com.example.stockcast.forecast.ForecastProviderException;
import com.example.stockcast.marketdata.HistoricalDataException;
import com.example.stockcast.marketdata.LiveFeed;
import com.example.stockcast.marketdata.LiveFeedException;
import com.example.stockcast.marketdata.LiveFeedListener;
import com.example.stockcast.marketdata.MarketDataProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.example.stockcast.TestData.forecast;
import static com.example.stockcast.TestData.lastDate;
import static com.example.stockcast.TestData.series;
import static com.example.stockcast.TestData.tick;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class InstrumentSessionTest {

    private static final Instrument AAPL = new Instrument("AAPL", "Apple Inc.");
    private static final Instrument MSFT = new Instrument("MSFT", "Microsoft Corporation");
    private static final HistoricalSeries AAPL_YEAR = series("AAPL", 252, 100.0);
    private static final HistoricalSeries MSFT_YEAR = series("MSFT", 252, 300.0);
    private static final Instant AFTER_CLOSE = lastDate(AAPL_YEAR).plusDays(1).atTime(15, 0).toInstant(ZoneOffset.UTC);

    private ManualExecutor mailbox;
    private ManualExecutor io;
    private ManualExecutor notifier;
    private MarketDataProvider marketData;
    private LiveFeed liveFeed;
    private ForecastProvider arima;
    private ForecastProvider prophet;
    private ForecastProvider ml;
    private InstrumentSession session;
    private final List<SessionState> notifications = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        mailbox = new ManualExecutor();
        io = new ManualExecutor();
        notifier = new ManualExecutor();
        marketData = mock(MarketDataProvider.class);
        liveFeed = mock(LiveFeed.class);
        when(marketData.getHistory("AAPL", "1y", "1d")).thenReturn(AAPL_YEAR);
        when(marketData.getHistory("MSFT", "1y", "1d")).thenReturn(MSFT_YEAR);
        arima = provider(ForecastModel.ARIMA);
        prophet = provider(ForecastModel.PROPHET);
        ml = provider(ForecastModel.ML);
        session = newSession(TestProperties.defaults(), List.of(arima, prophet, ml));
    }

    @Test
    void startsIdle() {
        SessionState state = session.currentState();

        assertEquals(SessionStatus.IDLE, state.status());
        assertNull(state.instrument());
        assertEquals(0L, state.generation());
        assertEquals(TimelineView.empty(), session.getViewModel(LookbackWindow.ONE_YEAR, ForecastModel.ARIMA));
    }

    @Test
    void selectLoadsHistoryAndEveryForecast() {
        session.select(AAPL);
        assertEquals(SessionStatus.IDLE, session.currentState().status(), "nothing changes before the mailbox runs");

        settle();

        SessionState state = session.currentState();
        assertEquals(SessionStatus.READY, state.status());
        assertEquals(AAPL, state.instrument());
        assertEquals(1L, state.generation());
        assertEquals(252, state.historical().size());
        assertEquals(Set.of(ForecastModel.ARIMA, ForecastModel.PROPHET, ForecastModel.ML), state.predictions().keySet());
        assertTrue(state.pendingModels().isEmpty());
        assertEquals(0, state.providerWarnings());
        assertNull(state.errorDetail());

        for (ForecastModel model : ForecastModel.values()) {
            TimelineView view = session.getViewModel(LookbackWindow.ONE_YEAR, model);
            assertEquals(252, view.primaryDates().size());
            assertEquals(7, view.forecastDates().size());
        }
        assertEquals(30, session.getViewModel(LookbackWindow.ONE_MONTH, null).primaryDates().size());
        verify(liveFeed).subscribe(eq("AAPL"), any(LiveFeedListener.class));
    }

    @Test
    void statusListenersSeeLoadingThenReady() {
        session.select(AAPL);
        mailbox.runAll();
        notifier.runAll();
        assertEquals(List.of(SessionStatus.LOADING), statuses());

        settle();

        assertEquals(List.of(SessionStatus.LOADING, SessionStatus.READY), statuses());
    }

    @Test
    void twoFailingProvidersOutOfThreeStillReady() {
        failWith(prophet, "prophet unavailable");
        failWith(ml, "ml unavailable");

        session.select(AAPL);
        settle();

        SessionState state = session.currentState();
        assertEquals(SessionStatus.READY, state.status());
        assertEquals(Set.of(ForecastModel.ARIMA), state.predictions().keySet());
        assertEquals(2, state.providerWarnings());
        assertNull(state.errorDetail());
    }

    @Test
    void allProvidersFailingIsAnError() {
        failWith(arima, "arima failed");
        failWith(prophet, "prophet failed");
        failWith(ml, "ml failed");

        session.select(AAPL);
        settle();

        SessionState state = session.currentState();
        assertEquals(SessionStatus.ERROR, state.status());
        assertTrue(state.predictions().isEmpty());
        assertEquals(3, state.providerWarnings());
        assertTrue(state.errorDetail().startsWith("No predictions available for AAPL"));
        assertEquals(252, state.historical().size(), "history is still shown");
    }

    @Test
    void historyFailureIsAnErrorThatForecastsDoNotClear() {
        when(marketData.getHistory("AAPL", "1y", "1d"))
                .thenThrow(new HistoricalDataException("AAPL", "Request for AAPL failed: 503 Service Unavailable"));

        session.select(AAPL);
        settle();

        SessionState state = session.currentState();
        assertEquals(SessionStatus.ERROR, state.status());
        assertEquals("Failed to fetch historical data for AAPL: Request for AAPL failed: 503 Service Unavailable",
                state.errorDetail());
        assertNull(state.historical());
        assertEquals(3, state.predictions().size());
        assertEquals(List.of(SessionStatus.LOADING, SessionStatus.ERROR), statuses());
    }

    @Test
    void switchingInstrumentsDiscardsEverythingFromThePreviousSelection() {
        session.select(AAPL);
        mailbox.runAll();
        LiveFeedListener aaplListener = feedListener("AAPL");

        session.select(MSFT);
        mailbox.runAll();
        // AAPL's history and forecasts only complete now, after the switch
        io.runAll();
        aaplListener.onTick(tick("AAPL", AFTER_CLOSE, 190.0));
        mailbox.runAll();

        SessionState state = session.currentState();
        assertEquals(MSFT, state.instrument());
        assertEquals(2L, state.generation());
        assertEquals(SessionStatus.READY, state.status());
        assertEquals("MSFT", state.historical().getSymbol());
        assertTrue(state.liveTail().isEmpty());
        for (ForecastSet forecast : state.predictions().values()) {
            assertEquals(2.0, forecast.predictedPrices().get(0), "only MSFT forecasts may be merged");
        }
        verify(liveFeed).unsubscribe("AAPL");
    }

    @Test
    void ticksForTheActiveInstrumentAreBufferedInOrder() {
        session.select(AAPL);
        settle();
        LiveFeedListener listener = feedListener("AAPL");

        listener.onTick(tick("AAPL", AFTER_CLOSE, 201.0));
        listener.onTick(tick("AAPL", AFTER_CLOSE.plusSeconds(5), 202.0));
        listener.onTick(tick("AAPL", AFTER_CLOSE.plusSeconds(10), 203.0));
        settle();

        List<LiveTick> tail = session.currentState().liveTail();
        assertEquals(List.of(201.0, 202.0, 203.0), tail.stream().map(LiveTick::price).toList());
        TimelineView view = session.getViewModel(LookbackWindow.ONE_MONTH, ForecastModel.ARIMA);
        assertEquals(33, view.primaryDates().size());
        assertEquals(203.0, view.primaryPrices().get(32));
    }

    @Test
    void ticksWithForeignSymbolOrGenerationAreDropped() {
        session.select(AAPL);
        settle();
        LiveFeedListener listener = feedListener("AAPL");

        listener.onTick(tick("MSFT", AFTER_CLOSE, 400.0));
        session.onLiveTick(7L, tick("AAPL", AFTER_CLOSE, 200.0));
        settle();

        assertTrue(session.currentState().liveTail().isEmpty());
    }

    @Test
    void liveTailHoldsTheLastHundredTicks() {
        session.select(AAPL);
        settle();
        LiveFeedListener listener = feedListener("AAPL");

        for (int i = 1; i <= 150; i++) {
            listener.onTick(tick("AAPL", AFTER_CLOSE.plusSeconds(i), i));
        }
        settle();

        List<LiveTick> tail = session.currentState().liveTail();
        assertEquals(100, tail.size());
        assertEquals(51.0, tail.get(0).price());
        assertEquals(150.0, tail.get(99).price());
    }

    @Test
    void feedErrorIsSurfacedAndClearedByReselecting() {
        session.select(AAPL);
        settle();

        feedListener("AAPL").onError(new LiveFeedException("AAPL", "Live updates for AAPL failed 3 times in a row"));
        settle();

        SessionState failed = session.currentState();
        assertEquals(SessionStatus.ERROR, failed.status());
        assertTrue(failed.errorDetail().startsWith("Live feed for AAPL failed"));

        session.select(AAPL);
        settle();

        assertEquals(SessionStatus.READY, session.currentState().status());
        assertEquals(2L, session.currentState().generation());
        verify(liveFeed, times(2)).subscribe(eq("AAPL"), any(LiveFeedListener.class));
        verify(liveFeed).unsubscribe("AAPL");
    }

    @Test
    void subscriptionFailureIsAnError() {
        doThrow(new LiveFeedException("AAPL", "Live feed is shut down"))
                .when(liveFeed).subscribe(eq("AAPL"), any(LiveFeedListener.class));

        session.select(AAPL);
        settle();

        SessionState state = session.currentState();
        assertEquals(SessionStatus.ERROR, state.status());
        assertEquals("Live feed subscription for AAPL failed: Live feed is shut down", state.errorDetail());
        assertEquals(252, state.historical().size());
    }

    @Test
    void refreshReplacesOnlyTheRefreshedModel() {
        session.select(AAPL);
        settle();
        ForecastSet prophetBefore = session.currentState().predictions().get(ForecastModel.PROPHET);
        doReturn(forecast(ForecastModel.ARIMA, lastDate(AAPL_YEAR), 7, 5.0)).when(arima).predict("AAPL", 7);

        session.refreshPrediction(ForecastModel.ARIMA);
        settle();

        SessionState state = session.currentState();
        assertEquals(5.0, state.predictions().get(ForecastModel.ARIMA).predictedPrices().get(0));
        assertSame(prophetBefore, state.predictions().get(ForecastModel.PROPHET));
        assertEquals(SessionStatus.READY, state.status());
        verify(prophet, times(1)).predict("AAPL", 7);
        verify(arima, times(2)).predict("AAPL", 7);
    }

    @Test
    void failedRefreshKeepsPreviousForecast() {
        session.select(AAPL);
        settle();
        ForecastSet before = session.currentState().predictions().get(ForecastModel.ML);
        failWith(ml, "ml unavailable");

        session.refreshPrediction(ForecastModel.ML);
        settle();

        SessionState state = session.currentState();
        assertSame(before, state.predictions().get(ForecastModel.ML));
        assertEquals(1, state.providerWarnings());
        assertEquals(SessionStatus.READY, state.status());
    }

    @Test
    void successfulRefreshRecoversFromNoPredictions() {
        failWith(arima, "arima failed");
        failWith(prophet, "prophet failed");
        failWith(ml, "ml failed");
        session.select(AAPL);
        settle();
        assertEquals(SessionStatus.ERROR, session.currentState().status());

        doReturn(forecast(ForecastModel.ARIMA, lastDate(AAPL_YEAR), 7, 1.0)).when(arima).predict("AAPL", 7);
        session.refreshPrediction(ForecastModel.ARIMA);
        mailbox.runAll();
        assertEquals(SessionStatus.ERROR, session.currentState().status(), "pending refresh alone does not clear the error");
        assertEquals(Set.of(ForecastModel.ARIMA), session.currentState().pendingModels());

        settle();

        SessionState state = session.currentState();
        assertEquals(SessionStatus.READY, state.status());
        assertNull(state.errorDetail());
        assertEquals(Set.of(ForecastModel.ARIMA), state.predictions().keySet());
    }

    @Test
    void refreshOverlappingTheFirstCallKeepsModelPending() {
        InstrumentSession mlOnly = newSession(TestProperties.defaults(), List.of(ml));
        doThrow(new ForecastProviderException(ForecastModel.ML, "ml unavailable"))
                .doReturn(forecast(ForecastModel.ML, lastDate(AAPL_YEAR), 7, 1.0))
                .when(ml).predict("AAPL", 7);

        mlOnly.select(AAPL);
        mailbox.runAll();
        mlOnly.refreshPrediction(ForecastModel.ML);
        mailbox.runAll();
        assertEquals(3, io.pending(), "history, the first ml call and the refresh are all queued");
        assertEquals(Set.of(ForecastModel.ML), mlOnly.currentState().pendingModels());

        // history loads, then the first ml call fails while the refresh is still out
        io.runNext();
        io.runNext();
        mailbox.runAll();

        SessionState midway = mlOnly.currentState();
        assertEquals(SessionStatus.READY, midway.status());
        assertEquals(Set.of(ForecastModel.ML), midway.pendingModels());
        assertEquals(1, midway.providerWarnings());

        settle();

        SessionState state = mlOnly.currentState();
        assertEquals(SessionStatus.READY, state.status());
        assertTrue(state.pendingModels().isEmpty());
        assertEquals(Set.of(ForecastModel.ML), state.predictions().keySet());
        assertFalse(statuses().contains(SessionStatus.ERROR));
    }

    @Test
    void statusListenersRunOffTheMailbox() {
        session.select(AAPL);
        mailbox.runAll();

        assertTrue(notifications.isEmpty(), "listeners wait for the notifier");
        assertEquals(SessionStatus.LOADING, session.currentState().status());

        // the session keeps processing while notifications are still queued
        io.runAll();
        mailbox.runAll();
        assertEquals(SessionStatus.READY, session.currentState().status());
        assertTrue(notifications.isEmpty());

        notifier.runAll();
        assertEquals(List.of(SessionStatus.LOADING, SessionStatus.READY), statuses());
    }

    @Test
    void refreshBeforeAnySelectionDoesNothing() {
        session.refreshPrediction(ForecastModel.ARIMA);
        settle();

        assertEquals(SessionStatus.IDLE, session.currentState().status());
        verify(arima, never()).predict(anyString(), anyInt());
    }

    @Test
    void refreshOfUnconfiguredModelIsRejected() {
        InstrumentSession arimaOnly = newSession(TestProperties.defaults(), List.of(arima));

        assertThrows(IllegalArgumentException.class, () -> arimaOnly.refreshPrediction(ForecastModel.PROPHET));
        assertEquals(Set.of(ForecastModel.ARIMA), arimaOnly.configuredModels());
    }

    @Test
    void duplicateProvidersForOneModelAreRejected() {
        ForecastProvider secondArima = provider(ForecastModel.ARIMA);

        assertThrows(IllegalArgumentException.class,
                () -> newSession(TestProperties.defaults(), List.of(arima, secondArima)));
    }

    @Test
    void timedOutProvidersCountAsFailures() throws Exception {
        InstrumentSession impatient = newSession(TestProperties.withForecastTimeout(Duration.ofMillis(50)),
                List.of(arima, prophet, ml));

        impatient.select(AAPL);
        mailbox.runAll();
        io.runNext(); // history only; forecast calls never run
        awaitMailbox(4);
        mailbox.runAll();

        SessionState state = impatient.currentState();
        assertEquals(SessionStatus.ERROR, state.status());
        assertEquals(3, state.providerWarnings());
        assertTrue(state.errorDetail().startsWith("No predictions available for AAPL"));
        verify(arima, never()).predict(anyString(), anyInt());
    }

    @Test
    void failingStatusListenerDoesNotStopTheSession() {
        session.addStatusListener(state -> {
            throw new IllegalStateException("listener broke");
        });

        session.select(AAPL);
        settle();

        assertEquals(SessionStatus.READY, session.currentState().status());
    }

    @Test
    void removedListenerIsNoLongerNotified() {
        List<SessionState> seen = new CopyOnWriteArrayList<>();
        SessionStatusListener listener = seen::add;
        session.addStatusListener(listener);
        session.removeStatusListener(listener);

        session.select(AAPL);
        settle();

        assertTrue(seen.isEmpty());
    }

    private InstrumentSession newSession(StockcastProperties properties, List<ForecastProvider> providers) {
        InstrumentSession created = new InstrumentSession(marketData, liveFeed, providers, properties, mailbox, io, notifier);
        created.addStatusListener(notifications::add);
        return created;
    }

    // Runs mailbox, I/O and notifier tasks until none has anything left
    private void settle() {
        while (mailbox.runAll() + io.runAll() + notifier.runAll() > 0) {
            // keep draining
        }
    }

    private void awaitMailbox(int tasks) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (mailbox.pending() < tasks && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(mailbox.pending() >= tasks, "timeouts did not reach the mailbox");
    }

    private List<SessionStatus> statuses() {
        return notifications.stream().map(SessionState::status).toList();
    }

    private LiveFeedListener feedListener(String symbol) {
        ArgumentCaptor<LiveFeedListener> captor = ArgumentCaptor.forClass(LiveFeedListener.class);
        verify(liveFeed, atLeastOnce()).subscribe(eq(symbol), captor.capture());
        return captor.getValue();
    }

    // AAPL forecasts are priced 1.0 and MSFT forecasts 2.0 so their origin stays visible
    private static ForecastProvider provider(ForecastModel model) {
        ForecastProvider provider = mock(ForecastProvider.class);
        when(provider.model()).thenReturn(model);
        when(provider.predict(anyString(), eq(7))).thenAnswer(inv -> {
            String symbol = inv.getArgument(0);
            return forecast(model, lastDate(AAPL_YEAR), 7, "AAPL".equals(symbol) ? 1.0 : 2.0);
        });
        return provider;
    }

    private static void failWith(ForecastProvider provider, String reason) {
        ForecastModel model = provider.model();
        doThrow(new ForecastProviderException(model, reason)).when(provider).predict(anyString(), anyInt());
    }
}
