package com.example.stockcast.session;

import com.example.stockcast.domain.ForecastModel;
import com.example.stockcast.domain.HistoricalSeries;
import com.example.stockcast.domain.Instrument;
import com.example.stockcast.domain.LiveTick;

/**
 * Messages processed one at a time by the session mailbox. Every asynchronous
 * completion carries the generation it was started for.
 */
interface SessionEvent {

    record Select(Instrument instrument) implements SessionEvent {}

    record HistoryLoaded(long generation, HistoricalSeries series) implements SessionEvent {}

    record HistoryFailed(long generation, String detail) implements SessionEvent {}

    record TickReceived(long generation, LiveTick tick) implements SessionEvent {}

    record FeedFailed(long generation, String detail) implements SessionEvent {}

    record ProviderSettled(long generation, ForecastModel model, ProviderResult result) implements SessionEvent {}

    record RefreshRequested(ForecastModel model) implements SessionEvent {}
}
