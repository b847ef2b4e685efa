package com.example.stockcast.marketdata;

import com.example.stockcast.config.StockcastProperties;
import com.example.stockcast.domain.HistoricalBar;
import com.example.stockcast.domain.LiveTick;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Live feed that polls the latest intraday bar of every subscribed symbol at a fixed delay.
 *
 * A single scheduler thread does all polling, which keeps ticks of one symbol in order.
 * Each tick is stamped with the poll time and carries the bar close as price and
 * close minus open as change. After {@code failureThreshold} consecutive failed polls the
 * subscriber receives one {@link LiveFeedException}; the streak resets on the next success.
 */
@Component
public class PollingLiveFeed implements LiveFeed {
    private static final Logger log = LoggerFactory.getLogger(PollingLiveFeed.class);

    private final MarketDataProvider marketData;
    private final Clock clock;
    private final Duration pollInterval;
    private final int failureThreshold;
    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();

    private ScheduledExecutorService scheduler;
    private volatile boolean shutdown = false;

    public PollingLiveFeed(MarketDataProvider marketData, StockcastProperties properties, Clock clock) {
        this.marketData = marketData;
        this.clock = clock;
        this.pollInterval = properties.live().pollInterval();
        this.failureThreshold = properties.live().failureThreshold();
    }

    @PostConstruct
    public void start() {
        scheduler = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("live-feed-"));
        long millis = pollInterval.toMillis();
        scheduler.scheduleWithFixedDelay(this::pollOnce, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Live feed polling every {} ms", millis);
    }

    @PreDestroy
    public void stop() {
        shutdown = true;
        subscriptions.clear();
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    @Override
    public void subscribe(String symbol, LiveFeedListener listener) {
        if (shutdown) {
            throw new LiveFeedException(symbol, "Live feed is shut down");
        }
        subscriptions.put(symbol, new Subscription(listener));
        log.info("Now tracking {}", symbol);
    }

    @Override
    public void unsubscribe(String symbol) {
        if (subscriptions.remove(symbol) != null) {
            log.info("Stopped tracking {}", symbol);
        }
    }

    void pollOnce() {
        for (Map.Entry<String, Subscription> e : subscriptions.entrySet()) {
            String symbol = e.getKey();
            Subscription sub = e.getValue();
            LiveTick tick;
            try {
                HistoricalBar bar = marketData.getLatestBar(symbol);
                tick = new LiveTick(symbol, clock.instant(), bar.close(), bar.close() - bar.open());
                sub.consecutiveFailures = 0;
            } catch (RuntimeException ex) {
                int failures = ++sub.consecutiveFailures;
                log.warn("Error updating {} ({} in a row): {}", symbol, failures, ex.getMessage());
                if (failures == failureThreshold) {
                    deliverError(symbol, sub, new LiveFeedException(symbol,
                            "Live updates for " + symbol + " failed " + failures + " times in a row", ex));
                }
                continue;
            }
            // The subscription may have been replaced while the bar was fetched
            if (subscriptions.get(symbol) == sub) {
                deliverTick(sub, tick);
            }
        }
    }

    private void deliverTick(Subscription sub, LiveTick tick) {
        try {
            sub.listener.onTick(tick);
        } catch (RuntimeException ex) {
            log.error("Tick listener for {} failed", tick.symbol(), ex);
        }
    }

    private void deliverError(String symbol, Subscription sub, LiveFeedException error) {
        try {
            sub.listener.onError(error);
        } catch (RuntimeException ex) {
            log.error("Error listener for {} failed", symbol, ex);
        }
    }

    // Failure counter is only touched by the scheduler thread
    private static final class Subscription {
        final LiveFeedListener listener;
        int consecutiveFailures;

        Subscription(LiveFeedListener listener) {
            this.listener = listener;
        }
    }
}
