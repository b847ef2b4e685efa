package com.example.stockcast.config;

import com.example.stockcast.forecast.ForecastProvider;
import com.example.stockcast.forecast.RemoteForecastProvider;
import com.example.stockcast.marketdata.LiveFeed;
import com.example.stockcast.marketdata.MarketDataProvider;
import com.example.stockcast.session.InstrumentSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the session actor: its single-threaded mailbox, the shared I/O pool and one
 * remote forecast provider per configured model.
 */
@Configuration
public class SessionConfig {
    private static final Logger log = LoggerFactory.getLogger(SessionConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // One thread: events are applied strictly one at a time
    @Bean
    public ExecutorService sessionMailbox() {
        return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("session-mailbox-"));
    }

    // Status listeners (SSE clients) run here, off the mailbox thread
    @Bean
    public ExecutorService statusNotifier() {
        return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("session-status-"));
    }

    @Bean
    public ExecutorService ioExecutor(StockcastProperties properties) {
        return Executors.newFixedThreadPool(properties.effectiveIoThreads(), new CustomizableThreadFactory("stockcast-io-"));
    }

    @Bean
    public List<ForecastProvider> forecastProviders(StockcastProperties properties, RestClient.Builder builder) {
        RestClient http = builder.clone().baseUrl(properties.forecast().baseUrl()).build();
        List<ForecastProvider> providers = new ArrayList<>();
        properties.forecast().models().stream()
                .distinct()
                .forEach(model -> providers.add(new RemoteForecastProvider(model, http)));
        log.info("Forecast providers {} at {}", properties.forecast().models(), properties.forecast().baseUrl());
        return providers;
    }

    @Bean
    public InstrumentSession instrumentSession(MarketDataProvider marketData,
                                               LiveFeed liveFeed,
                                               @Qualifier("forecastProviders") List<ForecastProvider> forecastProviders,
                                               StockcastProperties properties,
                                               @Qualifier("sessionMailbox") ExecutorService sessionMailbox,
                                               @Qualifier("ioExecutor") ExecutorService ioExecutor,
                                               @Qualifier("statusNotifier") ExecutorService statusNotifier) {
        return new InstrumentSession(marketData, liveFeed, forecastProviders, properties,
                sessionMailbox, ioExecutor, statusNotifier);
    }
}
