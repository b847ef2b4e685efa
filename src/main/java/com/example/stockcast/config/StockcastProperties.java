package com.example.stockcast.config;

import com.example.stockcast.domain.ForecastModel;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

/**
 * Externalized settings bound from the {@code stockcast.*} namespace of application.yml.
 */
@Validated
@ConfigurationProperties(prefix = "stockcast")
public record StockcastProperties(
        // Zone in which daily bars are placed on the timeline
        @NotNull @DefaultValue("America/New_York") ZoneId marketZone,
        // Size of the I/O pool; 0 picks a value from the number of processors
        @Min(0) @DefaultValue("0") int ioThreads,
        @Valid @NotNull @DefaultValue Universe universe,
        @Valid @NotNull @DefaultValue History history,
        @Valid @NotNull @DefaultValue Live live,
        @Valid @NotNull @DefaultValue Forecast forecast
) {

    // Classpath CSV listing the instruments offered for selection
    public record Universe(
            @NotBlank @DefaultValue("universe/available_stocks.csv") String resource
    ) {}

    public record History(
            @NotBlank @DefaultValue("1y") String period,
            @NotBlank @DefaultValue("1d") String interval,
            @NotNull @DefaultValue("20s") Duration timeout
    ) {}

    public record Live(
            @Positive @DefaultValue("100") int capacity,
            @NotNull @DefaultValue("5s") Duration pollInterval,
            // Consecutive poll failures for a symbol before the subscriber is told the feed broke
            @Positive @DefaultValue("3") int failureThreshold
    ) {}

    public record Forecast(
            @NotBlank @DefaultValue("http://localhost:5001") String baseUrl,
            @Positive @DefaultValue("7") int horizonDays,
            @NotNull @DefaultValue({"ARIMA", "PROPHET", "ML"}) List<ForecastModel> models,
            @NotNull @DefaultValue("30s") Duration timeout
    ) {}

    /**
     * Pool size for network calls, clamped the same way the universe fetch pool is.
     */
    public int effectiveIoThreads() {
        if (ioThreads > 0) return ioThreads;
        return Math.max(2, Math.min(8, Runtime.getRuntime().availableProcessors()));
    }
}
