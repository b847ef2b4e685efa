package com.example.stockcast.domain;

import java.time.Instant;

// One live price update; change is relative to the open of the bar it was taken from
public record LiveTick(
        String symbol,
        Instant timestamp,
        double price,
        double change
) {}
