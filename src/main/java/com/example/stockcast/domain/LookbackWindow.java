package com.example.stockcast.domain;

/**
 * Trailing slice of the historical series requested by the presentation layer.
 * Windows are counted in trading entries, not calendar days.
 */
public enum LookbackWindow {
    ONE_MONTH("1m", 30),
    THREE_MONTHS("3m", 90),
    SIX_MONTHS("6m", 180),
    ONE_YEAR("1y", Integer.MAX_VALUE); // everything available

    private final String code;
    private final int entries;

    LookbackWindow(String code, int entries) {
        this.code = code;
        this.entries = entries;
    }

    public String code() {
        return code;
    }

    public int entries() {
        return entries;
    }

    public static LookbackWindow fromCode(String code) {
        for (LookbackWindow window : values()) {
            if (window.code.equalsIgnoreCase(code)) return window;
        }
        throw new IllegalArgumentException("Unknown lookback window: " + code);
    }
}
