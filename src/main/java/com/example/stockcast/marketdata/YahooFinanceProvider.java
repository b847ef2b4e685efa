package com.example.stockcast.marketdata;

import com.example.stockcast.domain.HistoricalBar;
import com.example.stockcast.domain.HistoricalSeries;
import com.example.stockcast.domain.InstrumentInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Component
public class YahooFinanceProvider implements MarketDataProvider {
    private static final Logger log = LoggerFactory.getLogger(YahooFinanceProvider.class);

    static final String CHART_URL = "https://query1.finance.yahoo.com/v8/finance/chart/{symbol}?range={range}&interval={interval}";
    static final String QUOTE_URL = "https://query1.finance.yahoo.com/v7/finance/quote?symbols={symbol}";

    // HTTP client configured with realistic headers to reduce chances of being blocked
    private final RestClient http;

    public YahooFinanceProvider(RestClient.Builder builder) {
        this.http = builder
                .defaultHeader(HttpHeaders.USER_AGENT, "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/125.0.0.0 Safari/537.36")
                .defaultHeader(HttpHeaders.ACCEPT, "application/json")
                .build();
    }

    @Override
    public HistoricalSeries getHistory(String symbol, String period, String interval) {
        List<HistoricalBar> bars = fetchChartBars(symbol, period, interval);
        if (bars.isEmpty()) {
            throw new HistoricalDataException(symbol, "No price data returned for " + symbol + " (" + period + "/" + interval + ")");
        }
        log.debug("Fetched {} bars for {} ({}/{})", bars.size(), symbol, period, interval);
        return new HistoricalSeries(symbol, bars);
    }

    @Override
    public HistoricalBar getLatestBar(String symbol) {
        List<HistoricalBar> bars = fetchChartBars(symbol, "1d", "1m");
        if (bars.isEmpty()) {
            throw new HistoricalDataException(symbol, "No intraday bar available for " + symbol);
        }
        return bars.get(bars.size() - 1);
    }

    @Override
    public InstrumentInfo getInfo(String symbol) {
        Map<?, ?> resp = get(symbol, QUOTE_URL, symbol);
        try {
            Map<?, ?> quoteResponse = (Map<?, ?>) resp.get("quoteResponse");
            List<Map<?, ?>> results = (List<Map<?, ?>>) quoteResponse.get("result");
            if (results == null || results.isEmpty()) {
                throw new HistoricalDataException(symbol, "No quote returned for " + symbol);
            }
            Map<?, ?> q = results.get(0);
            String name = firstText(q, "shortName", "longName");
            Object currency = q.get("currency");
            return new InstrumentInfo(
                    symbol,
                    name != null ? name : symbol,
                    currency instanceof String s ? s : null,
                    number(q, "regularMarketPrice"),
                    number(q, "regularMarketPreviousClose"),
                    number(q, "regularMarketOpen"),
                    number(q, "regularMarketDayHigh"),
                    number(q, "regularMarketDayLow"),
                    number(q, "fiftyTwoWeekHigh"),
                    number(q, "fiftyTwoWeekLow"),
                    (long) number(q, "regularMarketVolume"),
                    (long) number(q, "averageDailyVolume3Month"),
                    number(q, "marketCap"),
                    number(q, "trailingPE"),
                    number(q, "forwardPE"),
                    number(q, "trailingAnnualDividendYield")
            );
        } catch (ClassCastException e) {
            throw new HistoricalDataException(symbol, "Unexpected quote payload for " + symbol, e);
        }
    }

    /**
     * Reads one chart response into daily bars. Points with a missing close are skipped and
     * bars falling on the same exchange-local date collapse to the last one, so the result
     * is strictly increasing.
     */
    private List<HistoricalBar> fetchChartBars(String symbol, String range, String interval) {
        Map<?, ?> resp = get(symbol, CHART_URL, symbol, range, interval);
        try {
            Map<?, ?> chart = (Map<?, ?>) resp.get("chart");
            List<Map<?, ?>> results = (List<Map<?, ?>>) chart.get("result");
            if (results == null || results.isEmpty()) {
                throw new HistoricalDataException(symbol, "Chart for " + symbol + " is empty: " + describeError(chart));
            }
            Map<?, ?> first = results.get(0);
            ZoneId zone = exchangeZone((Map<?, ?>) first.get("meta"));
            List<?> timestamps = (List<?>) first.get("timestamp");
            if (timestamps == null) return List.of();

            Map<?, ?> indicators = (Map<?, ?>) first.get("indicators");
            Map<?, ?> quote = ((List<Map<?, ?>>) indicators.get("quote")).get(0);
            List<?> opens = (List<?>) quote.get("open");
            List<?> highs = (List<?>) quote.get("high");
            List<?> lows = (List<?>) quote.get("low");
            List<?> closes = (List<?>) quote.get("close");
            List<?> volumes = (List<?>) quote.get("volume");

            TreeMap<LocalDate, HistoricalBar> byDate = new TreeMap<>();
            for (int i = 0; i < timestamps.size(); i++) {
                Double close = at(closes, i);
                if (!(timestamps.get(i) instanceof Number ts) || close == null) continue;
                LocalDate date = Instant.ofEpochSecond(ts.longValue()).atZone(zone).toLocalDate();
                Double open = at(opens, i);
                Double high = at(highs, i);
                Double low = at(lows, i);
                Double volume = at(volumes, i);
                byDate.put(date, new HistoricalBar(
                        date,
                        open != null ? open : close,
                        high != null ? high : close,
                        low != null ? low : close,
                        close,
                        volume != null ? volume.longValue() : 0L));
            }
            return new ArrayList<>(byDate.values());
        } catch (ClassCastException | IndexOutOfBoundsException | NullPointerException e) {
            throw new HistoricalDataException(symbol, "Unexpected chart payload for " + symbol, e);
        }
    }

    private Map<?, ?> get(String symbol, String url, Object... uriVariables) {
        Map<?, ?> resp;
        try {
            resp = http.get().uri(url, uriVariables).retrieve().body(Map.class);
        } catch (RestClientException e) {
            throw new HistoricalDataException(symbol, "Request for " + symbol + " failed: " + e.getMessage(), e);
        }
        if (resp == null) {
            throw new HistoricalDataException(symbol, "Empty response for " + symbol);
        }
        return resp;
    }

    private static ZoneId exchangeZone(Map<?, ?> meta) {
        if (meta != null && meta.get("exchangeTimezoneName") instanceof String tz) {
            try {
                return ZoneId.of(tz);
            } catch (DateTimeException e) {
                log.debug("Unknown exchange zone {}, using UTC", tz);
            }
        }
        return ZoneOffset.UTC;
    }

    private static String describeError(Map<?, ?> chart) {
        if (chart.get("error") instanceof Map<?, ?> error && error.get("description") instanceof String d) {
            return d;
        }
        return "no result";
    }

    private static Double at(List<?> values, int i) {
        if (values == null || i >= values.size()) return null;
        return values.get(i) instanceof Number n ? n.doubleValue() : null;
    }

    private static double number(Map<?, ?> map, String key) {
        return map.get(key) instanceof Number n ? n.doubleValue() : 0.0;
    }

    private static String firstText(Map<?, ?> map, String... keys) {
        for (String key : keys) {
            if (map.get(key) instanceof String s && !s.isBlank()) return s;
        }
        return null;
    }
}
