package com.example.stockcast.marketdata;

import com.example.stockcast.domain.Instrument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Utility to load the list of selectable instruments from a classpath CSV file.
 * CSV format: symbol,name
 * - Header is optional
 * - Lines starting with '#' are ignored
 * - If the name is blank, the symbol is used as display name
 * - Later duplicates of a symbol are skipped
 */
public final class UniverseListLoader {
    private static final Logger log = LoggerFactory.getLogger(UniverseListLoader.class);

    private UniverseListLoader() {
    }

    public static List<Instrument> load(String resourcePath) {
        ClassPathResource res = new ClassPathResource(resourcePath);
        List<Instrument> items = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        try (BufferedReader br = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            boolean first = true;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                if (first && line.toLowerCase(Locale.ROOT).startsWith("symbol,")) {
                    first = false;
                    continue;
                }
                first = false;
                // Names may themselves contain commas ("Amazon.com, Inc.")
                int comma = line.indexOf(',');
                String symbol = (comma < 0 ? line : line.substring(0, comma)).trim().toUpperCase(Locale.ROOT);
                String name = comma < 0 ? "" : line.substring(comma + 1).trim();
                if (symbol.isEmpty()) {
                    log.warn("Skipping line {} of {}: missing symbol", lineNo, resourcePath);
                    continue;
                }
                if (!seen.add(symbol)) {
                    log.warn("Skipping duplicate symbol {} on line {} of {}", symbol, lineNo, resourcePath);
                    continue;
                }
                items.add(new Instrument(symbol, name));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read instrument universe from " + resourcePath, e);
        }
        return items;
    }
}
