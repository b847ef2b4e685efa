package com.example.stockcast.repository;

import com.example.stockcast.config.StockcastProperties;
import com.example.stockcast.domain.Instrument;
import com.example.stockcast.marketdata.UniverseListLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.*;

/**
 * Directory of instruments offered for selection, loaded once at startup.
 */
@Repository
public class InstrumentRepository {
    private static final Logger log = LoggerFactory.getLogger(InstrumentRepository.class);

    // Backing store keyed by upper-case symbol, in file order
    private final Map<String, Instrument> instrumentsBySymbol = new LinkedHashMap<>();

    @Autowired
    public InstrumentRepository(StockcastProperties properties) {
        this(UniverseListLoader.load(properties.universe().resource()));
    }

    public InstrumentRepository(List<Instrument> instruments) {
        for (Instrument inst : instruments) {
            instrumentsBySymbol.putIfAbsent(inst.getSymbol().toUpperCase(Locale.ROOT), inst);
        }
        log.info("Instrument directory holds {} symbols", instrumentsBySymbol.size());
    }

    // Find a single instrument by symbol, case-insensitively
    public Optional<Instrument> findBySymbol(String symbol) {
        if (symbol == null) return Optional.empty();
        return Optional.ofNullable(instrumentsBySymbol.get(symbol.trim().toUpperCase(Locale.ROOT)));
    }

    // Return all instruments in a stable iteration order
    public List<Instrument> listAvailable() {
        return new ArrayList<>(instrumentsBySymbol.values());
    }
}
