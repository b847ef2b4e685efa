package com.example.stockcast.api;

import com.example.stockcast.domain.Instrument;
import com.example.stockcast.domain.InstrumentInfo;
import com.example.stockcast.marketdata.MarketDataProvider;
import com.example.stockcast.repository.InstrumentRepository;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/instruments")
public class InstrumentController {
    // Read-only directory of selectable instruments
    private final InstrumentRepository repository;
    private final MarketDataProvider marketData;

    public InstrumentController(InstrumentRepository repository, MarketDataProvider marketData) {
        this.repository = repository;
        this.marketData = marketData;
    }

    // Returns the full list of instruments available for selection on the frontend
    @GetMapping
    public List<Instrument> list() {
        return repository.listAvailable();
    }

    // Quote summary for the detail panel of one instrument
    @GetMapping("/{symbol}/info")
    public InstrumentInfo info(@PathVariable String symbol) {
        Instrument instrument = repository.findBySymbol(symbol)
                .orElseThrow(() -> new UnknownInstrumentException(symbol));
        return marketData.getInfo(instrument.getSymbol());
    }
}
