package com.example.stockcast.api;

import com.example.stockcast.api.dto.SessionDtos.ForecastResponse;
import com.example.stockcast.api.dto.SessionDtos.SelectRequest;
import com.example.stockcast.api.dto.SessionDtos.SessionStatusResponse;
import com.example.stockcast.domain.ForecastModel;
import com.example.stockcast.domain.Instrument;
import com.example.stockcast.domain.LookbackWindow;
import com.example.stockcast.repository.InstrumentRepository;
import com.example.stockcast.session.InstrumentSession;
import com.example.stockcast.session.SessionState;
import com.example.stockcast.session.SessionStatusListener;
import com.example.stockcast.session.TimelineView;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/session")
public class SessionController {
    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final InstrumentSession session;
    private final InstrumentRepository repository;

    public SessionController(InstrumentSession session, InstrumentRepository repository) {
        this.session = session;
        this.repository = repository;
    }

    // Starts loading history, live updates and forecasts for the symbol; completes asynchronously
    @PostMapping("/select")
    public ResponseEntity<Void> select(@Valid @RequestBody SelectRequest request) {
        Instrument instrument = repository.findBySymbol(request.symbol())
                .orElseThrow(() -> new UnknownInstrumentException(request.symbol()));
        session.select(instrument);
        return ResponseEntity.accepted().build();
    }

    @GetMapping
    public SessionStatusResponse status() {
        return SessionStatusResponse.from(session.currentState());
    }

    // Chart data: sliced history + live tail, plus the forecast of the selected model if any
    @GetMapping("/view")
    public TimelineView view(@RequestParam(defaultValue = "1y") String lookback,
                             @RequestParam(required = false) String model) {
        ForecastModel selected = (model == null || model.isBlank()) ? null : ForecastModel.fromId(model);
        return session.getViewModel(LookbackWindow.fromCode(lookback), selected);
    }

    // Forecasts received so far, keyed by model id, with change and band-width figures
    @GetMapping("/predictions")
    public Map<String, ForecastResponse> predictions() {
        Map<String, ForecastResponse> out = new LinkedHashMap<>();
        session.currentState().predictions().forEach((model, forecast) -> out.put(model.id(), ForecastResponse.from(forecast)));
        return out;
    }

    @PostMapping("/predictions/{model}/refresh")
    public ResponseEntity<Void> refresh(@PathVariable String model) {
        if (session.currentState().instrument() == null) {
            throw new NoActiveInstrumentException();
        }
        session.refreshPrediction(ForecastModel.fromId(model));
        return ResponseEntity.accepted().build();
    }

    // Server-sent stream of status changes, starting with the current state
    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        SseEmitter emitter = new SseEmitter(0L);
        SessionStatusListener listener = new SessionStatusListener() {
            @Override
            public void onStatusChange(SessionState state) {
                try {
                    emitter.send(SseEmitter.event().name("status").data(SessionStatusResponse.from(state)));
                } catch (IOException | IllegalStateException e) {
                    log.debug("Status stream closed: {}", e.getMessage());
                    session.removeStatusListener(this);
                }
            }
        };
        session.addStatusListener(listener);
        emitter.onCompletion(() -> session.removeStatusListener(listener));
        emitter.onTimeout(() -> session.removeStatusListener(listener));
        emitter.onError(e -> session.removeStatusListener(listener));
        listener.onStatusChange(session.currentState());
        return emitter;
    }
}
