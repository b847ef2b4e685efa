package com.example.stockcast.api;

public class UnknownInstrumentException extends RuntimeException {

    public UnknownInstrumentException(String symbol) {
        super("Unknown instrument: " + symbol);
    }
}
