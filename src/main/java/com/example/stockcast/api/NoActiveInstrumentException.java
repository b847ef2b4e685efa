package com.example.stockcast.api;

public class NoActiveInstrumentException extends RuntimeException {

    public NoActiveInstrumentException() {
        super("No instrument selected");
    }
}
