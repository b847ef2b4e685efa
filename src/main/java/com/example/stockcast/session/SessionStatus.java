package com.example.stockcast.session;

public enum SessionStatus {
    IDLE,
    LOADING,
    READY,
    ERROR
}
