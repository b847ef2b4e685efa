package com.example.stockcast.session;

/**
 * Notified on the session thread whenever status, error detail or generation change.
 * Implementations must return quickly.
 */
@FunctionalInterface
public interface SessionStatusListener {

    void onStatusChange(SessionState state);
}
