package com.example.stockcast.session;

import com.example.stockcast.domain.LiveTick;

import java.util.ArrayDeque;
import java.util.List;

/**
 * Bounded FIFO of the most recent live ticks for the active instrument.
 *
 * Not thread-safe: the owning session is the only writer and reader.
 */
public class LiveUpdateBuffer {
    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final ArrayDeque<LiveTick> ticks;

    public LiveUpdateBuffer() {
        this(DEFAULT_CAPACITY);
    }

    public LiveUpdateBuffer(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive: " + capacity);
        this.capacity = capacity;
        this.ticks = new ArrayDeque<>(capacity + 1);
    }

    public void push(LiveTick tick) {
        ticks.addLast(tick);
        while (ticks.size() > capacity) {
            ticks.removeFirst();
        }
    }

    /**
     * @return immutable copy of the buffered ticks in arrival order
     */
    public List<LiveTick> snapshot() {
        return List.copyOf(ticks);
    }

    public void clear() {
        ticks.clear();
    }

    public int size() {
        return ticks.size();
    }

    public int capacity() {
        return capacity;
    }
}
