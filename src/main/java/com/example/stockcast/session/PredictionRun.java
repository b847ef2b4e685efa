package com.example.stockcast.session;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Handle on the calls started by one orchestrator run.
 */
public class PredictionRun {
    private final long generation;
    private final List<CompletableFuture<?>> calls;

    PredictionRun(long generation, List<CompletableFuture<?>> calls) {
        this.generation = generation;
        this.calls = List.copyOf(calls);
    }

    public long generation() {
        return generation;
    }

    public boolean isDone() {
        return calls.stream().allMatch(CompletableFuture::isDone);
    }

    /**
     * Cancels calls that have not settled yet. A cancelled call still reports a failure
     * to the listener, tagged with this run's generation. Work already running on an
     * I/O thread is not interrupted.
     */
    public void cancel() {
        for (CompletableFuture<?> call : calls) {
            call.cancel(false);
        }
    }
}
