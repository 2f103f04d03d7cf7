package fr.lapetina.multillm.infrastructure.http;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Small helpers for composing provider calls.
 */
public final class Futures {

    private Futures() {
        // Utility class
    }

    /**
     * Strips the {@link CompletionException} / {@link ExecutionException} wrappers
     * added by {@link CompletableFuture} stages.
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static boolean isCancellation(Throwable throwable) {
        return unwrap(throwable) instanceof CancellationException;
    }

    /**
     * Cancels {@code inner} as soon as {@code outer} is cancelled.
     * Fires immediately when {@code outer} is already cancelled.
     */
    public static void propagateCancellation(CompletableFuture<?> outer, Future<?> inner) {
        outer.whenComplete((ignored, ex) -> {
            if (outer.isCancelled()) {
                inner.cancel(true);
            }
        });
    }
}
