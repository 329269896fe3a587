package com.example.checkout.application.service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Time budget of one checkout request. Every step runs against the same deadline.
 */
public final class Deadline {

    private final Duration budget;
    private final long expiresAtNanos;

    private Deadline(Duration budget, long expiresAtNanos) {
        this.budget = budget;
        this.expiresAtNanos = expiresAtNanos;
    }

    public static Deadline after(Duration budget) {
        return new Deadline(budget, System.nanoTime() + budget.toNanos());
    }

    public boolean isExpired() {
        return remaining().isZero();
    }

    public Duration remaining() {
        long left = expiresAtNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    public Duration budget() {
        return budget;
    }

    /**
     * Bounds a call by the remaining budget.
     * When the budget runs out first, the call is cancelled and the returned future fails
     * with {@link DeadlineExceededException}.
     */
    public <T> CompletableFuture<T> bound(CompletableFuture<T> call) {
        long remainingMillis = remaining().toMillis();
        if (remainingMillis <= 0) {
            call.cancel(true);
            return CompletableFuture.failedFuture(new DeadlineExceededException(budget));
        }

        CompletableFuture<T> bounded = new CompletableFuture<>();
        call.copy()
                .orTimeout(remainingMillis, TimeUnit.MILLISECONDS)
                .whenComplete((value, throwable) -> {
                    if (throwable == null) {
                        bounded.complete(value);
                        return;
                    }
                    Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                            ? throwable.getCause() : throwable;
                    if (cause instanceof TimeoutException) {
                        call.cancel(true);
                        bounded.completeExceptionally(new DeadlineExceededException(budget));
                    } else {
                        bounded.completeExceptionally(cause);
                    }
                });
        return bounded;
    }
}
