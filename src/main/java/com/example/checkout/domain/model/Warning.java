package com.example.checkout.domain.model;

/**
 * A tolerable step failure surfaced to the caller.
 * {@code retryable} is informational: nothing in this service retries.
 */
public record Warning(
        String collaborator,
        String reason,
        String message,
        boolean retryable
) {
}
