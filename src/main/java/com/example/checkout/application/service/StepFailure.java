package com.example.checkout.application.service;

/**
 * A failure recorded into the {@link OrderContext}.
 *
 * @param step the failed step, null for failures of the orchestrator itself
 */
public record StepFailure(
        CheckoutStep step,
        FailureKind kind,
        String collaborator,
        String reason,
        String message,
        boolean retryable
) {
    public boolean isFatal() {
        return kind != FailureKind.TOLERABLE;
    }
}
