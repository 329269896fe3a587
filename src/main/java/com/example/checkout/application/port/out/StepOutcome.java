package com.example.checkout.application.port.out;

import java.util.Objects;

/**
 * Tagged result of one collaborator call: either a payload or a failure reason.
 * Outbound ports complete their futures with a StepOutcome and never exceptionally.
 *
 * @param <T> payload type
 */
public record StepOutcome<T>(
        boolean success,
        T payload,
        String reason,
        String message,
        boolean retryable
) {

    public static final String TIMEOUT = "timeout";
    public static final String DEADLINE_EXCEEDED = "deadline_exceeded";
    public static final String UNAVAILABLE = "unavailable";
    public static final String REJECTED = "rejected";
    public static final String ERROR = "error";

    public static <T> StepOutcome<T> success(T payload) {
        return new StepOutcome<>(true, payload, null, null, false);
    }

    public static <T> StepOutcome<T> failure(String reason, String message, boolean retryable) {
        Objects.requireNonNull(reason, "Failure reason cannot be null");
        return new StepOutcome<>(false, null, reason, message, retryable);
    }

    public static <T> StepOutcome<T> timeout(String message) {
        return failure(TIMEOUT, message, true);
    }

    public static <T> StepOutcome<T> deadlineExceeded() {
        return failure(DEADLINE_EXCEEDED, "Request deadline exceeded", true);
    }

    public boolean isFailure() {
        return !success;
    }
}
