package com.example.checkout.application.service;

import java.time.Duration;

/**
 * Raised when the request deadline runs out while a step is waiting on a collaborator.
 */
public class DeadlineExceededException extends RuntimeException {

    private final Duration budget;

    public DeadlineExceededException(Duration budget) {
        super("Checkout deadline of " + budget.toMillis() + "ms exceeded");
        this.budget = budget;
    }

    public Duration getBudget() {
        return budget;
    }
}
