package com.example.checkout.simulator;

/**
 * Decides whether a simulated collaborator fails a given call.
 */
@FunctionalInterface
public interface FailurePolicy {

    boolean shouldFail();

    static FailurePolicy never() {
        return () -> false;
    }

    static FailurePolicy always() {
        return () -> true;
    }
}
