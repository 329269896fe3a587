package com.example.checkout.simulator;

import java.util.Random;

/**
 * Fails a fixed fraction of calls.
 */
public class ProbabilisticFailurePolicy implements FailurePolicy {

    private final Random random;
    private final double failureRate;

    public ProbabilisticFailurePolicy(Random random, double failureRate) {
        if (failureRate < 0.0 || failureRate > 1.0) {
            throw new IllegalArgumentException("Failure rate must be within [0, 1]: " + failureRate);
        }
        this.random = random;
        this.failureRate = failureRate;
    }

    @Override
    public boolean shouldFail() {
        return failureRate > 0.0 && random.nextDouble() < failureRate;
    }
}
