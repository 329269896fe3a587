package com.example.checkout.infrastructure.observability;

/**
 * Process identity attached to every meter, plus whether observations are echoed to the log.
 */
public record ObservabilitySettings(
        String serviceVersion,
        String environment,
        boolean logObservations
) {
}
