package com.example.checkout.infrastructure.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.observation.DefaultMeterObservationHandler;
import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.ObservationTextPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide telemetry handle. Created once by the entry point through {@link #init} and passed
 * to whoever records observations; {@link #shutdown()} stops any further recording.
 */
public final class Observability {

    private static final Logger log = LoggerFactory.getLogger(Observability.class);

    private final String serviceName;
    private final MeterRegistry meterRegistry;
    private final ObservationRegistry observationRegistry;
    private final AtomicBoolean open = new AtomicBoolean(true);

    private Observability(String serviceName, MeterRegistry meterRegistry, ObservationRegistry observationRegistry) {
        this.serviceName = serviceName;
        this.meterRegistry = meterRegistry;
        this.observationRegistry = observationRegistry;
    }

    public static Observability init(String serviceName, ObservabilitySettings settings, MeterRegistry meterRegistry) {
        Objects.requireNonNull(serviceName, "ServiceName cannot be null");
        Objects.requireNonNull(settings, "Settings cannot be null");
        Objects.requireNonNull(meterRegistry, "MeterRegistry cannot be null");

        meterRegistry.config().commonTags(
                "service.name", serviceName,
                "service.version", settings.serviceVersion(),
                "deployment.environment", settings.environment());

        ObservationRegistry observationRegistry = ObservationRegistry.create();
        Observability observability = new Observability(serviceName, meterRegistry, observationRegistry);

        observationRegistry.observationConfig()
                .observationPredicate((name, context) -> observability.isOpen())
                .observationHandler(new DefaultMeterObservationHandler(meterRegistry));
        if (settings.logObservations()) {
            observationRegistry.observationConfig().observationHandler(new ObservationTextPublisher(log::debug));
        }

        log.info("Observability initialized for {} (version={}, environment={})",
                serviceName, settings.serviceVersion(), settings.environment());
        return observability;
    }

    public ObservationRegistry observationRegistry() {
        return observationRegistry;
    }

    public MeterRegistry meterRegistry() {
        return meterRegistry;
    }

    public boolean isOpen() {
        return open.get();
    }

    /**
     * Idempotent. Observations started afterwards are no-ops.
     */
    public void shutdown() {
        if (open.compareAndSet(true, false)) {
            log.info("Observability for {} shut down", serviceName);
        }
    }
}
