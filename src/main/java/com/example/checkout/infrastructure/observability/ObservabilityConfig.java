package com.example.checkout.infrastructure.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ObservabilityConfig {

    @Bean(destroyMethod = "shutdown")
    public Observability observability(
            @Value("${spring.application.name:checkout-service}") String serviceName,
            @Value("${observability.service-version:1.0.0}") String serviceVersion,
            @Value("${observability.environment:local}") String environment,
            @Value("${observability.log-observations:false}") boolean logObservations,
            MeterRegistry meterRegistry) {
        return Observability.init(serviceName,
                new ObservabilitySettings(serviceVersion, environment, logObservations), meterRegistry);
    }
}
