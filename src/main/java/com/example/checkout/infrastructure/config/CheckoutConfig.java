package com.example.checkout.infrastructure.config;

import com.example.checkout.application.service.BackgroundTaskDispatcher;
import com.example.checkout.application.service.CheckoutSettings;
import com.example.checkout.application.service.CheckoutTelemetry;
import com.example.checkout.infrastructure.observability.Observability;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Wiring of the checkout flow's settings, telemetry and background executor.
 */
@Configuration
public class CheckoutConfig {

    @Bean
    public CheckoutSettings checkoutSettings(
            @Value("${checkout.deadline:10s}") Duration deadline,
            @Value("${checkout.settlement-currency:USD}") String settlementCurrency,
            @Value("${checkout.shipping.placeholder-cost:0.00}") BigDecimal placeholderShippingCost) {
        return new CheckoutSettings(deadline, settlementCurrency, placeholderShippingCost);
    }

    @Bean
    public CheckoutTelemetry checkoutTelemetry(Observability observability) {
        return new CheckoutTelemetry(observability.observationRegistry());
    }

    @Bean(name = "backgroundTaskExecutor")
    public ThreadPoolTaskExecutor backgroundTaskExecutor(
            @Value("${checkout.background.pool-size:4}") int poolSize,
            @Value("${checkout.background.queue-capacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("checkout-bg-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
        return executor;
    }

    @Bean
    public BackgroundTaskDispatcher backgroundTaskDispatcher(
            @Qualifier("backgroundTaskExecutor") Executor executor,
            CheckoutTelemetry telemetry) {
        return new BackgroundTaskDispatcher(executor, telemetry);
    }
}
