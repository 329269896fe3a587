package com.example.checkout.application.service;

import com.example.checkout.application.port.out.StepOutcome;
import com.example.checkout.domain.model.CorrelationId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Runs post-order tasks (reversal, e-mail, cart cleanup, accounting) off the response path.
 * Task results are only logged; nothing flows back into the order.
 */
public class BackgroundTaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BackgroundTaskDispatcher.class);

    private final Executor executor;
    private final CheckoutTelemetry telemetry;

    public BackgroundTaskDispatcher(Executor executor, CheckoutTelemetry telemetry) {
        this.executor = executor;
        this.telemetry = telemetry;
    }

    public <T extends StepOutcome<?>> void dispatch(CheckoutStep task, CorrelationId correlationId,
                                                    Supplier<CompletableFuture<T>> call) {
        try {
            executor.execute(() -> run(task, correlationId, call));
        } catch (RejectedExecutionException e) {
            log.warn("[{}] Background task {} rejected by executor: {}",
                    correlationId, task.spanName(), e.getMessage());
        }
    }

    private <T extends StepOutcome<?>> void run(CheckoutStep task, CorrelationId correlationId,
                                                Supplier<CompletableFuture<T>> call) {
        CompletableFuture<T> future;
        try {
            future = telemetry.observeTask(task, call);
        } catch (RuntimeException e) {
            log.warn("[{}] Background task {} could not be started: {}",
                    correlationId, task.spanName(), e.getMessage());
            return;
        }

        future.whenComplete((outcome, throwable) -> {
            if (throwable != null) {
                log.warn("[{}] Background task {} failed: {}",
                        correlationId, task.spanName(), throwable.getMessage());
            } else if (outcome.isFailure()) {
                log.warn("[{}] Background task {} failed on {}: reason={}, retryable={}, message={}",
                        correlationId, task.spanName(), task.collaborator(),
                        outcome.reason(), outcome.retryable(), outcome.message());
            } else {
                log.debug("[{}] Background task {} succeeded", correlationId, task.spanName());
            }
        });
    }
}
