package com.example.checkout.unit.application;

import com.example.checkout.application.port.out.StepOutcome;
import com.example.checkout.application.service.BackgroundTaskDispatcher;
import com.example.checkout.application.service.CheckoutStep;
import com.example.checkout.application.service.CheckoutTelemetry;
import com.example.checkout.domain.model.CorrelationId;
import io.micrometer.observation.tck.TestObservationRegistry;
import io.micrometer.observation.tck.TestObservationRegistryAssert;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BackgroundTaskDispatcher Tests")
class BackgroundTaskDispatcherTest {

    private final TestObservationRegistry registry = TestObservationRegistry.create();
    private final CheckoutTelemetry telemetry = new CheckoutTelemetry(registry);

    @Test
    @DisplayName("should_run_task_and_observe_its_outcome")
    void should_run_task_and_observe_its_outcome() {
        BackgroundTaskDispatcher dispatcher = new BackgroundTaskDispatcher(Runnable::run, telemetry);
        AtomicInteger calls = new AtomicInteger();

        dispatcher.dispatch(CheckoutStep.ACCOUNTING_PUBLISH, CorrelationId.generate(), () -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(StepOutcome.<Void>failure(StepOutcome.UNAVAILABLE, "503", true));
        });

        assertThat(calls).hasValue(1);
        TestObservationRegistryAssert.assertThat(registry)
                .hasObservationWithNameEqualTo(CheckoutTelemetry.CHECKOUT_TASK)
                .that()
                .hasLowCardinalityKeyValue(CheckoutTelemetry.KEY_STEP, "accounting-publish")
                .hasLowCardinalityKeyValue(CheckoutTelemetry.KEY_OUTCOME, StepOutcome.UNAVAILABLE)
                .hasBeenStopped();
    }

    @Test
    @DisplayName("should_swallow_task_that_throws")
    void should_swallow_task_that_throws() {
        BackgroundTaskDispatcher dispatcher = new BackgroundTaskDispatcher(Runnable::run, telemetry);

        assertThatCode(() -> dispatcher.<StepOutcome<Void>>dispatch(
                CheckoutStep.EMAIL_CONFIRMATION, CorrelationId.generate(), () -> {
                    throw new IllegalStateException("smtp down");
                }))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should_not_block_caller_when_executor_rejects")
    void should_not_block_caller_when_executor_rejects() {
        Executor saturated = task -> {
            throw new RejectedExecutionException("queue full");
        };
        BackgroundTaskDispatcher dispatcher = new BackgroundTaskDispatcher(saturated, telemetry);
        AtomicInteger calls = new AtomicInteger();

        assertThatCode(() -> dispatcher.dispatch(CheckoutStep.CART_CLEANUP, CorrelationId.generate(), () -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(StepOutcome.<Void>success(null));
        })).doesNotThrowAnyException();
        assertThat(calls).hasValue(0);
    }
}
