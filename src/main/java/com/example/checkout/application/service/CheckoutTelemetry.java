package com.example.checkout.application.service;

import com.example.checkout.application.port.out.StepOutcome;
import com.example.checkout.domain.model.Order;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Micrometer observations for the checkout flow: one {@value #CHECKOUT} observation per request,
 * one {@value #CHECKOUT_STEP} observation per pipeline step and one {@value #CHECKOUT_TASK}
 * observation per background task.
 */
public class CheckoutTelemetry {

    public static final String CHECKOUT = "checkout";
    public static final String CHECKOUT_STEP = "checkout.step";
    public static final String CHECKOUT_TASK = "checkout.task";

    public static final String KEY_STEP = "step";
    public static final String KEY_COLLABORATOR = "collaborator";
    public static final String KEY_OUTCOME = "outcome";
    public static final String KEY_ORDER_STATUS = "order.status";

    private static final String SUCCESS = "success";

    private final ObservationRegistry registry;

    public CheckoutTelemetry(ObservationRegistry registry) {
        this.registry = registry;
    }

    public Observation startCheckout(OrderContext context) {
        return Observation.createNotStarted(CHECKOUT, registry)
                .contextualName(CHECKOUT)
                .lowCardinalityKeyValue("currency", context.getCommand().currency())
                .highCardinalityKeyValue("order.id", context.getOrderId().getValue())
                .highCardinalityKeyValue("correlation.id", context.getCommand().correlationId().getValue())
                .start();
    }

    public void finishCheckout(Observation observation, Order order) {
        observation.lowCardinalityKeyValue(KEY_ORDER_STATUS, order.status().label());
        if (order.rejectionReason() != null) {
            observation.lowCardinalityKeyValue("order.reason", order.rejectionReason());
        }
        observation.stop();
    }

    public void failCheckout(Observation observation, Throwable error) {
        observation.error(error);
    }

    /**
     * Observes one pipeline step as a child of the request observation.
     * The step outcome is attached when the returned future completes.
     */
    public <T> CompletableFuture<StepOutcome<T>> observeStep(
            CheckoutStep step, Observation parent, Supplier<CompletableFuture<StepOutcome<T>>> call) {
        Observation observation = Observation.createNotStarted(CHECKOUT_STEP, registry)
                .parentObservation(parent)
                .contextualName(step.spanName());
        return observe(observation, step, call);
    }

    /**
     * Observes a background task. Tasks outlive the request, so they get no parent.
     */
    public <T extends StepOutcome<?>> CompletableFuture<T> observeTask(
            CheckoutStep task, Supplier<? extends CompletableFuture<T>> call) {
        Observation observation = Observation.createNotStarted(CHECKOUT_TASK, registry)
                .contextualName(task.spanName());
        return observe(observation, task, call);
    }

    private <T extends StepOutcome<?>> CompletableFuture<T> observe(
            Observation observation, CheckoutStep step, Supplier<? extends CompletableFuture<T>> call) {
        observation.lowCardinalityKeyValue(KEY_STEP, step.spanName())
                .lowCardinalityKeyValue(KEY_COLLABORATOR, step.collaborator())
                .start();

        CompletableFuture<T> future;
        try (Observation.Scope ignored = observation.openScope()) {
            future = call.get();
            if (future == null) {
                future = CompletableFuture.failedFuture(
                        new IllegalStateException("No result returned by " + step.collaborator()));
            }
        } catch (RuntimeException e) {
            observation.lowCardinalityKeyValue(KEY_OUTCOME, StepOutcome.ERROR);
            observation.error(e);
            observation.stop();
            throw e;
        }

        return future.whenComplete((outcome, throwable) -> {
            if (throwable != null) {
                observation.lowCardinalityKeyValue(KEY_OUTCOME, StepOutcome.ERROR);
                observation.error(throwable);
            } else {
                observation.lowCardinalityKeyValue(KEY_OUTCOME, outcome.success() ? SUCCESS : outcome.reason());
                if (outcome.isFailure()) {
                    observation.highCardinalityKeyValue("failure.message", String.valueOf(outcome.message()));
                }
            }
            observation.stop();
        });
    }
}
