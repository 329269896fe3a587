package com.example.checkout.application.service;

import com.example.checkout.application.dto.CheckoutCommand;
import com.example.checkout.application.port.out.FraudDetectionPort.FraudVerdict;
import com.example.checkout.application.port.out.PaymentPort.PaymentResult;
import com.example.checkout.application.port.out.StepOutcome;
import com.example.checkout.domain.model.Money;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.domain.model.OrderLine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-request accumulator of step outcomes.
 * Owned by a single checkout execution; steps touch it one after another, so it is not synchronized.
 */
public final class OrderContext {

    public static final String FRAUD_FLAGGED = "fraud_flagged";
    public static final String INTERNAL_ERROR = "internal_error";

    private final OrderId orderId;
    private final CheckoutCommand command;
    private final Instant createdAt;

    private final Map<CheckoutStep, StepOutcome<?>> outcomes = new EnumMap<>(CheckoutStep.class);
    private final List<StepFailure> failures = new ArrayList<>();
    private StepFailure haltedBy;

    private List<OrderLine> lines = List.of();
    private Money shippingCost;
    private Money total;
    private Money settlementTotal;
    private PaymentResult payment;
    private String trackingId;

    private OrderContext(OrderId orderId, CheckoutCommand command, Instant createdAt) {
        this.orderId = Objects.requireNonNull(orderId, "OrderId cannot be null");
        this.command = Objects.requireNonNull(command, "Command cannot be null");
        this.createdAt = Objects.requireNonNull(createdAt, "CreatedAt cannot be null");
    }

    public static OrderContext start(CheckoutCommand command) {
        return new OrderContext(OrderId.generate(), command, Instant.now());
    }

    /**
     * Records the single outcome of a pipeline step.
     * A failure is classified by the step's policy, or as {@link FailureKind#DEADLINE_EXCEEDED}
     * when the request deadline cut the call short. Any non-tolerable failure halts the flow.
     *
     * @throws IllegalStateException if the step already has an outcome
     */
    public void record(CheckoutStep step, StepOutcome<?> outcome) {
        Objects.requireNonNull(outcome, "Outcome cannot be null");
        if (outcomes.containsKey(step)) {
            throw new IllegalStateException("Outcome already recorded for step " + step);
        }
        outcomes.put(step, outcome);

        if (outcome.isFailure()) {
            FailureKind kind = StepOutcome.DEADLINE_EXCEEDED.equals(outcome.reason())
                    ? FailureKind.DEADLINE_EXCEEDED
                    : step.failureKind();
            addFailure(new StepFailure(step, kind, step.collaborator(),
                    outcome.reason(), outcome.message(), outcome.retryable()));
        }
    }

    /**
     * Records every pipeline step that has no outcome yet as skipped by the deadline.
     */
    public void skipRemainingSteps() {
        for (CheckoutStep step : CheckoutStep.pipeline()) {
            if (!outcomes.containsKey(step)) {
                record(step, StepOutcome.deadlineExceeded());
            }
        }
    }

    /**
     * Marks the order as rejected by fraud screening.
     */
    public void rejectAsFraud(FraudVerdict verdict) {
        addFailure(new StepFailure(CheckoutStep.FRAUD_CHECK, FailureKind.FATAL,
                CheckoutStep.FRAUD_CHECK.collaborator(), FRAUD_FLAGGED, verdict.reason(), false));
    }

    /**
     * Halts the flow after an unexpected orchestrator error.
     */
    public void abort(Throwable cause) {
        addFailure(new StepFailure(null, FailureKind.FATAL, "checkout",
                INTERNAL_ERROR, cause.getMessage(), false));
    }

    private void addFailure(StepFailure failure) {
        failures.add(failure);
        if (haltedBy == null && failure.isFatal()) {
            haltedBy = failure;
        }
    }

    public void applyPricing(List<OrderLine> pricedLines, Money shipping) {
        this.lines = List.copyOf(pricedLines);
        this.shippingCost = shipping;
        this.total = pricedLines.stream()
                .map(OrderLine::lineTotal)
                .reduce(shipping, Money::add);
    }

    public void applySettlement(Money settled) {
        this.settlementTotal = settled;
    }

    public void applyPayment(PaymentResult result) {
        this.payment = result;
    }

    public void applyShipment(String shipmentTrackingId) {
        this.trackingId = shipmentTrackingId;
    }

    /**
     * The amount to charge: the settlement total when conversion succeeded, else the cart total.
     */
    public Money chargeAmount() {
        return settlementTotal != null ? settlementTotal : total;
    }

    public boolean isHalted() {
        return haltedBy != null;
    }

    public boolean isHaltedByDeadline() {
        return haltedBy != null && haltedBy.kind() == FailureKind.DEADLINE_EXCEEDED;
    }

    public Optional<StepOutcome<?>> outcomeOf(CheckoutStep step) {
        return Optional.ofNullable(outcomes.get(step));
    }

    public Map<CheckoutStep, StepOutcome<?>> getOutcomes() {
        return Collections.unmodifiableMap(outcomes);
    }

    public List<StepFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public OrderId getOrderId() {
        return orderId;
    }

    public CheckoutCommand getCommand() {
        return command;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public List<OrderLine> getLines() {
        return lines;
    }

    public Money getShippingCost() {
        return shippingCost;
    }

    public Money getTotal() {
        return total;
    }

    public Money getSettlementTotal() {
        return settlementTotal;
    }

    public PaymentResult getPayment() {
        return payment;
    }

    public String getTrackingId() {
        return trackingId;
    }
}
