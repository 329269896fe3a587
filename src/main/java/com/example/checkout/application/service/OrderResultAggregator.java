package com.example.checkout.application.service;

import com.example.checkout.application.port.out.StepOutcome;
import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderStatus;
import com.example.checkout.domain.model.Warning;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Builds the final {@link Order} from an {@link OrderContext}.
 * Pure function of the context: the same recorded outcomes always give an equal order.
 *
 * <p>Status derivation, first match wins:
 * <ol>
 *     <li>payment failed → {@code PaymentFailed}</li>
 *     <li>fraud flagged → {@code Rejected}</li>
 *     <li>catalog lookup failed → {@code Rejected}</li>
 *     <li>deadline exceeded, or any other fatal failure → {@code Rejected}</li>
 *     <li>any tolerable failure → {@code CompletedWithWarnings}</li>
 *     <li>otherwise → {@code Completed}</li>
 * </ol>
 */
@Component
public class OrderResultAggregator {

    public Order aggregate(OrderContext context) {
        List<StepFailure> failures = context.getFailures();
        Resolution resolution = resolve(failures);
        boolean completed = resolution.status().isCompleted();

        List<Warning> warnings = failures.stream()
                .filter(failure -> failure.kind() == FailureKind.TOLERABLE)
                .map(this::toWarning)
                .toList();

        return new Order(
                context.getOrderId(),
                context.getCommand().correlationId(),
                context.getCommand().userId(),
                resolution.status(),
                resolution.reason(),
                context.getLines(),
                context.getShippingCost(),
                completed ? context.getTotal() : null,
                completed ? context.getSettlementTotal() : null,
                context.getSettlementTotal() != null,
                context.getPayment() != null ? context.getPayment().transactionId() : null,
                context.getTrackingId(),
                warnings,
                context.getCreatedAt()
        );
    }

    private Resolution resolve(List<StepFailure> failures) {
        Optional<StepFailure> paymentFailure = first(failures, failure ->
                failure.step() == CheckoutStep.PAYMENT && failure.kind() == FailureKind.FATAL);
        if (paymentFailure.isPresent()) {
            return new Resolution(OrderStatus.PAYMENT_FAILED, paymentFailure.get().reason());
        }

        if (first(failures, failure -> OrderContext.FRAUD_FLAGGED.equals(failure.reason())).isPresent()) {
            return new Resolution(OrderStatus.REJECTED, OrderContext.FRAUD_FLAGGED);
        }

        Optional<StepFailure> catalogFailure = first(failures, failure ->
                failure.step() == CheckoutStep.PRICE_LOOKUP && failure.kind() == FailureKind.FATAL);
        if (catalogFailure.isPresent()) {
            return new Resolution(OrderStatus.REJECTED, catalogFailure.get().reason());
        }

        if (first(failures, failure -> failure.kind() == FailureKind.DEADLINE_EXCEEDED).isPresent()) {
            return new Resolution(OrderStatus.REJECTED, StepOutcome.DEADLINE_EXCEEDED);
        }

        Optional<StepFailure> otherFatal = first(failures, StepFailure::isFatal);
        if (otherFatal.isPresent()) {
            return new Resolution(OrderStatus.REJECTED, otherFatal.get().reason());
        }

        if (!failures.isEmpty()) {
            return new Resolution(OrderStatus.COMPLETED_WITH_WARNINGS, null);
        }
        return new Resolution(OrderStatus.COMPLETED, null);
    }

    private Warning toWarning(StepFailure failure) {
        String message = failure.step() != null && failure.step().warningMessage() != null
                ? failure.step().warningMessage()
                : failure.message();
        return new Warning(failure.collaborator(), failure.reason(), message, failure.retryable());
    }

    private static Optional<StepFailure> first(List<StepFailure> failures, Predicate<StepFailure> predicate) {
        return failures.stream().filter(predicate).findFirst();
    }

    private record Resolution(OrderStatus status, String reason) {
    }
}
