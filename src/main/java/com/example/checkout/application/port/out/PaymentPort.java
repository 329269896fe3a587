package com.example.checkout.application.port.out;

import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.domain.model.Money;
import com.example.checkout.domain.model.OrderId;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for payment operations.
 * Whether a charge fails is decided by the collaborator, not by the caller.
 */
public interface PaymentPort {

    String PAYMENT_DECLINED = "payment_declined";

    /**
     * Charges an amount against a payment token.
     * A declined charge yields a failure with reason {@link #PAYMENT_DECLINED}.
     *
     * @param correlationId correlation id of the inbound request
     * @param orderId       the order being paid
     * @param amount        the amount to charge
     * @param paymentToken  opaque payment method token
     * @return future containing the charge outcome
     */
    CompletableFuture<StepOutcome<PaymentResult>> charge(
            CorrelationId correlationId, OrderId orderId, Money amount, String paymentToken);

    /**
     * Reverses a previously successful charge.
     *
     * @param correlationId correlation id of the inbound request
     * @param transactionId the charge to reverse
     * @param amount        the amount originally charged
     * @return future containing the reversal outcome
     */
    CompletableFuture<StepOutcome<ReversalResult>> reverse(
            CorrelationId correlationId, String transactionId, Money amount);

    /**
     * Result of a successful charge.
     */
    record PaymentResult(String transactionId, Money charged) {
    }

    /**
     * Result of a successful reversal.
     */
    record ReversalResult(String reversalId) {
    }
}
