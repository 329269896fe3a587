package com.example.checkout.application.port.out;

import com.example.checkout.domain.model.Address;
import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.domain.model.Money;
import com.example.checkout.domain.model.OrderId;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for fraud screening of a charged order.
 */
public interface FraudDetectionPort {

    /**
     * Screens an order.
     *
     * @param correlationId correlation id of the inbound request
     * @param request       the order facts the collaborator scores
     * @return future containing the verdict
     */
    CompletableFuture<StepOutcome<FraudVerdict>> check(CorrelationId correlationId, FraudCheckRequest request);

    record FraudCheckRequest(
            OrderId orderId,
            String userId,
            Money amount,
            Address shippingAddress,
            long itemCount
    ) {
    }

    record FraudVerdict(
            boolean flagged,
            String reason,
            double score
    ) {
        public static FraudVerdict clear() {
            return new FraudVerdict(false, null, 0.0);
        }

        public static FraudVerdict flagged(String reason, double score) {
            return new FraudVerdict(true, reason, score);
        }
    }
}
