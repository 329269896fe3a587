package com.example.checkout.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Final artifact of one checkout attempt. Produced once per request and never mutated.
 *
 * @param orderId         identifier assigned at request entry
 * @param correlationId   correlation id of the inbound request
 * @param userId          the purchasing user
 * @param status          terminal status
 * @param rejectionReason reason code for {@link OrderStatus#REJECTED} and {@link OrderStatus#PAYMENT_FAILED}, else null
 * @param lines           priced cart lines (empty when pricing never completed)
 * @param shippingCost    quoted or placeholder shipping cost, null when pricing never completed
 * @param total           itemized total in the request currency, only present for completed orders
 * @param settlementTotal total in the settlement currency, only present when conversion succeeded
 * @param converted       whether the total was converted to the settlement currency
 * @param transactionId   payment transaction id, null when no charge succeeded
 * @param trackingId      shipment tracking id, null when no shipment was dispatched
 * @param warnings        tolerable failures, in step order
 * @param createdAt       when the request entered the orchestrator
 */
public record Order(
        OrderId orderId,
        CorrelationId correlationId,
        String userId,
        OrderStatus status,
        String rejectionReason,
        List<OrderLine> lines,
        Money shippingCost,
        Money total,
        Money settlementTotal,
        boolean converted,
        String transactionId,
        String trackingId,
        List<Warning> warnings,
        Instant createdAt
) {
    public Order {
        Objects.requireNonNull(orderId, "OrderId cannot be null");
        Objects.requireNonNull(status, "Status cannot be null");
        Objects.requireNonNull(createdAt, "CreatedAt cannot be null");
        lines = List.copyOf(lines);
        warnings = List.copyOf(warnings);
    }
}
