package com.example.checkout.infrastructure.adapter.in.web.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Response DTO for a checkout. Every outcome, including rejections, is rendered with this shape.
 */
public record CheckoutResponse(
        String orderId,
        String correlationId,
        String status,
        String reason,
        List<LineResponse> lines,
        AmountResponse shippingCost,
        AmountResponse total,
        AmountResponse settlementTotal,
        boolean converted,
        String transactionId,
        String trackingId,
        List<WarningResponse> warnings,
        Instant createdAt
) {
    public record LineResponse(
            String productId,
            int quantity,
            AmountResponse unitPrice,
            AmountResponse lineTotal
    ) {}

    public record AmountResponse(
            BigDecimal amount,
            String currency
    ) {}

    public record WarningResponse(
            String collaborator,
            String reason,
            String message,
            boolean retryable
    ) {}
}
