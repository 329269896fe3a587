package com.example.checkout.infrastructure.adapter.out.accounting.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * Order outcome event published to accounting. Sent for every terminal status.
 */
public record OrderEventRequest(
        String orderId,
        String correlationId,
        String userId,
        String status,
        String reason,
        BigDecimal total,
        String currency,
        BigDecimal settlementTotal,
        String settlementCurrency,
        String transactionId,
        List<Line> lines,
        String createdAt
) {
    public record Line(
            String productId,
            int quantity,
            BigDecimal unitPrice
    ) {
    }
}
