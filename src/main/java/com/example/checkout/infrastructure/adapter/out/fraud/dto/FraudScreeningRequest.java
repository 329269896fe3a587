package com.example.checkout.infrastructure.adapter.out.fraud.dto;

import java.math.BigDecimal;

/**
 * Request DTO for fraud screening.
 */
public record FraudScreeningRequest(
        String orderId,
        String userId,
        BigDecimal amount,
        String currency,
        String country,
        long itemCount
) {
}
