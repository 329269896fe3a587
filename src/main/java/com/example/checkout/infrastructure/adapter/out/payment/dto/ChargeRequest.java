package com.example.checkout.infrastructure.adapter.out.payment.dto;

import java.math.BigDecimal;

/**
 * Request DTO for a payment charge.
 */
public record ChargeRequest(
        String orderId,
        BigDecimal amount,
        String currency,
        String paymentToken
) {
}
