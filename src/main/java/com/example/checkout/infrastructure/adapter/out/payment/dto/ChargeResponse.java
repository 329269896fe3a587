package com.example.checkout.infrastructure.adapter.out.payment.dto;

import java.math.BigDecimal;

/**
 * Response DTO from the payment charge endpoint. {@code status} is {@code APPROVED} or {@code DECLINED}.
 */
public record ChargeResponse(
        String transactionId,
        String status,
        BigDecimal amount,
        String currency,
        String message
) {
}
