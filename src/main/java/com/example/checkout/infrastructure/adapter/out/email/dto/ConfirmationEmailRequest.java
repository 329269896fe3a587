package com.example.checkout.infrastructure.adapter.out.email.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * Request DTO for the order confirmation e-mail.
 */
public record ConfirmationEmailRequest(
        String to,
        String orderId,
        String status,
        BigDecimal total,
        String currency,
        String trackingId,
        List<String> warnings
) {
}
