package com.example.checkout.infrastructure.adapter.out.payment.dto;

import java.math.BigDecimal;

public record ReverseRequest(
        String transactionId,
        BigDecimal amount,
        String currency
) {
}
