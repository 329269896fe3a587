package com.example.checkout.infrastructure.adapter.out.shipping.dto;

import java.math.BigDecimal;

public record QuoteResponse(
        BigDecimal cost,
        String currency
) {
}
