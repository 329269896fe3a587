package com.example.checkout.infrastructure.adapter.out.currency.dto;

import java.math.BigDecimal;

public record ConversionResponse(
        BigDecimal amount,
        String currency
) {
}
