package com.example.checkout.infrastructure.adapter.out.currency.dto;

import java.math.BigDecimal;

/**
 * Request DTO for currency conversion.
 */
public record ConversionRequest(
        BigDecimal amount,
        String from,
        String to
) {
}
