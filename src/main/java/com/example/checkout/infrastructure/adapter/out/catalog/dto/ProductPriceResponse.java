package com.example.checkout.infrastructure.adapter.out.catalog.dto;

import java.math.BigDecimal;

/**
 * Response DTO from the catalog price endpoint.
 */
public record ProductPriceResponse(
        String productId,
        BigDecimal price,
        String currency
) {
}
