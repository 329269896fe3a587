package com.example.checkout.domain.model;

import java.util.Objects;

/**
 * A priced cart entry: quantity times the catalog unit price.
 */
public record OrderLine(
        ProductId productId,
        int quantity,
        Money unitPrice,
        Money lineTotal
) {
    public OrderLine {
        Objects.requireNonNull(productId, "ProductId cannot be null");
        Objects.requireNonNull(unitPrice, "UnitPrice cannot be null");
        Objects.requireNonNull(lineTotal, "LineTotal cannot be null");
    }
}
