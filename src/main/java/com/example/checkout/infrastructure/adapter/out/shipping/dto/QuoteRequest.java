package com.example.checkout.infrastructure.adapter.out.shipping.dto;

import java.util.List;

/**
 * Request DTO for a shipping quote.
 */
public record QuoteRequest(
        ShippingAddress address,
        List<ShippingItem> items,
        String currency
) {
}
