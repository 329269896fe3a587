package com.example.checkout.infrastructure.adapter.out.shipping.dto;

public record ShippingItem(
        String productId,
        int quantity
) {
}
