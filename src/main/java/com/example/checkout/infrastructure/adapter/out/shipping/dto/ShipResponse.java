package com.example.checkout.infrastructure.adapter.out.shipping.dto;

public record ShipResponse(
        String trackingId
) {
}
