package com.example.checkout.infrastructure.adapter.out.shipping.dto;

import java.util.List;

/**
 * Request DTO for dispatching a shipment.
 */
public record ShipRequest(
        String orderId,
        ShippingAddress address,
        List<ShippingItem> items
) {
}
