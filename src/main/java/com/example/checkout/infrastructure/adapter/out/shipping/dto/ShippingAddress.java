package com.example.checkout.infrastructure.adapter.out.shipping.dto;

public record ShippingAddress(
        String streetAddress,
        String city,
        String state,
        String country,
        String zipCode
) {
}
