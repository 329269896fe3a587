package com.example.checkout.infrastructure.adapter.in.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Request DTO for a checkout via REST API.
 */
public record CheckoutRequest(
        @NotBlank(message = "User id is required")
        String userId,

        @NotEmpty(message = "Cart cannot be empty")
        List<@NotNull(message = "Cart item cannot be null") @Valid CartItemRequest> items,

        @NotNull(message = "Shipping address is required")
        @Valid
        AddressRequest shippingAddress,

        @NotBlank(message = "Payment token is required")
        String paymentToken,

        @NotBlank(message = "Currency is required")
        @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency must be an ISO-4217 code")
        String currency,

        @Email(message = "Invalid e-mail address")
        String email
) {
    public record CartItemRequest(
            @NotBlank(message = "Product id is required")
            String productId,

            @Positive(message = "Quantity must be positive")
            int quantity
    ) {}

    public record AddressRequest(
            @NotBlank(message = "Street address is required")
            String streetAddress,

            @NotBlank(message = "City is required")
            String city,

            String state,

            @NotBlank(message = "Country is required")
            String country,

            String zipCode
    ) {}
}
