package com.example.checkout.application.dto;

import com.example.checkout.domain.model.Address;
import com.example.checkout.domain.model.CartItem;
import com.example.checkout.domain.model.CorrelationId;

import java.util.List;
import java.util.Objects;

/**
 * Validated checkout request handed to the orchestrator.
 *
 * @param email optional; no confirmation is sent when absent
 */
public record CheckoutCommand(
        CorrelationId correlationId,
        String userId,
        List<CartItem> items,
        Address shippingAddress,
        String paymentToken,
        String currency,
        String email
) {
    public CheckoutCommand {
        Objects.requireNonNull(correlationId, "CorrelationId cannot be null");
        Objects.requireNonNull(userId, "UserId cannot be null");
        Objects.requireNonNull(items, "Items cannot be null");
        Objects.requireNonNull(shippingAddress, "ShippingAddress cannot be null");
        Objects.requireNonNull(paymentToken, "PaymentToken cannot be null");
        Objects.requireNonNull(currency, "Currency cannot be null");
        if (userId.isBlank()) {
            throw new IllegalArgumentException("UserId cannot be blank");
        }
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cart cannot be empty");
        }
        if (paymentToken.isBlank()) {
            throw new IllegalArgumentException("PaymentToken cannot be blank");
        }
        if (currency.isBlank()) {
            throw new IllegalArgumentException("Currency cannot be blank");
        }
        items = List.copyOf(items);
        currency = currency.trim().toUpperCase();
    }
}
