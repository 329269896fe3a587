package com.example.checkout.application.service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of the checkout flow.
 *
 * @param deadline                request-wide time budget shared by every step
 * @param settlementCurrency      currency the charge is settled in
 * @param placeholderShippingCost shipping cost applied when no quote could be obtained
 */
public record CheckoutSettings(
        Duration deadline,
        String settlementCurrency,
        BigDecimal placeholderShippingCost
) {
    public CheckoutSettings {
        Objects.requireNonNull(deadline, "Deadline cannot be null");
        Objects.requireNonNull(settlementCurrency, "SettlementCurrency cannot be null");
        Objects.requireNonNull(placeholderShippingCost, "PlaceholderShippingCost cannot be null");
        if (deadline.isNegative() || deadline.isZero()) {
            throw new IllegalArgumentException("Deadline must be positive: " + deadline);
        }
        settlementCurrency = settlementCurrency.trim().toUpperCase();
    }
}
