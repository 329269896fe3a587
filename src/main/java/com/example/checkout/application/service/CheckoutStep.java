package com.example.checkout.application.service;

import java.util.List;

/**
 * Steps of the checkout flow, with the collaborator each one calls and how its failure is treated.
 */
public enum CheckoutStep {

    PRICE_LOOKUP("catalog", "price-lookup", FailureKind.FATAL, null),
    SHIPPING_QUOTE("shipping", "shipping-quote", FailureKind.TOLERABLE,
            "Shipping quote unavailable, placeholder shipping cost applied"),
    CURRENCY_CONVERSION("currency", "currency-conversion", FailureKind.TOLERABLE,
            "Total not converted to the settlement currency, charged in the cart currency"),
    PAYMENT("payment", "payment", FailureKind.FATAL, null),
    FRAUD_CHECK("fraud-detection", "fraud-check", FailureKind.TOLERABLE,
            "Fraud screening unavailable, order was not screened"),
    SHIPMENT("shipping", "shipment", FailureKind.TOLERABLE,
            "Shipment not dispatched, it must be retried out of band"),

    // background tasks, never recorded into the order
    PAYMENT_REVERSAL("payment", "payment-reversal", FailureKind.TOLERABLE, null),
    EMAIL_CONFIRMATION("email", "email-confirmation", FailureKind.TOLERABLE, null),
    CART_CLEANUP("cart", "cart-cleanup", FailureKind.TOLERABLE, null),
    ACCOUNTING_PUBLISH("accounting", "accounting-publish", FailureKind.TOLERABLE, null);

    private static final List<CheckoutStep> PIPELINE = List.of(
            PRICE_LOOKUP, SHIPPING_QUOTE, CURRENCY_CONVERSION, PAYMENT, FRAUD_CHECK, SHIPMENT);

    private final String collaborator;
    private final String spanName;
    private final FailureKind failureKind;
    private final String warningMessage;

    CheckoutStep(String collaborator, String spanName, FailureKind failureKind, String warningMessage) {
        this.collaborator = collaborator;
        this.spanName = spanName;
        this.failureKind = failureKind;
        this.warningMessage = warningMessage;
    }

    /**
     * Steps whose outcome is recorded into the order, in execution order.
     */
    public static List<CheckoutStep> pipeline() {
        return PIPELINE;
    }

    public String collaborator() {
        return collaborator;
    }

    public String spanName() {
        return spanName;
    }

    public FailureKind failureKind() {
        return failureKind;
    }

    public String warningMessage() {
        return warningMessage;
    }
}
