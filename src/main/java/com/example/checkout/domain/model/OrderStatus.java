package com.example.checkout.domain.model;

/**
 * Terminal status of a checkout attempt.
 */
public enum OrderStatus {

    /**
     * Every step succeeded.
     */
    COMPLETED("Completed"),

    /**
     * Payment succeeded and the order stands, but at least one tolerable step failed.
     */
    COMPLETED_WITH_WARNINGS("CompletedWithWarnings"),

    /**
     * The payment collaborator refused or failed the charge.
     */
    PAYMENT_FAILED("PaymentFailed"),

    /**
     * Catalog miss, fraud flag or an exhausted request deadline.
     */
    REJECTED("Rejected");

    private final String label;

    OrderStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isCompleted() {
        return this == COMPLETED || this == COMPLETED_WITH_WARNINGS;
    }
}
