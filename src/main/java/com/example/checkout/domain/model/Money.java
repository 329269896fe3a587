package com.example.checkout.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Value Object representing a monetary amount in an ISO-4217 currency.
 */
public final class Money {

    private static final int SCALE = 2;

    private final BigDecimal amount;
    private final String currency;

    private Money(BigDecimal amount, String currency) {
        this.amount = amount.setScale(SCALE, RoundingMode.HALF_UP);
        this.currency = Objects.requireNonNull(currency, "Currency cannot be null");
    }

    /**
     * Creates Money with the specified amount and currency.
     *
     * @param amount   the monetary amount
     * @param currency the currency code, normalized to upper case
     * @return new Money instance
     * @throws IllegalArgumentException if amount is negative or currency is blank
     */
    public static Money of(BigDecimal amount, String currency) {
        Objects.requireNonNull(amount, "Amount cannot be null");
        Objects.requireNonNull(currency, "Currency cannot be null");
        if (amount.compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalArgumentException("Amount cannot be negative: " + amount);
        }
        if (currency.isBlank()) {
            throw new IllegalArgumentException("Currency cannot be blank");
        }
        return new Money(amount, currency.trim().toUpperCase());
    }

    public static Money of(String amount, String currency) {
        return of(new BigDecimal(amount), currency);
    }

    public static Money zero(String currency) {
        return of(BigDecimal.ZERO, currency);
    }

    /**
     * Adds another Money to this one.
     *
     * @throws IllegalArgumentException if currencies don't match
     */
    public Money add(Money other) {
        Objects.requireNonNull(other, "Cannot add null Money");
        if (!isSameCurrency(other)) {
            throw new IllegalArgumentException(
                    "Cannot add Money with different currencies: " + this.currency + " vs " + other.currency);
        }
        return new Money(this.amount.add(other.amount), this.currency);
    }

    /**
     * Multiplies this Money by a quantity.
     *
     * @throws IllegalArgumentException if quantity is negative
     */
    public Money multiply(int quantity) {
        if (quantity < 0) {
            throw new IllegalArgumentException("Quantity cannot be negative: " + quantity);
        }
        return new Money(this.amount.multiply(BigDecimal.valueOf(quantity)), this.currency);
    }

    public boolean isSameCurrency(Money other) {
        return other != null && currency.equals(other.currency);
    }

    public boolean isIn(String currencyCode) {
        return currencyCode != null && currency.equalsIgnoreCase(currencyCode.trim());
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public String getCurrency() {
        return currency;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Money money = (Money) o;
        return amount.compareTo(money.amount) == 0 && Objects.equals(currency, money.currency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount, currency);
    }

    @Override
    public String toString() {
        return amount.toPlainString() + " " + currency;
    }
}
