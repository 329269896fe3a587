package com.example.checkout.domain.model;

import java.util.Objects;

/**
 * Value Object representing a catalog product identifier.
 * The catalog owns the id format; only blank ids are rejected here.
 */
public final class ProductId {

    private final String value;

    private ProductId(String value) {
        this.value = value;
    }

    /**
     * Creates a new ProductId with the given value.
     *
     * @param value product id string
     * @return new ProductId instance
     * @throws IllegalArgumentException if value is null or blank
     */
    public static ProductId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ProductId cannot be blank");
        }
        return new ProductId(value.trim());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProductId productId = (ProductId) o;
        return Objects.equals(value, productId.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
