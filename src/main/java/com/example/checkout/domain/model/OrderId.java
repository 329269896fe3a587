package com.example.checkout.domain.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Identifier assigned to a checkout attempt when it enters the orchestrator.
 * Every attempt gets one, including attempts that end up rejected.
 */
public final class OrderId {

    private final String value;

    private OrderId(String value) {
        this.value = value;
    }

    public static OrderId generate() {
        return new OrderId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderId other)) return false;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
