package com.example.checkout.domain.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Correlation id of one inbound checkout request, forwarded on every outbound collaborator call.
 */
public final class CorrelationId {

    public static final String HEADER = "X-Correlation-Id";

    private final String value;

    private CorrelationId(String value) {
        this.value = value;
    }

    /**
     * Uses the given value, or generates a new id when it is null or blank.
     */
    public static CorrelationId ofNullable(String value) {
        if (value == null || value.isBlank()) {
            return generate();
        }
        return new CorrelationId(value.trim());
    }

    public static CorrelationId generate() {
        return new CorrelationId(UUID.randomUUID().toString().replace("-", ""));
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CorrelationId that = (CorrelationId) o;
        return Objects.equals(value, that.value);
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
