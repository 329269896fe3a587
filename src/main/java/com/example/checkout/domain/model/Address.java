package com.example.checkout.domain.model;

import java.util.Objects;

/**
 * Shipping address of a checkout request.
 */
public record Address(
        String streetAddress,
        String city,
        String state,
        String country,
        String zipCode
) {
    public Address {
        Objects.requireNonNull(streetAddress, "StreetAddress cannot be null");
        Objects.requireNonNull(city, "City cannot be null");
        Objects.requireNonNull(country, "Country cannot be null");
        if (streetAddress.isBlank() || city.isBlank() || country.isBlank()) {
            throw new IllegalArgumentException("Address requires street, city and country");
        }
    }

    @Override
    public String toString() {
        return streetAddress + ", " + city + (state != null ? ", " + state : "")
                + ", " + country + (zipCode != null ? " " + zipCode : "");
    }
}
