package com.example.checkout.simulator;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

/**
 * Settings of the in-process collaborators.
 *
 * @param catalog         product id → unit price in {@code catalogCurrency}
 * @param currencyRates   currency → units per one {@code baseCurrency}
 * @param fraudThreshold  amounts above this, in {@code baseCurrency}, are flagged; must be positive
 * @param historyCapacity how many payments, ledger entries and e-mails each simulator remembers
 * @param seed            seed of the failure policies' random source, unseeded when null
 */
@ConfigurationProperties(prefix = "simulator")
public record SimulatorProperties(
        Map<String, BigDecimal> catalog,
        @DefaultValue("USD") String catalogCurrency,
        @DefaultValue("USD") String baseCurrency,
        Map<String, BigDecimal> currencyRates,
        @DefaultValue("4.99") BigDecimal shippingFlatRate,
        @DefaultValue("0.50") BigDecimal shippingPerItem,
        @DefaultValue("0.0") double paymentFailureRate,
        @DefaultValue("0.0") double shippingFailureRate,
        @DefaultValue("0.0") double fraudDetectionFailureRate,
        @DefaultValue("5000") BigDecimal fraudThreshold,
        @DefaultValue("0ms") Duration latency,
        @DefaultValue("1000") int historyCapacity,
        Long seed
) {
    public SimulatorProperties {
        catalog = catalog != null ? Map.copyOf(catalog) : Map.of();
        currencyRates = currencyRates != null ? Map.copyOf(currencyRates) : Map.of();
        if (fraudThreshold == null || fraudThreshold.signum() <= 0) {
            throw new IllegalArgumentException("Fraud threshold must be positive: " + fraudThreshold);
        }
        if (historyCapacity <= 0) {
            throw new IllegalArgumentException("History capacity must be positive: " + historyCapacity);
        }
    }
}
