package com.example.checkout.simulator;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed exchange rates relative to a base currency.
 */
public class CurrencyTable {

    private static final int RATE_SCALE = 10;

    private final String baseCurrency;
    private final Map<String, BigDecimal> rates;

    public CurrencyTable(String baseCurrency, Map<String, BigDecimal> rates) {
        this.baseCurrency = baseCurrency.toUpperCase();
        Map<String, BigDecimal> normalized = new HashMap<>();
        rates.forEach((currency, rate) -> normalized.put(currency.toUpperCase(), rate));
        normalized.put(this.baseCurrency, BigDecimal.ONE);
        this.rates = Map.copyOf(normalized);
    }

    public boolean supports(String currency) {
        return currency != null && rates.containsKey(currency.toUpperCase());
    }

    /**
     * Empty when either currency is unknown.
     */
    public Optional<BigDecimal> convert(BigDecimal amount, String from, String to) {
        if (!supports(from) || !supports(to)) {
            return Optional.empty();
        }
        BigDecimal inBase = amount.divide(rates.get(from.toUpperCase()), RATE_SCALE, RoundingMode.HALF_UP);
        return Optional.of(inBase.multiply(rates.get(to.toUpperCase())).setScale(2, RoundingMode.HALF_UP));
    }

    public String getBaseCurrency() {
        return baseCurrency;
    }
}
