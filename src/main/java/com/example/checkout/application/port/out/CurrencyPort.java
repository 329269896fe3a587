package com.example.checkout.application.port.out;

import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.domain.model.Money;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for currency conversion.
 */
public interface CurrencyPort {

    /**
     * Converts an amount into the target currency.
     *
     * @param correlationId correlation id of the inbound request
     * @param amount        the amount to convert
     * @param toCurrency    target ISO-4217 code
     * @return future containing the converted amount
     */
    CompletableFuture<StepOutcome<Money>> convert(CorrelationId correlationId, Money amount, String toCurrency);
}
