package com.example.checkout.application.port.out;

import com.example.checkout.domain.model.CorrelationId;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for the cart store.
 */
public interface CartPort {

    /**
     * Empties the user's stored cart once the order has been placed.
     */
    CompletableFuture<StepOutcome<Void>> emptyCart(CorrelationId correlationId, String userId);
}
