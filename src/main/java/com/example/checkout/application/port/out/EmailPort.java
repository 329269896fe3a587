package com.example.checkout.application.port.out;

import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.domain.model.Order;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for order confirmation e-mails.
 */
public interface EmailPort {

    CompletableFuture<StepOutcome<Void>> sendConfirmation(CorrelationId correlationId, String email, Order order);
}
