package com.example.checkout.application.port.out;

import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.domain.model.Order;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound port publishing final order outcomes for bookkeeping.
 * Completed, rejected and payment-failed orders are all published.
 */
public interface AccountingPort {

    CompletableFuture<StepOutcome<Void>> publish(CorrelationId correlationId, Order order);
}
