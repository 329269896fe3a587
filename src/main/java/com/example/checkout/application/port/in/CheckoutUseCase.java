package com.example.checkout.application.port.in;

import com.example.checkout.application.dto.CheckoutCommand;
import com.example.checkout.domain.model.Order;

import java.util.concurrent.CompletableFuture;

/**
 * Inbound port for placing an order.
 */
public interface CheckoutUseCase {

    /**
     * Runs the checkout flow for a validated command.
     * The returned future always completes with an {@link Order}; downstream failures are
     * reflected in its status and warnings rather than as exceptions.
     *
     * @param command the checkout command
     * @return future containing the final order
     */
    CompletableFuture<Order> checkout(CheckoutCommand command);
}
