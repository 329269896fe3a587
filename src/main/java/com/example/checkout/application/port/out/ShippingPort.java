package com.example.checkout.application.port.out;

import com.example.checkout.domain.model.Address;
import com.example.checkout.domain.model.CartItem;
import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.domain.model.Money;
import com.example.checkout.domain.model.OrderId;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for shipping quotes and shipment dispatch.
 */
public interface ShippingPort {

    /**
     * Requests a shipping quote for the given items.
     *
     * @param correlationId correlation id of the inbound request
     * @param address       destination
     * @param items         the items to ship
     * @param currency      the currency the quote should be expressed in
     * @return future containing the quote outcome
     */
    CompletableFuture<StepOutcome<ShippingQuote>> quote(
            CorrelationId correlationId, Address address, List<CartItem> items, String currency);

    /**
     * Dispatches a shipment for a paid order.
     *
     * @param correlationId correlation id of the inbound request
     * @param orderId       the order being shipped
     * @param address       destination
     * @param items         the items to ship
     * @return future containing the dispatch outcome
     */
    CompletableFuture<StepOutcome<ShipmentResult>> ship(
            CorrelationId correlationId, OrderId orderId, Address address, List<CartItem> items);

    /**
     * Shipping cost quoted by the collaborator.
     */
    record ShippingQuote(Money cost) {
    }

    /**
     * Result of a dispatched shipment.
     */
    record ShipmentResult(String trackingId) {
    }
}
