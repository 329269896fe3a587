package com.example.checkout.infrastructure.adapter.out.shipping;

import com.example.checkout.application.port.out.ShippingPort;
import com.example.checkout.application.port.out.StepOutcome;
import com.example.checkout.domain.model.Address;
import com.example.checkout.domain.model.CartItem;
import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.infrastructure.adapter.out.CollaboratorFailures;
import com.example.checkout.infrastructure.adapter.out.shipping.dto.QuoteResponse;
import com.example.checkout.infrastructure.adapter.out.shipping.dto.ShipResponse;
import com.example.checkout.infrastructure.adapter.out.shipping.mapper.ShippingMapper;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

/**
 * Adapter for the shipping service: quotes during pricing, dispatch after payment.
 * Both operations share one time limiter.
 */
@Component
public class ShippingServiceAdapter implements ShippingPort {

    private static final Logger log = LoggerFactory.getLogger(ShippingServiceAdapter.class);
    private static final String SERVICE_NAME = "shipping";

    private final WebClient webClient;
    private final ShippingMapper mapper;

    public ShippingServiceAdapter(
            @Qualifier("shippingWebClient") WebClient webClient,
            ShippingMapper mapper) {
        this.webClient = webClient;
        this.mapper = mapper;
    }

    @Override
    @TimeLimiter(name = "shippingTL", fallbackMethod = "quoteFallback")
    public CompletableFuture<StepOutcome<ShippingQuote>> quote(
            CorrelationId correlationId, Address address, List<CartItem> items, String currency) {

        log.debug("[{}] Requesting shipping quote for {} item(s) to {}", correlationId, items.size(), address.country());

        return CollaboratorFailures.onErrorStatus(webClient.post()
                        .uri("/api/shipping/quote")
                        .header(CorrelationId.HEADER, correlationId.getValue())
                        .bodyValue(mapper.toQuoteRequest(address, items, currency))
                        .retrieve(), SERVICE_NAME)
                .bodyToMono(QuoteResponse.class)
                .map(response -> StepOutcome.success(mapper.toQuote(response)))
                .toFuture();
    }

    @Override
    @TimeLimiter(name = "shippingTL", fallbackMethod = "shipFallback")
    public CompletableFuture<StepOutcome<ShipmentResult>> ship(
            CorrelationId correlationId, OrderId orderId, Address address, List<CartItem> items) {

        log.debug("[{}] Dispatching shipment for order {}", correlationId, orderId);

        return CollaboratorFailures.onErrorStatus(webClient.post()
                        .uri("/api/shipping/ship")
                        .header(CorrelationId.HEADER, correlationId.getValue())
                        .bodyValue(mapper.toShipRequest(orderId, address, items))
                        .retrieve(), SERVICE_NAME)
                .bodyToMono(ShipResponse.class)
                .map(response -> StepOutcome.success(mapper.toShipment(response)))
                .toFuture();
    }

    @SuppressWarnings("unused")
    private CompletableFuture<StepOutcome<ShippingQuote>> quoteFallback(
            CorrelationId correlationId, Address address, List<CartItem> items, String currency,
            Throwable throwable) {

        StepOutcome<ShippingQuote> outcome = CollaboratorFailures.toOutcome(SERVICE_NAME, throwable);
        log.warn("[{}] Shipping quote failed: reason={}, message={}",
                correlationId, outcome.reason(), outcome.message());
        return CompletableFuture.completedFuture(outcome);
    }

    /**
     * Timeout while dispatching: the shipment may still have been created on the other side.
     */
    @SuppressWarnings("unused")
    private CompletableFuture<StepOutcome<ShipmentResult>> shipFallback(
            CorrelationId correlationId, OrderId orderId, Address address, List<CartItem> items,
            TimeoutException ex) {

        log.warn("[{}] Shipment dispatch for order {} timed out, outcome unknown", correlationId, orderId);
        return CompletableFuture.completedFuture(
                StepOutcome.timeout("Shipment dispatch timed out, the shipment may or may not exist"));
    }

    @SuppressWarnings("unused")
    private CompletableFuture<StepOutcome<ShipmentResult>> shipFallback(
            CorrelationId correlationId, OrderId orderId, Address address, List<CartItem> items,
            Throwable throwable) {

        StepOutcome<ShipmentResult> outcome = CollaboratorFailures.toOutcome(SERVICE_NAME, throwable);
        log.warn("[{}] Shipment dispatch for order {} failed: reason={}, message={}",
                correlationId, orderId, outcome.reason(), outcome.message());
        return CompletableFuture.completedFuture(outcome);
    }
}
