package com.example.checkout.simulator;

import com.example.checkout.infrastructure.adapter.out.shipping.dto.QuoteRequest;
import com.example.checkout.infrastructure.adapter.out.shipping.dto.QuoteResponse;
import com.example.checkout.infrastructure.adapter.out.shipping.dto.ShipRequest;
import com.example.checkout.infrastructure.adapter.out.shipping.dto.ShipResponse;
import com.example.checkout.infrastructure.adapter.out.shipping.dto.ShippingItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Flat-rate shipping: a base fee plus a per-item fee, quoted in the base currency and converted.
 */
@RestController
@Profile("simulator")
@RequestMapping("/api/shipping")
public class SimulatedShippingController {

    private static final Logger log = LoggerFactory.getLogger(SimulatedShippingController.class);

    private final SimulatorProperties properties;
    private final CurrencyTable currencyTable;
    private final FailurePolicy failurePolicy;

    public SimulatedShippingController(
            SimulatorProperties properties,
            CurrencyTable currencyTable,
            @Qualifier("shippingFailurePolicy") FailurePolicy failurePolicy) {
        this.properties = properties;
        this.currencyTable = currencyTable;
        this.failurePolicy = failurePolicy;
    }

    @PostMapping("/quote")
    public Mono<ResponseEntity<QuoteResponse>> quote(@RequestBody QuoteRequest request) {
        if (failurePolicy.shouldFail()) {
            log.info("Simulated shipping quote failure");
            return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).<QuoteResponse>build());
        }

        long itemCount = request.items().stream().mapToLong(ShippingItem::quantity).sum();
        BigDecimal cost = properties.shippingFlatRate()
                .add(properties.shippingPerItem().multiply(BigDecimal.valueOf(itemCount)));
        Optional<BigDecimal> converted = currencyTable.convert(cost, currencyTable.getBaseCurrency(), request.currency());
        if (converted.isEmpty()) {
            return Mono.just(ResponseEntity.badRequest().<QuoteResponse>build());
        }

        return Mono.just(ResponseEntity.ok(new QuoteResponse(converted.get(), request.currency().toUpperCase())))
                .delayElement(properties.latency());
    }

    @PostMapping("/ship")
    public Mono<ResponseEntity<ShipResponse>> ship(@RequestBody ShipRequest request) {
        if (failurePolicy.shouldFail()) {
            log.info("Simulated shipment failure for order {}", request.orderId());
            return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).<ShipResponse>build());
        }

        String trackingId = "TRK-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
        log.info("Shipment {} created for order {}", trackingId, request.orderId());
        return Mono.just(ResponseEntity.ok(new ShipResponse(trackingId)))
                .delayElement(properties.latency());
    }
}
