package com.example.checkout.simulator;

import com.example.checkout.infrastructure.adapter.out.payment.dto.ChargeRequest;
import com.example.checkout.infrastructure.adapter.out.payment.dto.ChargeResponse;
import com.example.checkout.infrastructure.adapter.out.payment.dto.ReverseRequest;
import com.example.checkout.infrastructure.adapter.out.payment.dto.ReverseResponse;
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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Payment gateway stand-in. Declines are decided by the injected {@link FailurePolicy}. Only the most
 * recent charges can be reversed; older ones are forgotten.
 */
@RestController
@Profile("simulator")
@RequestMapping("/api/payments")
public class SimulatedPaymentController {

    private static final Logger log = LoggerFactory.getLogger(SimulatedPaymentController.class);

    private final SimulatorProperties properties;
    private final FailurePolicy failurePolicy;
    private final Map<String, ChargeRequest> charges;

    public SimulatedPaymentController(
            SimulatorProperties properties,
            @Qualifier("paymentFailurePolicy") FailurePolicy failurePolicy) {
        this.properties = properties;
        this.failurePolicy = failurePolicy;
        this.charges = Collections.synchronizedMap(boundedMap(properties.historyCapacity()));
    }

    @PostMapping("/charge")
    public Mono<ResponseEntity<ChargeResponse>> charge(@RequestBody ChargeRequest request) {
        if (failurePolicy.shouldFail()) {
            log.info("Simulated decline for order {}", request.orderId());
            return Mono.just(ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED).body(new ChargeResponse(
                    null, "DECLINED", request.amount(), request.currency(), "Card declined by issuer")));
        }

        String transactionId = "txn-" + UUID.randomUUID();
        charges.put(transactionId, request);
        log.info("Charged {} {} for order {}: {}", request.amount(), request.currency(), request.orderId(), transactionId);
        return Mono.just(ResponseEntity.ok(new ChargeResponse(
                        transactionId, "APPROVED", request.amount(), request.currency(), null)))
                .delayElement(properties.latency());
    }

    @PostMapping("/reverse")
    public Mono<ResponseEntity<ReverseResponse>> reverse(@RequestBody ReverseRequest request) {
        if (charges.remove(request.transactionId()) == null) {
            log.warn("Reversal requested for unknown transaction {}", request.transactionId());
            return Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND).<ReverseResponse>build());
        }
        log.info("Reversed transaction {}", request.transactionId());
        return Mono.just(ResponseEntity.ok(new ReverseResponse("rev-" + UUID.randomUUID(), "REVERSED")));
    }

    private static <K, V> Map<K, V> boundedMap(int capacity) {
        return new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > capacity;
            }
        };
    }
}
