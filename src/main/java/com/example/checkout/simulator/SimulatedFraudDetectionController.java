package com.example.checkout.simulator;

import com.example.checkout.infrastructure.adapter.out.fraud.dto.FraudScreeningRequest;
import com.example.checkout.infrastructure.adapter.out.fraud.dto.FraudScreeningResponse;
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
import java.math.RoundingMode;

/**
 * Flags orders whose amount, in the base currency, exceeds a threshold.
 */
@RestController
@Profile("simulator")
@RequestMapping("/api/fraud")
public class SimulatedFraudDetectionController {

    private static final Logger log = LoggerFactory.getLogger(SimulatedFraudDetectionController.class);

    private final SimulatorProperties properties;
    private final CurrencyTable currencyTable;
    private final FailurePolicy failurePolicy;

    public SimulatedFraudDetectionController(
            SimulatorProperties properties,
            CurrencyTable currencyTable,
            @Qualifier("fraudDetectionFailurePolicy") FailurePolicy failurePolicy) {
        this.properties = properties;
        this.currencyTable = currencyTable;
        this.failurePolicy = failurePolicy;
    }

    @PostMapping("/check")
    public Mono<ResponseEntity<FraudScreeningResponse>> check(@RequestBody FraudScreeningRequest request) {
        if (failurePolicy.shouldFail()) {
            log.info("Simulated fraud screening outage for order {}", request.orderId());
            return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).<FraudScreeningResponse>build());
        }

        BigDecimal amount = currencyTable
                .convert(request.amount(), request.currency(), currencyTable.getBaseCurrency())
                .orElse(request.amount());
        double score = amount.divide(properties.fraudThreshold(), 4, RoundingMode.HALF_UP)
                .min(BigDecimal.ONE)
                .doubleValue();

        FraudScreeningResponse response = amount.compareTo(properties.fraudThreshold()) > 0
                ? new FraudScreeningResponse(true, "amount_above_threshold", score)
                : new FraudScreeningResponse(false, null, score);
        if (response.flagged()) {
            log.info("Order {} flagged: {} {} above threshold", request.orderId(), amount, currencyTable.getBaseCurrency());
        }
        return Mono.just(ResponseEntity.ok(response)).delayElement(properties.latency());
    }
}
