package com.example.checkout.infrastructure.adapter.out.payment;

import com.example.checkout.application.port.out.PaymentPort;
import com.example.checkout.application.port.out.StepOutcome;
import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.domain.model.Money;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.infrastructure.adapter.out.CollaboratorFailures;
import com.example.checkout.infrastructure.adapter.out.payment.dto.ChargeResponse;
import com.example.checkout.infrastructure.adapter.out.payment.dto.ReverseResponse;
import com.example.checkout.infrastructure.adapter.out.payment.mapper.PaymentMapper;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.concurrent.CompletableFuture;

/**
 * Adapter for the payment service.
 * A charge is declined either by a 402 answer or by a {@code DECLINED} status in a 2xx body.
 * Reversals run under their own, shorter time limiter.
 */
@Component
public class PaymentServiceAdapter implements PaymentPort {

    private static final Logger log = LoggerFactory.getLogger(PaymentServiceAdapter.class);
    private static final String SERVICE_NAME = "payment";
    private static final int PAYMENT_REQUIRED = 402;

    private final WebClient webClient;
    private final PaymentMapper mapper;

    public PaymentServiceAdapter(
            @Qualifier("paymentWebClient") WebClient webClient,
            PaymentMapper mapper) {
        this.webClient = webClient;
        this.mapper = mapper;
    }

    @Override
    @TimeLimiter(name = "paymentTL", fallbackMethod = "chargeFallback")
    public CompletableFuture<StepOutcome<PaymentResult>> charge(
            CorrelationId correlationId, OrderId orderId, Money amount, String paymentToken) {

        log.debug("[{}] Charging {} for order {}", correlationId, amount, orderId);

        return CollaboratorFailures.onErrorStatus(webClient.post()
                        .uri("/api/payments/charge")
                        .header(CorrelationId.HEADER, correlationId.getValue())
                        .bodyValue(mapper.toChargeRequest(orderId, amount, paymentToken))
                        .retrieve(), SERVICE_NAME)
                .bodyToMono(ChargeResponse.class)
                .map(response -> mapper.toChargeOutcome(response, amount))
                .toFuture();
    }

    @Override
    @TimeLimiter(name = "paymentReversalTL", fallbackMethod = "reverseFallback")
    public CompletableFuture<StepOutcome<ReversalResult>> reverse(
            CorrelationId correlationId, String transactionId, Money amount) {

        log.debug("[{}] Reversing transaction {} of {}", correlationId, transactionId, amount);

        return CollaboratorFailures.onErrorStatus(webClient.post()
                        .uri("/api/payments/reverse")
                        .header(CorrelationId.HEADER, correlationId.getValue())
                        .bodyValue(mapper.toReverseRequest(transactionId, amount))
                        .retrieve(), SERVICE_NAME)
                .bodyToMono(ReverseResponse.class)
                .map(response -> StepOutcome.success(mapper.toReversal(response)))
                .toFuture();
    }

    @SuppressWarnings("unused")
    private CompletableFuture<StepOutcome<PaymentResult>> chargeFallback(
            CorrelationId correlationId, OrderId orderId, Money amount, String paymentToken,
            Throwable throwable) {

        if (CollaboratorFailures.statusOf(throwable) == PAYMENT_REQUIRED) {
            log.info("[{}] Payment declined for order {}", correlationId, orderId);
            return CompletableFuture.completedFuture(StepOutcome.failure(
                    PAYMENT_DECLINED, CollaboratorFailures.unwrap(throwable).getMessage(), false));
        }

        StepOutcome<PaymentResult> outcome = CollaboratorFailures.toOutcome(SERVICE_NAME, throwable);
        log.warn("[{}] Charge for order {} failed: reason={}, message={}",
                correlationId, orderId, outcome.reason(), outcome.message());
        return CompletableFuture.completedFuture(outcome);
    }

    @SuppressWarnings("unused")
    private CompletableFuture<StepOutcome<ReversalResult>> reverseFallback(
            CorrelationId correlationId, String transactionId, Money amount,
            Throwable throwable) {

        StepOutcome<ReversalResult> outcome = CollaboratorFailures.toOutcome(SERVICE_NAME, throwable);
        log.warn("[{}] Reversal of transaction {} failed: reason={}, message={}",
                correlationId, transactionId, outcome.reason(), outcome.message());
        return CompletableFuture.completedFuture(outcome);
    }
}
