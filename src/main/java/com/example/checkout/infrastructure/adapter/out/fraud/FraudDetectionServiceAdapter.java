package com.example.checkout.infrastructure.adapter.out.fraud;

import com.example.checkout.application.port.out.FraudDetectionPort;
import com.example.checkout.application.port.out.StepOutcome;
import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.infrastructure.adapter.out.CollaboratorFailures;
import com.example.checkout.infrastructure.adapter.out.fraud.dto.FraudScreeningRequest;
import com.example.checkout.infrastructure.adapter.out.fraud.dto.FraudScreeningResponse;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.concurrent.CompletableFuture;

@Component
public class FraudDetectionServiceAdapter implements FraudDetectionPort {

    private static final Logger log = LoggerFactory.getLogger(FraudDetectionServiceAdapter.class);
    private static final String SERVICE_NAME = "fraud-detection";

    private final WebClient webClient;

    public FraudDetectionServiceAdapter(@Qualifier("fraudDetectionWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    @TimeLimiter(name = "fraudDetectionTL", fallbackMethod = "checkFallback")
    public CompletableFuture<StepOutcome<FraudVerdict>> check(
            CorrelationId correlationId, FraudCheckRequest request) {

        log.debug("[{}] Screening order {} for {}", correlationId, request.orderId(), request.amount());

        FraudScreeningRequest body = new FraudScreeningRequest(
                request.orderId().getValue(),
                request.userId(),
                request.amount().getAmount(),
                request.amount().getCurrency(),
                request.shippingAddress().country(),
                request.itemCount());

        return CollaboratorFailures.onErrorStatus(webClient.post()
                        .uri("/api/fraud/check")
                        .header(CorrelationId.HEADER, correlationId.getValue())
                        .bodyValue(body)
                        .retrieve(), SERVICE_NAME)
                .bodyToMono(FraudScreeningResponse.class)
                .map(response -> StepOutcome.success(response.flagged()
                        ? FraudVerdict.flagged(response.reason(), response.score())
                        : new FraudVerdict(false, response.reason(), response.score())))
                .toFuture();
    }

    @SuppressWarnings("unused")
    private CompletableFuture<StepOutcome<FraudVerdict>> checkFallback(
            CorrelationId correlationId, FraudCheckRequest request,
            Throwable throwable) {

        StepOutcome<FraudVerdict> outcome = CollaboratorFailures.toOutcome(SERVICE_NAME, throwable);
        log.warn("[{}] Fraud screening of order {} failed: reason={}, message={}",
                correlationId, request.orderId(), outcome.reason(), outcome.message());
        return CompletableFuture.completedFuture(outcome);
    }
}
