package com.example.checkout.infrastructure.adapter.out.cart;

import com.example.checkout.application.port.out.CartPort;
import com.example.checkout.application.port.out.StepOutcome;
import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.infrastructure.adapter.out.CollaboratorFailures;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.concurrent.CompletableFuture;

@Component
public class CartServiceAdapter implements CartPort {

    private static final Logger log = LoggerFactory.getLogger(CartServiceAdapter.class);
    private static final String SERVICE_NAME = "cart";

    private final WebClient webClient;

    public CartServiceAdapter(@Qualifier("cartWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    @TimeLimiter(name = "cartTL", fallbackMethod = "emptyCartFallback")
    public CompletableFuture<StepOutcome<Void>> emptyCart(CorrelationId correlationId, String userId) {
        return CollaboratorFailures.onErrorStatus(webClient.delete()
                        .uri("/api/carts/{userId}", userId)
                        .header(CorrelationId.HEADER, correlationId.getValue())
                        .retrieve(), SERVICE_NAME)
                .toBodilessEntity()
                .map(response -> StepOutcome.<Void>success(null))
                .toFuture();
    }

    @SuppressWarnings("unused")
    private CompletableFuture<StepOutcome<Void>> emptyCartFallback(
            CorrelationId correlationId, String userId,
            Throwable throwable) {

        StepOutcome<Void> outcome = CollaboratorFailures.toOutcome(SERVICE_NAME, throwable);
        log.warn("[{}] Cart of user {} not emptied: reason={}", correlationId, userId, outcome.reason());
        return CompletableFuture.completedFuture(outcome);
    }
}
