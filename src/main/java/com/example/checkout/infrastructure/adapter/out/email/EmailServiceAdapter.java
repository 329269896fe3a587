package com.example.checkout.infrastructure.adapter.out.email;

import com.example.checkout.application.port.out.EmailPort;
import com.example.checkout.application.port.out.StepOutcome;
import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.Warning;
import com.example.checkout.infrastructure.adapter.out.CollaboratorFailures;
import com.example.checkout.infrastructure.adapter.out.email.dto.ConfirmationEmailRequest;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.concurrent.CompletableFuture;

@Component
public class EmailServiceAdapter implements EmailPort {

    private static final Logger log = LoggerFactory.getLogger(EmailServiceAdapter.class);
    private static final String SERVICE_NAME = "email";

    private final WebClient webClient;

    public EmailServiceAdapter(@Qualifier("emailWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    @TimeLimiter(name = "emailTL", fallbackMethod = "sendConfirmationFallback")
    public CompletableFuture<StepOutcome<Void>> sendConfirmation(
            CorrelationId correlationId, String email, Order order) {

        ConfirmationEmailRequest request = new ConfirmationEmailRequest(
                email,
                order.orderId().getValue(),
                order.status().label(),
                order.total() != null ? order.total().getAmount() : null,
                order.total() != null ? order.total().getCurrency() : null,
                order.trackingId(),
                order.warnings().stream().map(Warning::message).toList());

        return CollaboratorFailures.onErrorStatus(webClient.post()
                        .uri("/api/email/order-confirmation")
                        .header(CorrelationId.HEADER, correlationId.getValue())
                        .bodyValue(request)
                        .retrieve(), SERVICE_NAME)
                .toBodilessEntity()
                .map(response -> StepOutcome.<Void>success(null))
                .toFuture();
    }

    @SuppressWarnings("unused")
    private CompletableFuture<StepOutcome<Void>> sendConfirmationFallback(
            CorrelationId correlationId, String email, Order order,
            Throwable throwable) {

        StepOutcome<Void> outcome = CollaboratorFailures.toOutcome(SERVICE_NAME, throwable);
        log.warn("[{}] Confirmation e-mail for order {} not sent: reason={}",
                correlationId, order.orderId(), outcome.reason());
        return CompletableFuture.completedFuture(outcome);
    }
}
