package com.example.checkout.infrastructure.adapter.out.accounting;

import com.example.checkout.application.port.out.AccountingPort;
import com.example.checkout.application.port.out.StepOutcome;
import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.domain.model.Money;
import com.example.checkout.domain.model.Order;
import com.example.checkout.infrastructure.adapter.out.CollaboratorFailures;
import com.example.checkout.infrastructure.adapter.out.accounting.dto.OrderEventRequest;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;

@Component
public class AccountingServiceAdapter implements AccountingPort {

    private static final Logger log = LoggerFactory.getLogger(AccountingServiceAdapter.class);
    private static final String SERVICE_NAME = "accounting";

    private final WebClient webClient;

    public AccountingServiceAdapter(@Qualifier("accountingWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    @TimeLimiter(name = "accountingTL", fallbackMethod = "publishFallback")
    public CompletableFuture<StepOutcome<Void>> publish(CorrelationId correlationId, Order order) {
        return CollaboratorFailures.onErrorStatus(webClient.post()
                        .uri("/api/accounting/orders")
                        .header(CorrelationId.HEADER, correlationId.getValue())
                        .bodyValue(toEvent(order))
                        .retrieve(), SERVICE_NAME)
                .toBodilessEntity()
                .map(response -> StepOutcome.<Void>success(null))
                .toFuture();
    }

    @SuppressWarnings("unused")
    private CompletableFuture<StepOutcome<Void>> publishFallback(
            CorrelationId correlationId, Order order,
            Throwable throwable) {

        StepOutcome<Void> outcome = CollaboratorFailures.toOutcome(SERVICE_NAME, throwable);
        log.warn("[{}] Accounting event for order {} not published: reason={}",
                correlationId, order.orderId(), outcome.reason());
        return CompletableFuture.completedFuture(outcome);
    }

    private OrderEventRequest toEvent(Order order) {
        return new OrderEventRequest(
                order.orderId().getValue(),
                order.correlationId().getValue(),
                order.userId(),
                order.status().label(),
                order.rejectionReason(),
                amountOf(order.total()),
                order.total() != null ? order.total().getCurrency() : null,
                amountOf(order.settlementTotal()),
                order.settlementTotal() != null ? order.settlementTotal().getCurrency() : null,
                order.transactionId(),
                order.lines().stream()
                        .map(line -> new OrderEventRequest.Line(
                                line.productId().getValue(), line.quantity(), line.unitPrice().getAmount()))
                        .toList(),
                order.createdAt().toString());
    }

    private static BigDecimal amountOf(Money money) {
        return money != null ? money.getAmount() : null;
    }
}
