package com.example.checkout.infrastructure.adapter.out.currency;

import com.example.checkout.application.port.out.CurrencyPort;
import com.example.checkout.application.port.out.StepOutcome;
import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.domain.model.Money;
import com.example.checkout.infrastructure.adapter.out.CollaboratorFailures;
import com.example.checkout.infrastructure.adapter.out.currency.dto.ConversionRequest;
import com.example.checkout.infrastructure.adapter.out.currency.dto.ConversionResponse;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.concurrent.CompletableFuture;

@Component
public class CurrencyServiceAdapter implements CurrencyPort {

    private static final Logger log = LoggerFactory.getLogger(CurrencyServiceAdapter.class);
    private static final String SERVICE_NAME = "currency";

    private final WebClient webClient;

    public CurrencyServiceAdapter(@Qualifier("currencyWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    @TimeLimiter(name = "currencyTL", fallbackMethod = "convertFallback")
    public CompletableFuture<StepOutcome<Money>> convert(
            CorrelationId correlationId, Money amount, String toCurrency) {

        log.debug("[{}] Converting {} to {}", correlationId, amount, toCurrency);

        ConversionRequest request = new ConversionRequest(amount.getAmount(), amount.getCurrency(), toCurrency);

        return CollaboratorFailures.onErrorStatus(webClient.post()
                        .uri("/api/currency/convert")
                        .header(CorrelationId.HEADER, correlationId.getValue())
                        .bodyValue(request)
                        .retrieve(), SERVICE_NAME)
                .bodyToMono(ConversionResponse.class)
                .map(response -> StepOutcome.success(Money.of(response.amount(), response.currency())))
                .toFuture();
    }

    @SuppressWarnings("unused")
    private CompletableFuture<StepOutcome<Money>> convertFallback(
            CorrelationId correlationId, Money amount, String toCurrency,
            Throwable throwable) {

        StepOutcome<Money> outcome = CollaboratorFailures.toOutcome(SERVICE_NAME, throwable);
        log.warn("[{}] Conversion of {} to {} failed: reason={}, message={}",
                correlationId, amount, toCurrency, outcome.reason(), outcome.message());
        return CompletableFuture.completedFuture(outcome);
    }
}
