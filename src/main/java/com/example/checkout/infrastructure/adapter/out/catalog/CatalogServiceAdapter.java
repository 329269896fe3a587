package com.example.checkout.infrastructure.adapter.out.catalog;

import com.example.checkout.application.port.out.CatalogPort;
import com.example.checkout.application.port.out.StepOutcome;
import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.domain.model.ProductId;
import com.example.checkout.infrastructure.adapter.out.CollaboratorFailures;
import com.example.checkout.infrastructure.adapter.out.catalog.dto.ProductPriceResponse;
import com.example.checkout.infrastructure.adapter.out.catalog.mapper.CatalogMapper;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.concurrent.CompletableFuture;

/**
 * Adapter for the product catalog. A 404 means the product does not exist.
 */
@Component
public class CatalogServiceAdapter implements CatalogPort {

    private static final Logger log = LoggerFactory.getLogger(CatalogServiceAdapter.class);
    private static final String SERVICE_NAME = "catalog";

    private final WebClient webClient;
    private final CatalogMapper mapper;

    public CatalogServiceAdapter(
            @Qualifier("catalogWebClient") WebClient webClient,
            CatalogMapper mapper) {
        this.webClient = webClient;
        this.mapper = mapper;
    }

    @Override
    @TimeLimiter(name = "catalogTL", fallbackMethod = "getPriceFallback")
    public CompletableFuture<StepOutcome<ProductPrice>> getPrice(
            CorrelationId correlationId, ProductId productId, String currency) {

        log.debug("[{}] Looking up price of {} in {}", correlationId, productId, currency);

        return CollaboratorFailures.onErrorStatus(webClient.get()
                        .uri(uri -> uri.path("/api/products/{id}/price")
                                .queryParam("currency", currency)
                                .build(productId.getValue()))
                        .header(CorrelationId.HEADER, correlationId.getValue())
                        .retrieve(), SERVICE_NAME)
                .bodyToMono(ProductPriceResponse.class)
                .map(response -> StepOutcome.success(mapper.toProductPrice(productId, response)))
                .toFuture();
    }

    @SuppressWarnings("unused")
    private CompletableFuture<StepOutcome<ProductPrice>> getPriceFallback(
            CorrelationId correlationId, ProductId productId, String currency,
            Throwable throwable) {

        if (CollaboratorFailures.statusOf(throwable) == 404) {
            log.info("[{}] Product {} not found in catalog", correlationId, productId);
            return CompletableFuture.completedFuture(StepOutcome.failure(
                    CATALOG_MISS, "Product " + productId + " not found", false));
        }

        StepOutcome<ProductPrice> outcome = CollaboratorFailures.toOutcome(SERVICE_NAME, throwable);
        log.warn("[{}] Price lookup of {} failed: reason={}, message={}",
                correlationId, productId, outcome.reason(), outcome.message());
        return CompletableFuture.completedFuture(outcome);
    }
}
