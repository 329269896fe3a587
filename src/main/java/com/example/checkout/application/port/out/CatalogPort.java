package com.example.checkout.application.port.out;

import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.domain.model.Money;
import com.example.checkout.domain.model.ProductId;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for product catalog lookups.
 */
public interface CatalogPort {

    String CATALOG_MISS = "catalog_miss";

    /**
     * Looks up the current unit price of a product.
     * An unknown product yields a failure with reason {@link #CATALOG_MISS}.
     *
     * @param correlationId correlation id of the inbound request
     * @param productId     the product to price
     * @param currency      the currency the price should be quoted in
     * @return future containing the lookup outcome
     */
    CompletableFuture<StepOutcome<ProductPrice>> getPrice(
            CorrelationId correlationId, ProductId productId, String currency);

    /**
     * Unit price of a product as quoted by the catalog.
     */
    record ProductPrice(
            ProductId productId,
            Money unitPrice
    ) {
    }
}
