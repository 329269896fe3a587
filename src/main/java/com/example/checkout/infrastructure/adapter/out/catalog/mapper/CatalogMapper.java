package com.example.checkout.infrastructure.adapter.out.catalog.mapper;

import com.example.checkout.application.port.out.CatalogPort.ProductPrice;
import com.example.checkout.domain.model.Money;
import com.example.checkout.domain.model.ProductId;
import com.example.checkout.infrastructure.adapter.out.catalog.dto.ProductPriceResponse;
import org.springframework.stereotype.Component;

@Component
public class CatalogMapper {

    /**
     * The requested id is kept; the catalog may echo it back normalized.
     */
    public ProductPrice toProductPrice(ProductId requested, ProductPriceResponse response) {
        return new ProductPrice(requested, Money.of(response.price(), response.currency()));
    }
}
