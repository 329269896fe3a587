package com.example.checkout.simulator;

import com.example.checkout.infrastructure.adapter.out.catalog.dto.ProductPriceResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * In-memory product catalog. Prices are stored in one currency and converted on request.
 */
@RestController
@Profile("simulator")
@RequestMapping("/api/products")
public class SimulatedCatalogController {

    private static final Logger log = LoggerFactory.getLogger(SimulatedCatalogController.class);

    private final SimulatorProperties properties;
    private final CurrencyTable currencyTable;

    public SimulatedCatalogController(SimulatorProperties properties, CurrencyTable currencyTable) {
        this.properties = properties;
        this.currencyTable = currencyTable;
    }

    @GetMapping("/{productId}/price")
    public Mono<ResponseEntity<ProductPriceResponse>> price(
            @PathVariable String productId,
            @RequestParam(defaultValue = "USD") String currency) {

        BigDecimal listPrice = properties.catalog().get(productId);
        if (listPrice == null) {
            log.info("Catalog miss for product {}", productId);
            return Mono.just(ResponseEntity.<ProductPriceResponse>notFound().build());
        }

        Optional<BigDecimal> price = currencyTable.convert(listPrice, properties.catalogCurrency(), currency);
        if (price.isEmpty()) {
            return Mono.just(ResponseEntity.<ProductPriceResponse>badRequest().build());
        }
        return Mono.just(ResponseEntity.ok(new ProductPriceResponse(productId, price.get(), currency.toUpperCase())))
                .delayElement(properties.latency());
    }
}
