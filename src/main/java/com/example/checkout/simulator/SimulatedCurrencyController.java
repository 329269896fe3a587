package com.example.checkout.simulator;

import com.example.checkout.infrastructure.adapter.out.currency.dto.ConversionRequest;
import com.example.checkout.infrastructure.adapter.out.currency.dto.ConversionResponse;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@Profile("simulator")
@RequestMapping("/api/currency")
public class SimulatedCurrencyController {

    private final SimulatorProperties properties;
    private final CurrencyTable currencyTable;

    public SimulatedCurrencyController(SimulatorProperties properties, CurrencyTable currencyTable) {
        this.properties = properties;
        this.currencyTable = currencyTable;
    }

    @PostMapping("/convert")
    public Mono<ResponseEntity<ConversionResponse>> convert(@RequestBody ConversionRequest request) {
        return currencyTable.convert(request.amount(), request.from(), request.to())
                .map(amount -> Mono.just(ResponseEntity.ok(new ConversionResponse(amount, request.to().toUpperCase())))
                        .delayElement(properties.latency()))
                .orElseGet(() -> Mono.just(ResponseEntity.badRequest().<ConversionResponse>build()));
    }
}
