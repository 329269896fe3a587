package com.example.checkout.infrastructure.config;

import com.example.checkout.domain.model.CorrelationId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Makes sure every request carries an {@code X-Correlation-Id}, generating one when absent,
 * and echoes it on the response.
 */
@Component
@Order(1)
public class CorrelationIdFilter implements WebFilter {

    private static final Logger log = LoggerFactory.getLogger(CorrelationIdFilter.class);

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (path.startsWith("/actuator")) {
            return chain.filter(exchange);
        }

        String incoming = exchange.getRequest().getHeaders().getFirst(CorrelationId.HEADER);
        CorrelationId correlationId = CorrelationId.ofNullable(incoming);

        ServerHttpRequest request = exchange.getRequest().mutate()
                .headers(headers -> headers.set(CorrelationId.HEADER, correlationId.getValue()))
                .build();
        exchange.getResponse().getHeaders().set(CorrelationId.HEADER, correlationId.getValue());

        return chain.filter(exchange.mutate().request(request).build())
                .doFinally(signalType -> log.debug("[{}] {} {} completed with signal: {}",
                        correlationId, exchange.getRequest().getMethod(), path, signalType));
    }
}
