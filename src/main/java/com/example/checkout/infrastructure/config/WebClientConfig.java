package com.example.checkout.infrastructure.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * One WebClient per collaborator.
 * The socket timeouts are a backstop; the per-call limit is the collaborator's Resilience4j time limiter.
 */
@Configuration
public class WebClientConfig {

    private static final int CONNECT_TIMEOUT_MS = 2000;

    @Value("${services.catalog.base-url:http://localhost:8081}")
    private String catalogBaseUrl;

    @Value("${services.shipping.base-url:http://localhost:8082}")
    private String shippingBaseUrl;

    @Value("${services.currency.base-url:http://localhost:8083}")
    private String currencyBaseUrl;

    @Value("${services.payment.base-url:http://localhost:8084}")
    private String paymentBaseUrl;

    @Value("${services.fraud-detection.base-url:http://localhost:8085}")
    private String fraudDetectionBaseUrl;

    @Value("${services.email.base-url:http://localhost:8086}")
    private String emailBaseUrl;

    @Value("${services.accounting.base-url:http://localhost:8087}")
    private String accountingBaseUrl;

    @Value("${services.cart.base-url:http://localhost:8088}")
    private String cartBaseUrl;

    @Value("${services.socket-timeout:5s}")
    private Duration socketTimeout;

    @Bean
    public WebClient catalogWebClient(WebClient.Builder builder) {
        return createWebClient(builder, catalogBaseUrl);
    }

    @Bean
    public WebClient shippingWebClient(WebClient.Builder builder) {
        return createWebClient(builder, shippingBaseUrl);
    }

    @Bean
    public WebClient currencyWebClient(WebClient.Builder builder) {
        return createWebClient(builder, currencyBaseUrl);
    }

    @Bean
    public WebClient paymentWebClient(WebClient.Builder builder) {
        return createWebClient(builder, paymentBaseUrl);
    }

    @Bean
    public WebClient fraudDetectionWebClient(WebClient.Builder builder) {
        return createWebClient(builder, fraudDetectionBaseUrl);
    }

    @Bean
    public WebClient emailWebClient(WebClient.Builder builder) {
        return createWebClient(builder, emailBaseUrl);
    }

    @Bean
    public WebClient accountingWebClient(WebClient.Builder builder) {
        return createWebClient(builder, accountingBaseUrl);
    }

    @Bean
    public WebClient cartWebClient(WebClient.Builder builder) {
        return createWebClient(builder, cartBaseUrl);
    }

    private WebClient createWebClient(WebClient.Builder builder, String baseUrl) {
        long timeoutMs = socketTimeout.toMillis();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
                .responseTimeout(socketTimeout)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS)));

        // the builder bean is shared, clone it so base urls do not leak between clients
        return builder.clone()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
