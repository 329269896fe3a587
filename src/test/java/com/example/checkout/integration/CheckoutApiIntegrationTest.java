package com.example.checkout.integration;

import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.support.WireMockTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.util.function.IntSupplier;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end checkout through {@code POST /api/checkout} against WireMock collaborators.
 */
@DisplayName("Checkout API Integration Tests")
class CheckoutApiIntegrationTest extends WireMockTestSupport {

    private static final String PRODUCT = "OLJCESPC7Z";

    @Autowired
    private WebTestClient webTestClient;

    @Test
    @DisplayName("should_return_200_with_completed_order")
    void should_return_200_with_completed_order() {
        // Given
        stubHappyPath(PRODUCT, "10.00");

        // When & Then
        client().post().uri("/api/checkout")
                .contentType(MediaType.APPLICATION_JSON)
                .header(CorrelationId.HEADER, "corr-123")
                .bodyValue(request(PRODUCT, 2, null))
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals(CorrelationId.HEADER, "corr-123")
                .expectBody()
                .jsonPath("$.status").isEqualTo("Completed")
                .jsonPath("$.correlationId").isEqualTo("corr-123")
                .jsonPath("$.total.amount").isEqualTo(25.0)
                .jsonPath("$.total.currency").isEqualTo("USD")
                .jsonPath("$.transactionId").isEqualTo("txn-1")
                .jsonPath("$.trackingId").isEqualTo("TRK-1")
                .jsonPath("$.warnings").isEmpty();

        paymentServer.verify(postRequestedFor(urlEqualTo("/api/payments/charge"))
                .withHeader(CorrelationId.HEADER, equalTo("corr-123")));
    }

    @Test
    @DisplayName("should_generate_correlation_id_when_absent")
    void should_generate_correlation_id_when_absent() {
        stubHappyPath(PRODUCT, "10.00");

        client().post().uri("/api/checkout")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request(PRODUCT, 1, null))
                .exchange()
                .expectStatus().isOk()
                .expectHeader().exists(CorrelationId.HEADER)
                .expectBody()
                .jsonPath("$.correlationId").isNotEmpty();
    }

    @Test
    @DisplayName("should_return_200_with_warning_when_quote_fails")
    void should_return_200_with_warning_when_quote_fails() {
        // Given
        stubHappyPath(PRODUCT, "10.00");
        stubShippingQuoteUnavailable();

        // When & Then
        client().post().uri("/api/checkout")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request(PRODUCT, 2, null))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("CompletedWithWarnings")
                .jsonPath("$.shippingCost.amount").isEqualTo(0.0)
                .jsonPath("$.total.amount").isEqualTo(20.0)
                .jsonPath("$.warnings[0].collaborator").isEqualTo("shipping")
                .jsonPath("$.warnings[0].retryable").isEqualTo(true);
    }

    @Test
    @DisplayName("should_return_402_and_skip_shipment_when_payment_declined")
    void should_return_402_and_skip_shipment_when_payment_declined() {
        // Given
        stubHappyPath(PRODUCT, "10.00");
        stubPaymentDeclinedWith402();

        // When & Then
        client().post().uri("/api/checkout")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request(PRODUCT, 2, null))
                .exchange()
                .expectStatus().isEqualTo(402)
                .expectBody()
                .jsonPath("$.status").isEqualTo("PaymentFailed")
                .jsonPath("$.reason").isEqualTo("payment_declined")
                .jsonPath("$.total").doesNotExist();

        verifyFraudCheckCalledTimes(0);
        verifyShipmentCalledTimes(0);
    }

    @Test
    @DisplayName("should_return_409_without_charging_on_catalog_miss")
    void should_return_409_without_charging_on_catalog_miss() {
        // Given
        stubHappyPath(PRODUCT, "10.00");
        stubCatalogNotFound("UNKNOWN");

        // When & Then
        client().post().uri("/api/checkout")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request("UNKNOWN", 1, null))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.status").isEqualTo("Rejected")
                .jsonPath("$.reason").isEqualTo("catalog_miss");

        verifyPaymentCalledTimes(0);
    }

    @Test
    @DisplayName("should_return_409_and_reverse_charge_when_fraud_flagged")
    void should_return_409_and_reverse_charge_when_fraud_flagged() throws Exception {
        // Given
        stubHappyPath(PRODUCT, "10.00");
        stubFraudFlagged("velocity");

        // When & Then
        client().post().uri("/api/checkout")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request(PRODUCT, 1, null))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.status").isEqualTo("Rejected")
                .jsonPath("$.reason").isEqualTo("fraud_flagged");

        verifyShipmentCalledTimes(0);
        // the reversal runs in the background, give it a moment
        awaitRequests(() -> paymentServer.findAll(postRequestedFor(urlEqualTo("/api/payments/reverse"))).size(), 1);
        paymentServer.verify(1, postRequestedFor(urlEqualTo("/api/payments/reverse"))
                .withRequestBody(matchingJsonPath("$.transactionId", equalTo("txn-1"))));
    }

    @Test
    @DisplayName("should_publish_outcome_to_accounting_in_background")
    void should_publish_outcome_to_accounting_in_background() throws Exception {
        stubHappyPath(PRODUCT, "10.00");

        client().post().uri("/api/checkout")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request(PRODUCT, 1, "buyer@example.com"))
                .exchange()
                .expectStatus().isOk();

        awaitRequests(() -> accountingServer.findAll(postRequestedFor(urlEqualTo("/api/accounting/orders"))).size(), 1);
        accountingServer.verify(1, postRequestedFor(urlEqualTo("/api/accounting/orders"))
                .withRequestBody(matchingJsonPath("$.status", equalTo("Completed"))));
        awaitRequests(() -> emailServer.findAll(postRequestedFor(urlEqualTo("/api/email/order-confirmation"))).size(), 1);
        emailServer.verify(1, postRequestedFor(urlEqualTo("/api/email/order-confirmation"))
                .withRequestBody(matchingJsonPath("$.to", equalTo("buyer@example.com"))));
    }

    @Test
    @DisplayName("should_return_400_for_empty_cart")
    void should_return_400_for_empty_cart() {
        client().post().uri("/api/checkout")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {
                            "userId": "user-1",
                            "items": [],
                            "shippingAddress": {
                                "streetAddress": "1 Main St",
                                "city": "Springfield",
                                "country": "US"
                            },
                            "paymentToken": "tok_visa",
                            "currency": "USD"
                        }
                        """)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REQUEST")
                .jsonPath("$.message").value(message -> assertThat((String) message).contains("items"));

        verifyPaymentCalledTimes(0);
    }

    @Test
    @DisplayName("should_return_400_for_null_cart_item")
    void should_return_400_for_null_cart_item() {
        client().post().uri("/api/checkout")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {
                            "userId": "user-1",
                            "items": [null],
                            "shippingAddress": {
                                "streetAddress": "1 Main St",
                                "city": "Springfield",
                                "country": "US"
                            },
                            "paymentToken": "tok_visa",
                            "currency": "USD"
                        }
                        """)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REQUEST")
                .jsonPath("$.message").value(message -> assertThat((String) message).contains("Cart item cannot be null"));

        verifyPaymentCalledTimes(0);
    }

    @Test
    @DisplayName("should_return_400_for_malformed_json")
    void should_return_400_for_malformed_json() {
        client().post().uri("/api/checkout")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{ not json")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REQUEST");
    }

    private WebTestClient client() {
        return webTestClient.mutate().responseTimeout(Duration.ofSeconds(10)).build();
    }

    private static String request(String productId, int quantity, String email) {
        return """
                {
                    "userId": "user-1",
                    "items": [{"productId": "%s", "quantity": %d}],
                    "shippingAddress": {
                        "streetAddress": "1 Main St",
                        "city": "Springfield",
                        "state": "IL",
                        "country": "US",
                        "zipCode": "62701"
                    },
                    "paymentToken": "tok_visa",
                    "currency": "USD"%s
                }
                """.formatted(productId, quantity, email != null ? ",\n    \"email\": \"" + email + "\"" : "");
    }

    private static void awaitRequests(IntSupplier count, int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 3000;
        while (count.getAsInt() < expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
    }
}
