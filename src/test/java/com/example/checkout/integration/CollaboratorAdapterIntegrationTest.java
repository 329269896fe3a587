package com.example.checkout.integration;

import com.example.checkout.application.port.out.CatalogPort;
import com.example.checkout.application.port.out.CatalogPort.ProductPrice;
import com.example.checkout.application.port.out.FraudDetectionPort;
import com.example.checkout.application.port.out.FraudDetectionPort.FraudCheckRequest;
import com.example.checkout.application.port.out.FraudDetectionPort.FraudVerdict;
import com.example.checkout.application.port.out.PaymentPort;
import com.example.checkout.application.port.out.PaymentPort.PaymentResult;
import com.example.checkout.application.port.out.ShippingPort;
import com.example.checkout.application.port.out.ShippingPort.ShipmentResult;
import com.example.checkout.application.port.out.ShippingPort.ShippingQuote;
import com.example.checkout.application.port.out.StepOutcome;
import com.example.checkout.domain.model.Address;
import com.example.checkout.domain.model.CartItem;
import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.domain.model.Money;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.domain.model.ProductId;
import com.example.checkout.support.WireMockTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for the collaborator adapters: HTTP answers are turned into step outcomes,
 * never into exceptions.
 */
@DisplayName("Collaborator Adapter Integration Tests")
class CollaboratorAdapterIntegrationTest extends WireMockTestSupport {

    private static final Address ADDRESS = new Address("1 Main St", "Springfield", "IL", "US", "62701");

    @Autowired
    private CatalogPort catalogPort;

    @Autowired
    private ShippingPort shippingPort;

    @Autowired
    private PaymentPort paymentPort;

    @Autowired
    private FraudDetectionPort fraudDetectionPort;

    @Nested
    @DisplayName("Catalog")
    class Catalog {

        @Test
        @DisplayName("should_return_price_and_forward_correlation_id")
        void should_return_price_and_forward_correlation_id() throws Exception {
            // Given
            stubCatalogPrice("OLJCESPC7Z", "19.99", "USD");
            CorrelationId correlationId = CorrelationId.generate();

            // When
            StepOutcome<ProductPrice> outcome = catalogPort
                    .getPrice(correlationId, ProductId.of("OLJCESPC7Z"), "USD")
                    .get(5, TimeUnit.SECONDS);

            // Then
            assertThat(outcome.success()).isTrue();
            assertThat(outcome.payload().unitPrice()).isEqualTo(Money.of("19.99", "USD"));
            catalogServer.verify(getRequestedFor(urlPathEqualTo("/api/products/OLJCESPC7Z/price"))
                    .withQueryParam("currency", equalTo("USD"))
                    .withHeader(CorrelationId.HEADER, equalTo(correlationId.getValue())));
        }

        @Test
        @DisplayName("should_map_404_to_catalog_miss")
        void should_map_404_to_catalog_miss() throws Exception {
            stubCatalogNotFound("UNKNOWN");

            StepOutcome<ProductPrice> outcome = catalogPort
                    .getPrice(CorrelationId.generate(), ProductId.of("UNKNOWN"), "USD")
                    .get(5, TimeUnit.SECONDS);

            assertThat(outcome.isFailure()).isTrue();
            assertThat(outcome.reason()).isEqualTo(CatalogPort.CATALOG_MISS);
            assertThat(outcome.retryable()).isFalse();
        }
    }

    @Nested
    @DisplayName("Payment")
    class Payment {

        @Test
        @DisplayName("should_return_transaction_on_approval")
        void should_return_transaction_on_approval() throws Exception {
            stubPaymentSuccess("txn-42");

            StepOutcome<PaymentResult> outcome = paymentPort
                    .charge(CorrelationId.generate(), OrderId.generate(), Money.of("25.00", "USD"), "tok_visa")
                    .get(5, TimeUnit.SECONDS);

            assertThat(outcome.success()).isTrue();
            assertThat(outcome.payload().transactionId()).isEqualTo("txn-42");
            assertThat(outcome.payload().charged()).isEqualTo(Money.of("25.00", "USD"));
            paymentServer.verify(postRequestedFor(urlEqualTo("/api/payments/charge"))
                    .withRequestBody(matchingJsonPath("$.paymentToken", equalTo("tok_visa")))
                    .withRequestBody(matchingJsonPath("$.currency", equalTo("USD"))));
        }

        @Test
        @DisplayName("should_map_402_to_payment_declined")
        void should_map_402_to_payment_declined() throws Exception {
            stubPaymentDeclinedWith402();

            StepOutcome<PaymentResult> outcome = paymentPort
                    .charge(CorrelationId.generate(), OrderId.generate(), Money.of("25.00", "USD"), "tok_visa")
                    .get(5, TimeUnit.SECONDS);

            assertThat(outcome.reason()).isEqualTo(PaymentPort.PAYMENT_DECLINED);
            assertThat(outcome.retryable()).isFalse();
        }

        @Test
        @DisplayName("should_map_declined_body_to_payment_declined")
        void should_map_declined_body_to_payment_declined() throws Exception {
            stubPaymentDeclinedInBody();

            StepOutcome<PaymentResult> outcome = paymentPort
                    .charge(CorrelationId.generate(), OrderId.generate(), Money.of("25.00", "USD"), "tok_visa")
                    .get(5, TimeUnit.SECONDS);

            assertThat(outcome.reason()).isEqualTo(PaymentPort.PAYMENT_DECLINED);
            assertThat(outcome.message()).isEqualTo("Insufficient funds");
        }

        @Test
        @DisplayName("should_map_5xx_to_retryable_unavailable_without_retrying")
        void should_map_5xx_to_retryable_unavailable_without_retrying() throws Exception {
            stubPaymentPermanentFailure();

            StepOutcome<PaymentResult> outcome = paymentPort
                    .charge(CorrelationId.generate(), OrderId.generate(), Money.of("25.00", "USD"), "tok_visa")
                    .get(5, TimeUnit.SECONDS);

            assertThat(outcome.reason()).isEqualTo(StepOutcome.UNAVAILABLE);
            assertThat(outcome.retryable()).isTrue();
            verifyPaymentCalledTimes(1);
        }
    }

    @Nested
    @DisplayName("Shipping")
    class Shipping {

        @Test
        @DisplayName("should_return_quote")
        void should_return_quote() throws Exception {
            stubShippingQuote("5.00", "USD");

            StepOutcome<ShippingQuote> outcome = shippingPort
                    .quote(CorrelationId.generate(), ADDRESS, List.of(CartItem.of("A", 2)), "USD")
                    .get(5, TimeUnit.SECONDS);

            assertThat(outcome.payload().cost()).isEqualTo(Money.of("5.00", "USD"));
            shippingServer.verify(postRequestedFor(urlEqualTo("/api/shipping/quote"))
                    .withRequestBody(matchingJsonPath("$.items[0].quantity", equalTo("2"))));
        }

        @Test
        @DisplayName("should_time_out_slow_shipment")
        void should_time_out_slow_shipment() throws Exception {
            // Given: shipping answers after 2s, shippingTL allows 1s in tests
            stubShipmentWithDelay("TRK-LATE", 2000);

            // When
            long startTime = System.currentTimeMillis();
            StepOutcome<ShipmentResult> outcome = shippingPort
                    .ship(CorrelationId.generate(), OrderId.generate(), ADDRESS, List.of(CartItem.of("A", 1)))
                    .get(5, TimeUnit.SECONDS);
            long elapsed = System.currentTimeMillis() - startTime;

            // Then
            assertThat(outcome.reason()).isEqualTo(StepOutcome.TIMEOUT);
            assertThat(outcome.retryable()).isTrue();
            assertThat(elapsed).isLessThan(1900);
        }
    }

    @Nested
    @DisplayName("Fraud detection")
    class FraudDetection {

        @Test
        @DisplayName("should_return_flagged_verdict")
        void should_return_flagged_verdict() throws Exception {
            stubFraudFlagged("velocity");
            FraudCheckRequest request = new FraudCheckRequest(OrderId.generate(), "user-1",
                    Money.of("25.00", "USD"), ADDRESS, 2);

            StepOutcome<FraudVerdict> outcome = fraudDetectionPort
                    .check(CorrelationId.generate(), request)
                    .get(5, TimeUnit.SECONDS);

            assertThat(outcome.payload().flagged()).isTrue();
            assertThat(outcome.payload().reason()).isEqualTo("velocity");
            fraudDetectionServer.verify(postRequestedFor(urlEqualTo("/api/fraud/check"))
                    .withRequestBody(matchingJsonPath("$.country", equalTo("US")))
                    .withRequestBody(matchingJsonPath("$.itemCount", equalTo("2"))));
        }

        @Test
        @DisplayName("should_map_unreachable_collaborator_to_unavailable")
        void should_map_unreachable_collaborator_to_unavailable() throws Exception {
            fraudDetectionServer.stubFor(post(urlEqualTo("/api/fraud/check"))
                    .willReturn(aResponse().withStatus(503)));

            StepOutcome<FraudVerdict> outcome = fraudDetectionPort
                    .check(CorrelationId.generate(), new FraudCheckRequest(OrderId.generate(), "user-1",
                            Money.of("25.00", "USD"), ADDRESS, 1))
                    .get(5, TimeUnit.SECONDS);

            assertThat(outcome.reason()).isEqualTo(StepOutcome.UNAVAILABLE);
        }
    }
}
