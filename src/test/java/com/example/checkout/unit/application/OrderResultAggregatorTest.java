package com.example.checkout.unit.application;

import com.example.checkout.application.dto.CheckoutCommand;
import com.example.checkout.application.port.out.CatalogPort;
import com.example.checkout.application.port.out.FraudDetectionPort.FraudVerdict;
import com.example.checkout.application.port.out.PaymentPort;
import com.example.checkout.application.port.out.PaymentPort.PaymentResult;
import com.example.checkout.application.port.out.StepOutcome;
import com.example.checkout.application.service.CheckoutStep;
import com.example.checkout.application.service.OrderContext;
import com.example.checkout.application.service.OrderResultAggregator;
import com.example.checkout.domain.model.Address;
import com.example.checkout.domain.model.CartItem;
import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.domain.model.Money;
import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("OrderResultAggregator Tests")
class OrderResultAggregatorTest {

    private final OrderResultAggregator aggregator = new OrderResultAggregator();
    private OrderContext context;

    @BeforeEach
    void setUp() {
        CheckoutCommand command = new CheckoutCommand(CorrelationId.generate(), "user-1",
                List.of(CartItem.of("A", 2)),
                new Address("1 Main St", "Springfield", null, "US", null),
                "tok_visa", "USD", null);
        context = OrderContext.start(command);
    }

    @Test
    @DisplayName("should_complete_when_every_step_succeeded")
    void should_complete_when_every_step_succeeded() {
        priceCart();
        context.record(CheckoutStep.CURRENCY_CONVERSION, StepOutcome.success(context.getTotal()));
        context.applySettlement(context.getTotal());
        chargeCart();
        context.record(CheckoutStep.FRAUD_CHECK, StepOutcome.success(FraudVerdict.clear()));
        context.record(CheckoutStep.SHIPMENT, StepOutcome.success("TRK-1"));
        context.applyShipment("TRK-1");

        Order order = aggregator.aggregate(context);

        assertThat(order.status()).isEqualTo(OrderStatus.COMPLETED);
        assertThat(order.total()).isEqualTo(Money.of("25.00", "USD"));
        assertThat(order.converted()).isTrue();
        assertThat(order.trackingId()).isEqualTo("TRK-1");
        assertThat(order.createdAt()).isEqualTo(context.getCreatedAt());
    }

    @Test
    @DisplayName("should_rank_payment_failure_above_fraud_flag")
    void should_rank_payment_failure_above_fraud_flag() {
        priceCart();
        context.record(CheckoutStep.PAYMENT, StepOutcome.failure(PaymentPort.PAYMENT_DECLINED, "declined", false));
        context.rejectAsFraud(FraudVerdict.flagged("velocity", 0.9));

        Order order = aggregator.aggregate(context);

        assertThat(order.status()).isEqualTo(OrderStatus.PAYMENT_FAILED);
        assertThat(order.rejectionReason()).isEqualTo(PaymentPort.PAYMENT_DECLINED);
        assertThat(order.total()).isNull();
    }

    @Test
    @DisplayName("should_rank_fraud_flag_above_catalog_miss")
    void should_rank_fraud_flag_above_catalog_miss() {
        context.rejectAsFraud(FraudVerdict.flagged("velocity", 0.9));
        context.record(CheckoutStep.PRICE_LOOKUP, StepOutcome.failure(CatalogPort.CATALOG_MISS, "missing", false));

        Order order = aggregator.aggregate(context);

        assertThat(order.status()).isEqualTo(OrderStatus.REJECTED);
        assertThat(order.rejectionReason()).isEqualTo(OrderContext.FRAUD_FLAGGED);
    }

    @Test
    @DisplayName("should_reject_with_catalog_reason")
    void should_reject_with_catalog_reason() {
        context.record(CheckoutStep.PRICE_LOOKUP, StepOutcome.failure(CatalogPort.CATALOG_MISS, "missing", false));
        context.record(CheckoutStep.SHIPPING_QUOTE, StepOutcome.failure(StepOutcome.TIMEOUT, "slow", true));

        Order order = aggregator.aggregate(context);

        assertThat(order.status()).isEqualTo(OrderStatus.REJECTED);
        assertThat(order.rejectionReason()).isEqualTo(CatalogPort.CATALOG_MISS);
        // the tolerable quote failure is still reported
        assertThat(order.warnings()).hasSize(1);
    }

    @Test
    @DisplayName("should_reject_on_deadline_and_record_skipped_steps")
    void should_reject_on_deadline_and_record_skipped_steps() {
        priceCart();
        context.record(CheckoutStep.CURRENCY_CONVERSION, StepOutcome.deadlineExceeded());
        context.skipRemainingSteps();

        Order order = aggregator.aggregate(context);

        assertThat(order.status()).isEqualTo(OrderStatus.REJECTED);
        assertThat(order.rejectionReason()).isEqualTo(StepOutcome.DEADLINE_EXCEEDED);
        assertThat(context.getOutcomes()).containsOnlyKeys(CheckoutStep.pipeline());
        assertThat(context.outcomeOf(CheckoutStep.SHIPMENT))
                .hasValueSatisfying(outcome -> assertThat(outcome.reason()).isEqualTo(StepOutcome.DEADLINE_EXCEEDED));
        assertThat(order.warnings()).isEmpty();
    }

    @Test
    @DisplayName("should_record_every_step_as_deadline_exceeded_when_pricing_is_cut_short")
    void should_record_every_step_as_deadline_exceeded_when_pricing_is_cut_short() {
        context.record(CheckoutStep.PRICE_LOOKUP, StepOutcome.deadlineExceeded());
        context.record(CheckoutStep.SHIPPING_QUOTE, StepOutcome.deadlineExceeded());
        context.skipRemainingSteps();

        Order order = aggregator.aggregate(context);

        // a catalog call cut by the deadline is not a catalog rejection
        assertThat(order.status()).isEqualTo(OrderStatus.REJECTED);
        assertThat(order.rejectionReason()).isEqualTo(StepOutcome.DEADLINE_EXCEEDED);
        assertThat(order.total()).isNull();
        assertThat(context.getOutcomes()).containsOnlyKeys(CheckoutStep.pipeline());
        assertThat(context.getOutcomes().values())
                .allSatisfy(outcome -> assertThat(outcome.reason()).isEqualTo(StepOutcome.DEADLINE_EXCEEDED));
    }

    @Test
    @DisplayName("should_complete_with_warnings_on_tolerable_failure")
    void should_complete_with_warnings_on_tolerable_failure() {
        priceCart();
        chargeCart();
        context.record(CheckoutStep.SHIPMENT, StepOutcome.failure(StepOutcome.UNAVAILABLE, "503", true));

        Order order = aggregator.aggregate(context);

        assertThat(order.status()).isEqualTo(OrderStatus.COMPLETED_WITH_WARNINGS);
        assertThat(order.total()).isEqualTo(Money.of("25.00", "USD"));
        assertThat(order.converted()).isFalse();
        assertThat(order.warnings()).singleElement().satisfies(warning -> {
            assertThat(warning.collaborator()).isEqualTo("shipping");
            assertThat(warning.message()).isEqualTo(CheckoutStep.SHIPMENT.warningMessage());
        });
    }

    @Test
    @DisplayName("should_reject_with_internal_error_after_abort")
    void should_reject_with_internal_error_after_abort() {
        priceCart();
        context.abort(new IllegalStateException("boom"));

        Order order = aggregator.aggregate(context);

        assertThat(order.status()).isEqualTo(OrderStatus.REJECTED);
        assertThat(order.rejectionReason()).isEqualTo(OrderContext.INTERNAL_ERROR);
    }

    @Test
    @DisplayName("should_produce_equal_orders_when_aggregated_twice")
    void should_produce_equal_orders_when_aggregated_twice() {
        priceCart();
        chargeCart();
        context.record(CheckoutStep.FRAUD_CHECK, StepOutcome.failure(StepOutcome.TIMEOUT, "slow", true));

        Order first = aggregator.aggregate(context);
        Order second = aggregator.aggregate(context);

        assertThat(second).isEqualTo(first);
        assertThat(second.toString()).isEqualTo(first.toString());
    }

    @Test
    @DisplayName("should_refuse_second_outcome_for_same_step")
    void should_refuse_second_outcome_for_same_step() {
        priceCart();

        assertThatThrownBy(() -> context.record(CheckoutStep.PRICE_LOOKUP, StepOutcome.success(List.of())))
                .isInstanceOf(IllegalStateException.class);
    }

    private void priceCart() {
        context.record(CheckoutStep.PRICE_LOOKUP, StepOutcome.success(List.of()));
        context.record(CheckoutStep.SHIPPING_QUOTE, StepOutcome.success(Money.of("5.00", "USD")));
        context.applyPricing(List.of(CartItem.of("A", 2).priceAt(Money.of("10.00", "USD"))), Money.of("5.00", "USD"));
    }

    private void chargeCart() {
        context.record(CheckoutStep.PAYMENT, StepOutcome.success("txn-1"));
        context.applyPayment(new PaymentResult("txn-1", context.chargeAmount()));
    }
}
