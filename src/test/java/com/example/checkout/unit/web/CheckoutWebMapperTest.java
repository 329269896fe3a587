package com.example.checkout.unit.web;

import com.example.checkout.application.dto.CheckoutCommand;
import com.example.checkout.application.port.out.StepOutcome;
import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.domain.model.Money;
import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.domain.model.OrderStatus;
import com.example.checkout.domain.model.Warning;
import com.example.checkout.infrastructure.adapter.in.web.dto.CheckoutRequest;
import com.example.checkout.infrastructure.adapter.in.web.dto.CheckoutRequest.AddressRequest;
import com.example.checkout.infrastructure.adapter.in.web.dto.CheckoutRequest.CartItemRequest;
import com.example.checkout.infrastructure.adapter.in.web.dto.CheckoutResponse;
import com.example.checkout.infrastructure.adapter.in.web.mapper.CheckoutWebMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CheckoutWebMapper Tests")
class CheckoutWebMapperTest {

    private final CheckoutWebMapper mapper = new CheckoutWebMapper();

    @Test
    @DisplayName("should_map_statuses_to_http_codes")
    void should_map_statuses_to_http_codes() {
        assertThat(mapper.toHttpStatus(order(OrderStatus.COMPLETED, null))).isEqualTo(HttpStatus.OK);
        assertThat(mapper.toHttpStatus(order(OrderStatus.COMPLETED_WITH_WARNINGS, null))).isEqualTo(HttpStatus.OK);
        assertThat(mapper.toHttpStatus(order(OrderStatus.PAYMENT_FAILED, "payment_declined")))
                .isEqualTo(HttpStatus.PAYMENT_REQUIRED);
        assertThat(mapper.toHttpStatus(order(OrderStatus.REJECTED, "catalog_miss"))).isEqualTo(HttpStatus.CONFLICT);
        assertThat(mapper.toHttpStatus(order(OrderStatus.REJECTED, StepOutcome.DEADLINE_EXCEEDED)))
                .isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
    }

    @Test
    @DisplayName("should_render_status_label_and_warnings")
    void should_render_status_label_and_warnings() {
        CheckoutResponse response = mapper.toResponse(order(OrderStatus.COMPLETED_WITH_WARNINGS, null));

        assertThat(response.status()).isEqualTo("CompletedWithWarnings");
        assertThat(response.total().amount()).isEqualByComparingTo("25.00");
        assertThat(response.settlementTotal()).isNull();
        assertThat(response.warnings()).singleElement()
                .satisfies(warning -> assertThat(warning.reason()).isEqualTo("timeout"));
    }

    @Test
    @DisplayName("should_build_command_with_generated_correlation_id")
    void should_build_command_with_generated_correlation_id() {
        CheckoutRequest request = new CheckoutRequest("user-1",
                List.of(new CartItemRequest("A", 2)),
                new AddressRequest("1 Main St", "Springfield", null, "US", null),
                "tok_visa", "usd", null);

        CheckoutCommand command = mapper.toCommand(request, null);

        assertThat(command.correlationId().getValue()).isNotBlank();
        assertThat(command.currency()).isEqualTo("USD");
        assertThat(command.items()).singleElement()
                .satisfies(item -> assertThat(item.getQuantity()).isEqualTo(2));
    }

    private static Order order(OrderStatus status, String reason) {
        boolean completed = status.isCompleted();
        return new Order(OrderId.generate(), CorrelationId.generate(), "user-1", status, reason,
                List.of(), Money.of("5.00", "USD"),
                completed ? Money.of("25.00", "USD") : null, null, false, null, null,
                completed && status == OrderStatus.COMPLETED_WITH_WARNINGS
                        ? List.of(new Warning("fraud-detection", "timeout", "unscreened", true))
                        : List.of(),
                Instant.now());
    }
}
