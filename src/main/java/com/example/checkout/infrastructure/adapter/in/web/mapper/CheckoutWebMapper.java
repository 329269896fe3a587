package com.example.checkout.infrastructure.adapter.in.web.mapper;

import com.example.checkout.application.dto.CheckoutCommand;
import com.example.checkout.application.port.out.StepOutcome;
import com.example.checkout.domain.model.Address;
import com.example.checkout.domain.model.CartItem;
import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.domain.model.Money;
import com.example.checkout.domain.model.Order;
import com.example.checkout.infrastructure.adapter.in.web.dto.CheckoutRequest;
import com.example.checkout.infrastructure.adapter.in.web.dto.CheckoutResponse;
import com.example.checkout.infrastructure.adapter.in.web.dto.CheckoutResponse.AmountResponse;
import com.example.checkout.infrastructure.adapter.in.web.dto.CheckoutResponse.LineResponse;
import com.example.checkout.infrastructure.adapter.in.web.dto.CheckoutResponse.WarningResponse;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper between web DTOs and the application layer.
 */
@Component
public class CheckoutWebMapper {

    /**
     * @throws IllegalArgumentException when the request violates a domain rule
     */
    public CheckoutCommand toCommand(CheckoutRequest request, String correlationId) {
        List<CartItem> items = request.items().stream()
                .map(item -> CartItem.of(item.productId(), item.quantity()))
                .toList();

        CheckoutRequest.AddressRequest address = request.shippingAddress();
        return new CheckoutCommand(
                CorrelationId.ofNullable(correlationId),
                request.userId(),
                items,
                new Address(address.streetAddress(), address.city(), address.state(),
                        address.country(), address.zipCode()),
                request.paymentToken(),
                request.currency(),
                request.email());
    }

    public CheckoutResponse toResponse(Order order) {
        return new CheckoutResponse(
                order.orderId().getValue(),
                order.correlationId() != null ? order.correlationId().getValue() : null,
                order.status().label(),
                order.rejectionReason(),
                order.lines().stream()
                        .map(line -> new LineResponse(line.productId().getValue(), line.quantity(),
                                toAmount(line.unitPrice()), toAmount(line.lineTotal())))
                        .toList(),
                toAmount(order.shippingCost()),
                toAmount(order.total()),
                toAmount(order.settlementTotal()),
                order.converted(),
                order.transactionId(),
                order.trackingId(),
                order.warnings().stream()
                        .map(warning -> new WarningResponse(warning.collaborator(), warning.reason(),
                                warning.message(), warning.retryable()))
                        .toList(),
                order.createdAt());
    }

    /**
     * 200 for completed orders, 402 for payment failures, 409 for rejections,
     * 504 when the request deadline ran out.
     */
    public HttpStatus toHttpStatus(Order order) {
        return switch (order.status()) {
            case COMPLETED, COMPLETED_WITH_WARNINGS -> HttpStatus.OK;
            case PAYMENT_FAILED -> HttpStatus.PAYMENT_REQUIRED;
            case REJECTED -> StepOutcome.DEADLINE_EXCEEDED.equals(order.rejectionReason())
                    ? HttpStatus.GATEWAY_TIMEOUT
                    : HttpStatus.CONFLICT;
        };
    }

    private static AmountResponse toAmount(Money money) {
        return money != null ? new AmountResponse(money.getAmount(), money.getCurrency()) : null;
    }
}
