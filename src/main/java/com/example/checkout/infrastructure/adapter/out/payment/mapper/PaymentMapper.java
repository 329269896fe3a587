package com.example.checkout.infrastructure.adapter.out.payment.mapper;

import com.example.checkout.application.port.out.PaymentPort;
import com.example.checkout.application.port.out.PaymentPort.PaymentResult;
import com.example.checkout.application.port.out.PaymentPort.ReversalResult;
import com.example.checkout.application.port.out.StepOutcome;
import com.example.checkout.domain.model.Money;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.infrastructure.adapter.out.payment.dto.ChargeRequest;
import com.example.checkout.infrastructure.adapter.out.payment.dto.ChargeResponse;
import com.example.checkout.infrastructure.adapter.out.payment.dto.ReverseRequest;
import com.example.checkout.infrastructure.adapter.out.payment.dto.ReverseResponse;
import org.springframework.stereotype.Component;

/**
 * Mapper between domain objects and payment service DTOs.
 */
@Component
public class PaymentMapper {

    static final String DECLINED = "DECLINED";

    public ChargeRequest toChargeRequest(OrderId orderId, Money amount, String paymentToken) {
        return new ChargeRequest(orderId.getValue(), amount.getAmount(), amount.getCurrency(), paymentToken);
    }

    public ReverseRequest toReverseRequest(String transactionId, Money amount) {
        return new ReverseRequest(transactionId, amount.getAmount(), amount.getCurrency());
    }

    /**
     * A 2xx answer can still carry a decline.
     */
    public StepOutcome<PaymentResult> toChargeOutcome(ChargeResponse response, Money requested) {
        if (DECLINED.equalsIgnoreCase(response.status())) {
            return StepOutcome.failure(PaymentPort.PAYMENT_DECLINED,
                    response.message() != null ? response.message() : "Payment declined", false);
        }
        Money charged = response.amount() != null && response.currency() != null
                ? Money.of(response.amount(), response.currency())
                : requested;
        return StepOutcome.success(new PaymentResult(response.transactionId(), charged));
    }

    public ReversalResult toReversal(ReverseResponse response) {
        return new ReversalResult(response.reversalId());
    }
}
