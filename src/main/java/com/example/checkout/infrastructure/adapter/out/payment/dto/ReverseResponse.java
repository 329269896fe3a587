package com.example.checkout.infrastructure.adapter.out.payment.dto;

public record ReverseResponse(
        String reversalId,
        String status
) {
}
