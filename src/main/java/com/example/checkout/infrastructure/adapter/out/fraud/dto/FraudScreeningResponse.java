package com.example.checkout.infrastructure.adapter.out.fraud.dto;

public record FraudScreeningResponse(
        boolean flagged,
        String reason,
        double score
) {
}
