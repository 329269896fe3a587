package com.example.checkout.infrastructure.adapter.in.web;

import com.example.checkout.application.dto.CheckoutCommand;
import com.example.checkout.application.port.in.CheckoutUseCase;
import com.example.checkout.domain.model.CorrelationId;
import com.example.checkout.infrastructure.adapter.in.web.dto.CheckoutRequest;
import com.example.checkout.infrastructure.adapter.in.web.dto.CheckoutResponse;
import com.example.checkout.infrastructure.adapter.in.web.mapper.CheckoutWebMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

/**
 * HTTP entry point of the checkout flow.
 */
@RestController
@RequestMapping("/api/checkout")
@Tag(name = "Checkout", description = "Checkout orchestration API")
public class CheckoutController {

    private static final Logger log = LoggerFactory.getLogger(CheckoutController.class);

    private final CheckoutUseCase checkoutUseCase;
    private final CheckoutWebMapper mapper;

    public CheckoutController(CheckoutUseCase checkoutUseCase, CheckoutWebMapper mapper) {
        this.checkoutUseCase = checkoutUseCase;
        this.mapper = mapper;
    }

    @Operation(
            summary = "Place an order",
            description = """
                    Runs the checkout flow:
                    1. **Price & quote** - catalog prices and a shipping quote, in parallel. A catalog miss rejects the order
                    2. **Currency conversion** - into the settlement currency. Failure only adds a warning
                    3. **Payment** - failure ends the order as PaymentFailed
                    4. **Fraud check** - a flag rejects the order and reverses the charge
                    5. **Shipment** - failure only adds a warning

                    The whole flow shares one deadline. Confirmation e-mail, cart cleanup and the accounting event
                    run after the response is produced.
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Order completed, possibly with warnings",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = CheckoutResponse.class),
                            examples = @ExampleObject(value = """
                                    {
                                      "orderId": "550e8400-e29b-41d4-a716-446655440000",
                                      "correlationId": "4bf92f3577b34da6a3ce929d0e0e4736",
                                      "status": "Completed",
                                      "reason": null,
                                      "lines": [
                                        {
                                          "productId": "OLJCESPC7Z",
                                          "quantity": 2,
                                          "unitPrice": {"amount": 10.00, "currency": "USD"},
                                          "lineTotal": {"amount": 20.00, "currency": "USD"}
                                        }
                                      ],
                                      "shippingCost": {"amount": 5.00, "currency": "USD"},
                                      "total": {"amount": 25.00, "currency": "USD"},
                                      "settlementTotal": {"amount": 25.00, "currency": "USD"},
                                      "converted": true,
                                      "transactionId": "txn-7f3a",
                                      "trackingId": "TRK-12345678",
                                      "warnings": [],
                                      "createdAt": "2026-02-02T12:00:00Z"
                                    }
                                    """)
                    )
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Malformed checkout request",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            examples = @ExampleObject(value = """
                                    {
                                      "error": "INVALID_REQUEST",
                                      "message": "items Cart cannot be empty",
                                      "timestamp": "2026-02-02T12:00:00Z"
                                    }
                                    """)
                    )
            ),
            @ApiResponse(
                    responseCode = "402",
                    description = "Payment failed",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = CheckoutResponse.class)
                    )
            ),
            @ApiResponse(
                    responseCode = "409",
                    description = "Order rejected (catalog miss, fraud flag)",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = CheckoutResponse.class)
                    )
            ),
            @ApiResponse(
                    responseCode = "504",
                    description = "Request deadline exceeded",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = CheckoutResponse.class)
                    )
            )
    })
    @PostMapping
    public CompletableFuture<ResponseEntity<CheckoutResponse>> checkout(
            @Parameter(description = "Correlation id, generated when absent")
            @RequestHeader(value = CorrelationId.HEADER, required = false) String correlationId,
            @Valid @RequestBody CheckoutRequest request) {

        CheckoutCommand command = mapper.toCommand(request, correlationId);
        log.info("[{}] Received checkout request from user {} with {} item(s)",
                command.correlationId(), command.userId(), command.items().size());

        return checkoutUseCase.checkout(command)
                .thenApply(order -> ResponseEntity
                        .status(mapper.toHttpStatus(order))
                        .header(CorrelationId.HEADER, command.correlationId().getValue())
                        .body(mapper.toResponse(order)));
    }
}
