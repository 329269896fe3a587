package com.example.checkout.simulator;

import com.example.checkout.infrastructure.adapter.out.email.dto.ConfirmationEmailRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * E-mail sink: the most recent confirmations are kept in memory and can be listed.
 */
@RestController
@Profile("simulator")
@RequestMapping("/api/email")
public class SimulatedEmailController {

    private static final Logger log = LoggerFactory.getLogger(SimulatedEmailController.class);

    private final BoundedHistory<ConfirmationEmailRequest> outbox;

    public SimulatedEmailController(SimulatorProperties properties) {
        this.outbox = new BoundedHistory<>(properties.historyCapacity());
    }

    @PostMapping("/order-confirmation")
    public ResponseEntity<Void> send(@RequestBody ConfirmationEmailRequest request) {
        outbox.add(request);
        log.info("Confirmation for order {} sent to {}", request.orderId(), request.to());
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/order-confirmation")
    public List<ConfirmationEmailRequest> sent() {
        return outbox.snapshot();
    }
}
