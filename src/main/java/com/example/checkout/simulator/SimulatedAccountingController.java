package com.example.checkout.simulator;

import com.example.checkout.infrastructure.adapter.out.accounting.dto.OrderEventRequest;
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
 * In-memory ledger of the most recent order outcomes.
 */
@RestController
@Profile("simulator")
@RequestMapping("/api/accounting")
public class SimulatedAccountingController {

    private static final Logger log = LoggerFactory.getLogger(SimulatedAccountingController.class);

    private final BoundedHistory<OrderEventRequest> ledger;

    public SimulatedAccountingController(SimulatorProperties properties) {
        this.ledger = new BoundedHistory<>(properties.historyCapacity());
    }

    @PostMapping("/orders")
    public ResponseEntity<Void> record(@RequestBody OrderEventRequest event) {
        ledger.add(event);
        log.info("Ledger entry for order {}: status={}, total={} {}",
                event.orderId(), event.status(), event.total(), event.currency());
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/orders")
    public List<OrderEventRequest> entries() {
        return ledger.snapshot();
    }
}
