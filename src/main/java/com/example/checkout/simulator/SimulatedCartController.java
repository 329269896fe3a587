package com.example.checkout.simulator;

import com.example.checkout.infrastructure.adapter.out.shipping.dto.ShippingItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory cart store keyed by user id.
 */
@RestController
@Profile("simulator")
@RequestMapping("/api/carts")
public class SimulatedCartController {

    private static final Logger log = LoggerFactory.getLogger(SimulatedCartController.class);

    private final Map<String, List<ShippingItem>> carts = new ConcurrentHashMap<>();

    @PostMapping("/{userId}/items")
    public ResponseEntity<List<ShippingItem>> addItem(@PathVariable String userId, @RequestBody ShippingItem item) {
        List<ShippingItem> cart = carts.computeIfAbsent(userId, id -> new CopyOnWriteArrayList<>());
        cart.add(item);
        return ResponseEntity.ok(List.copyOf(cart));
    }

    @GetMapping("/{userId}")
    public List<ShippingItem> get(@PathVariable String userId) {
        return List.copyOf(carts.getOrDefault(userId, List.of()));
    }

    @DeleteMapping("/{userId}")
    public ResponseEntity<Void> empty(@PathVariable String userId) {
        List<ShippingItem> removed = carts.remove(userId);
        log.info("Cart of user {} emptied ({} item(s))", userId, removed != null ? removed.size() : 0);
        return ResponseEntity.noContent().build();
    }
}
