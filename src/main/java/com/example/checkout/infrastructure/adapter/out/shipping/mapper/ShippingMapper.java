package com.example.checkout.infrastructure.adapter.out.shipping.mapper;

import com.example.checkout.application.port.out.ShippingPort.ShipmentResult;
import com.example.checkout.application.port.out.ShippingPort.ShippingQuote;
import com.example.checkout.domain.model.Address;
import com.example.checkout.domain.model.CartItem;
import com.example.checkout.domain.model.Money;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.infrastructure.adapter.out.shipping.dto.QuoteRequest;
import com.example.checkout.infrastructure.adapter.out.shipping.dto.QuoteResponse;
import com.example.checkout.infrastructure.adapter.out.shipping.dto.ShipRequest;
import com.example.checkout.infrastructure.adapter.out.shipping.dto.ShipResponse;
import com.example.checkout.infrastructure.adapter.out.shipping.dto.ShippingAddress;
import com.example.checkout.infrastructure.adapter.out.shipping.dto.ShippingItem;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper between domain objects and shipping service DTOs.
 */
@Component
public class ShippingMapper {

    public QuoteRequest toQuoteRequest(Address address, List<CartItem> items, String currency) {
        return new QuoteRequest(toAddress(address), toItems(items), currency);
    }

    public ShipRequest toShipRequest(OrderId orderId, Address address, List<CartItem> items) {
        return new ShipRequest(orderId.getValue(), toAddress(address), toItems(items));
    }

    public ShippingQuote toQuote(QuoteResponse response) {
        return new ShippingQuote(Money.of(response.cost(), response.currency()));
    }

    public ShipmentResult toShipment(ShipResponse response) {
        return new ShipmentResult(response.trackingId());
    }

    private ShippingAddress toAddress(Address address) {
        return new ShippingAddress(address.streetAddress(), address.city(), address.state(),
                address.country(), address.zipCode());
    }

    private List<ShippingItem> toItems(List<CartItem> items) {
        return items.stream()
                .map(item -> new ShippingItem(item.getProductId().getValue(), item.getQuantity()))
                .toList();
    }
}
