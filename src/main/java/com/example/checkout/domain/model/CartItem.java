package com.example.checkout.domain.model;

import java.util.Objects;

/**
 * One cart entry as submitted by the caller, before it is priced.
 */
public final class CartItem {

    private final ProductId productId;
    private final int quantity;

    private CartItem(ProductId productId, int quantity) {
        this.productId = Objects.requireNonNull(productId, "ProductId cannot be null");
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
        this.quantity = quantity;
    }

    /**
     * Creates a new CartItem.
     *
     * @param productId the catalog product id
     * @param quantity  the quantity (must be positive)
     * @return new CartItem instance
     */
    public static CartItem of(ProductId productId, int quantity) {
        return new CartItem(productId, quantity);
    }

    public static CartItem of(String productId, int quantity) {
        return new CartItem(ProductId.of(productId), quantity);
    }

    /**
     * Prices this item with the unit price resolved from the catalog.
     */
    public OrderLine priceAt(Money unitPrice) {
        return new OrderLine(productId, quantity, unitPrice, unitPrice.multiply(quantity));
    }

    public ProductId getProductId() {
        return productId;
    }

    public int getQuantity() {
        return quantity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CartItem cartItem = (CartItem) o;
        return quantity == cartItem.quantity && Objects.equals(productId, cartItem.productId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(productId, quantity);
    }

    @Override
    public String toString() {
        return "CartItem{" +
                "productId=" + productId +
                ", quantity=" + quantity +
                '}';
    }
}
