package com.pantheon.dispatch.api;

import java.util.Map;
import java.util.Objects;

/**
 * A single order within a shipment: who it is for and what it contains.
 *
 * @param orderId  identifier of the order within the shipment
 * @param customer customer contact for the order
 * @param items    product code to expected quantity; quantities must be positive
 */
public record ShipmentOrder(String orderId, Customer customer, Map<String, Integer> items)
{
    public ShipmentOrder {
        Objects.requireNonNull(orderId, "orderId");
        Objects.requireNonNull(customer, "customer");
        Objects.requireNonNull(items, "items");

        if (items.isEmpty()) {
            throw new IllegalArgumentException("order " + orderId + " has no items");
        }
        for (Map.Entry<String, Integer> item : items.entrySet()) {
            Objects.requireNonNull(item.getKey(), "product code");
            Integer quantity = Objects.requireNonNull(item.getValue(), "quantity");
            if (quantity <= 0) {
                throw new IllegalArgumentException(
                        "order " + orderId + ": quantity for " + item.getKey() + " must be positive");
            }
        }
        items = Map.copyOf(items);
    }
}
