package com.pantheon.dispatch.api;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * ShipmentManifest
 * -----------------------------------------------------------------------------
 * The expected contents of one dispatch cycle.
 *
 * <p>A manifest is immutable. It is installed at most once per cycle and removed
 * by a reset; nothing inside the monitor ever edits one in place.</p>
 *
 * <p>Parsing of manifest documents from wire formats happens outside this
 * library. Callers construct the manifest directly.</p>
 */
public record ShipmentManifest(String shipmentId, List<ShipmentOrder> orders)
{
    public ShipmentManifest {
        Objects.requireNonNull(shipmentId, "shipmentId");
        Objects.requireNonNull(orders, "orders");

        if (shipmentId.isBlank()) {
            throw new IllegalArgumentException("shipmentId must not be blank");
        }
        if (orders.isEmpty()) {
            throw new IllegalArgumentException("shipment " + shipmentId + " has no orders");
        }
        orders = List.copyOf(orders);

        long total = 0;
        for (ShipmentOrder order : orders) {
            for (int quantity : order.items().values()) {
                total += quantity;
            }
        }
        if (total > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                    "shipment " + shipmentId + " expects " + total + " items, more than can be tracked");
        }
    }

    /**
     * Returns the expected quantity per product code, summed across all orders.
     * Totals fit in an {@code int}; construction rejects larger shipments.
     */
    public Map<String, Integer> expectedQuantities() {
        Map<String, Integer> totals = new TreeMap<>();
        for (ShipmentOrder order : orders) {
            order.items().forEach((code, quantity) -> totals.merge(code, quantity, Math::addExact));
        }
        return Collections.unmodifiableMap(totals);
    }

    /**
     * Total number of tagged items expected on the truck.
     */
    public int expectedItemCount() {
        return expectedQuantities().values().stream().mapToInt(Integer::intValue).reduce(0, Math::addExact);
    }
}
