package com.pantheon.dispatch.api;

import java.util.Objects;

/**
 * Contact details for the customer receiving an order.
 *
 * <p>Only {@code name} is mandatory. Email and cell number may be {@code null}
 * when the customer has no such contact channel.</p>
 */
public record Customer(String name, String email, String cell)
{
    public Customer {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("customer name must not be blank");
        }
    }
}
