package com.mktsim.engine.exchange;

import com.mktsim.protocol.Order;

/**
 * External settlement logic for basket (creation/redemption) orders.
 * Returns the settlement price in cents, or null if the basket cannot be priced.
 */
@FunctionalInterface
public interface BasketPricer {
    Long price(Order basket, long now);
}
