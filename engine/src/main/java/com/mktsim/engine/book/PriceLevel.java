package com.mktsim.engine.book;

import com.mktsim.protocol.Order;
import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;

import java.util.ArrayList;
import java.util.List;

/**
 * FIFO queue of resting orders at a single price.
 * First entry = oldest (first to match). Last entry = newest.
 *
 * Backed by an insertion-ordered map keyed by order id, so a cancel from the
 * middle of the queue is O(1) and replacing a partially filled order with its
 * reduced copy keeps its place in the queue.
 */
final class PriceLevel {

    final long price;
    private long totalQty;
    private final Long2ObjectLinkedOpenHashMap<Order> orders = new Long2ObjectLinkedOpenHashMap<>();

    PriceLevel(long price) {
        this.price = price;
    }

    void addOrder(Order o) {
        orders.put(o.orderId, o);
        totalQty += o.quantity;
    }

    Order head() {
        return orders.isEmpty() ? null : orders.get(orders.firstLongKey());
    }

    /** Swap in a reduced copy of a resting order without losing its time priority. */
    void replace(Order reduced) {
        Order old = orders.put(reduced.orderId, reduced);
        totalQty += reduced.quantity - old.quantity;
    }

    Order removeOrder(long orderId) {
        Order o = orders.remove(orderId);
        if (o != null) totalQty -= o.quantity;
        return o;
    }

    List<Order> orders() {
        return new ArrayList<>(orders.values());
    }

    long totalQty() { return totalQty; }

    int size() { return orders.size(); }

    boolean isEmpty() { return orders.isEmpty(); }
}
