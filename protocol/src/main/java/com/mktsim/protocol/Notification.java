package com.mktsim.protocol;

/**
 * Execution report delivered to an agent as an event payload.
 *
 * {@code order} is an independent copy of the affected order; for
 * {@link NotificationKind#EXECUTED} its quantity is the filled quantity and its
 * fill price is set. {@code fillPrice} and {@code quantity} are null when they
 * do not apply, {@code reason} is set only on rejections.
 */
public record Notification(NotificationKind kind, Order order, Long fillPrice, Long quantity, RejectReason reason) {

    public long orderId() { return order.orderId; }

    public static Notification acked(Order order) {
        return new Notification(NotificationKind.ACKED, order.copy(), null, order.quantity, null);
    }

    public static Notification executed(Order order, long price, long qty) {
        Order executed = order.withQuantity(qty);
        executed.fillPrice = price;
        return new Notification(NotificationKind.EXECUTED, executed, price, qty, null);
    }

    public static Notification cancelled(Order order) {
        return new Notification(NotificationKind.CANCELLED, order.copy(), null, order.quantity, null);
    }

    public static Notification modified(Order replacement) {
        return new Notification(NotificationKind.MODIFIED, replacement.copy(), null, replacement.quantity, null);
    }

    public static Notification rejected(Order order, long qty, RejectReason reason) {
        return new Notification(NotificationKind.REJECTED, order.copy(), null, qty, reason);
    }

    @Override
    public String toString() {
        return kind + (reason != null ? "(" + reason + ")" : "") + " " + order;
    }
}
