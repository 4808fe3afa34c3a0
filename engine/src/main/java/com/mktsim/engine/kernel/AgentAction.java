package com.mktsim.engine.kernel;

import com.mktsim.protocol.Order;

import java.util.Objects;

/**
 * Something an agent asks the kernel to do on its behalf.
 * Only the fields of the action's {@link Type} are set.
 */
public final class AgentAction {

    public enum Type {
        PLACE_ORDER,
        MODIFY_ORDER,
        CANCEL_ORDER,
        SCHEDULE_WAKEUP,
        SEND_MESSAGE
    }

    public final Type   type;
    public final Order  order;        // PLACE / MODIFY (replacement) / CANCEL
    public final long   time;         // SCHEDULE_WAKEUP: absolute; SEND_MESSAGE: delay
    public final int    recipientId;  // SEND_MESSAGE
    public final Object body;         // SEND_MESSAGE

    private AgentAction(Type type, Order order, long time, int recipientId, Object body) {
        this.type = type;
        this.order = order;
        this.time = time;
        this.recipientId = recipientId;
        this.body = body;
    }

    /** Submit a new order. If it has no id, the kernel assigns one. */
    public static AgentAction placeOrder(Order order) {
        return new AgentAction(Type.PLACE_ORDER, Objects.requireNonNull(order), 0L, -1, null);
    }

    /** Replace a resting limit order; the replacement carries the original order id. */
    public static AgentAction modifyOrder(Order replacement) {
        return new AgentAction(Type.MODIFY_ORDER, Objects.requireNonNull(replacement), 0L, -1, null);
    }

    public static AgentAction cancelOrder(Order order) {
        return new AgentAction(Type.CANCEL_ORDER, Objects.requireNonNull(order), 0L, -1, null);
    }

    public static AgentAction scheduleWakeup(long time) {
        return new AgentAction(Type.SCHEDULE_WAKEUP, null, time, -1, null);
    }

    public static AgentAction sendMessage(int recipientId, long delay, Object body) {
        if (delay < 0) throw new IllegalArgumentException("Negative message delay: " + delay);
        return new AgentAction(Type.SEND_MESSAGE, null, delay, recipientId, body);
    }

    @Override
    public String toString() {
        return switch (type) {
            case PLACE_ORDER, MODIFY_ORDER, CANCEL_ORDER -> type + " " + order;
            case SCHEDULE_WAKEUP -> type + " @ " + time;
            case SEND_MESSAGE -> type + " -> " + recipientId + " +" + time + ": " + body;
        };
    }
}
