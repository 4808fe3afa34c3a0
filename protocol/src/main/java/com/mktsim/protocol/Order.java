package com.mktsim.protocol;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * An order submitted by an agent. Closed over {@link OrderType}: market, limit
 * and basket orders share one class and are told apart by {@link #type}.
 *
 * Identity and size fields are final. A partial fill never shrinks an order in
 * place; the book swaps in a reduced copy from {@link #withQuantity(long)}.
 * The only mutable field is {@link #fillPrice}, which is set when the order
 * (or a copy of it) executes.
 *
 * Prices are integer cents.
 */
public final class Order {

    private static final Logger log = LoggerFactory.getLogger(Order.class);

    /** Order id not yet assigned; the kernel allocates one on submission. */
    public static final long NO_ID = 0L;

    /**
     * A limit price of this value prints as "MKT". It is still an ordinary
     * limit price to the book: the order rests and matches like any other.
     */
    public static final long MARKET_PRICE_SENTINEL = Long.MAX_VALUE;

    public final OrderType type;
    public final Side      side;
    public final long      orderId;
    public final int       agentId;
    public final String    symbol;
    public final long      timePlaced;   // virtual ns
    public final long      quantity;
    public final long      limitPrice;   // LIMIT only
    public final boolean   dollar;       // BASKET only
    public final Object    tag;

    public Long fillPrice;

    private Order(OrderType type, Side side, long orderId, int agentId, String symbol, long timePlaced,
                  long quantity, long limitPrice, boolean dollar, Object tag) {
        this.type       = Objects.requireNonNull(type, "type");
        this.side       = Objects.requireNonNull(side, "side");
        this.orderId    = orderId;
        this.agentId    = agentId;
        this.symbol     = symbol;
        this.timePlaced = timePlaced;
        this.quantity   = quantity;
        this.limitPrice = limitPrice;
        this.dollar     = dollar;
        this.tag        = tag;
    }

    // ---- Factories ----

    public static Order market(int agentId, long timePlaced, String symbol, Side side, long quantity) {
        return market(agentId, timePlaced, symbol, side, quantity, NO_ID, null);
    }

    public static Order market(int agentId, long timePlaced, String symbol, Side side, long quantity,
                               long orderId, Object tag) {
        return new Order(OrderType.MARKET, side, orderId, agentId, symbol, timePlaced, quantity, 0L, false, tag);
    }

    public static Order limit(int agentId, long timePlaced, String symbol, Side side, long quantity, long limitPrice) {
        return limit(agentId, timePlaced, symbol, side, quantity, limitPrice, NO_ID, null);
    }

    public static Order limit(int agentId, long timePlaced, String symbol, Side side, long quantity,
                              long limitPrice, long orderId, Object tag) {
        return new Order(OrderType.LIMIT, side, orderId, agentId, symbol, timePlaced, quantity, limitPrice, false, tag);
    }

    public static Order bid(int agentId, long timePlaced, String symbol, long quantity, long limitPrice) {
        return limit(agentId, timePlaced, symbol, Side.BUY, quantity, limitPrice);
    }

    public static Order ask(int agentId, long timePlaced, String symbol, long quantity, long limitPrice) {
        return limit(agentId, timePlaced, symbol, Side.SELL, quantity, limitPrice);
    }

    /** Basket order: {@code creation == true} is a buy (ETF creation), false a redemption. */
    public static Order basket(int agentId, long timePlaced, String symbol, long quantity, boolean creation,
                               boolean dollar, long orderId) {
        return new Order(OrderType.BASKET, creation ? Side.BUY : Side.SELL, orderId, agentId, symbol, timePlaced,
                quantity, 0L, dollar, null);
    }

    // ---- Copies ----

    /**
     * Copy with the same identity, price and tag. The copy's fill price starts
     * equal to this order's but is independent from then on.
     */
    public Order copy() {
        Order order = switch (type) {
            case MARKET -> new Order(OrderType.MARKET, side, orderId, agentId, symbol, timePlaced,
                    quantity, 0L, false, tag);
            case LIMIT -> new Order(OrderType.LIMIT, side, orderId, agentId, symbol, timePlaced,
                    quantity, limitPrice, false, tag);
            case BASKET -> new Order(OrderType.BASKET, side, orderId, agentId, symbol, timePlaced,
                    quantity, 0L, dollar, null);
        };
        order.fillPrice = fillPrice;
        return order;
    }

    public Order withQuantity(long newQuantity) {
        Order order = new Order(type, side, orderId, agentId, symbol, timePlaced, newQuantity, limitPrice, dollar, tag);
        order.fillPrice = fillPrice;
        return order;
    }

    public Order withOrderId(long newOrderId) {
        Order order = new Order(type, side, newOrderId, agentId, symbol, timePlaced, quantity, limitPrice, dollar, tag);
        order.fillPrice = fillPrice;
        return order;
    }

    public Order withTimePlaced(long newTimePlaced) {
        Order order = new Order(type, side, orderId, agentId, symbol, newTimePlaced, quantity, limitPrice, dollar, tag);
        order.fillPrice = fillPrice;
        return order;
    }

    // ---- Queries ----

    public boolean isBuyOrder() { return side == Side.BUY; }

    public boolean hasOrderId() { return orderId != NO_ID; }

    public boolean isLimit() { return type == OrderType.LIMIT; }

    /**
     * True if {@code other} can execute against this order: the buy side's
     * limit is at or above the sell side's. Only defined between a buy and a
     * sell; same-side calls log a warning and return false.
     */
    public boolean isMatch(Order other) {
        if (side == other.side) {
            log.warn("isMatch() called on limit orders of same side: {} vs {}", this, other);
            return false;
        }
        if (isBuyOrder()) {
            return limitPrice >= other.limitPrice;
        }
        return limitPrice <= other.limitPrice;
    }

    public boolean hasEqPrice(Order other) {
        return limitPrice == other.limitPrice;
    }

    /**
     * True if this order's price is strictly better than {@code other}'s:
     * higher for buys, lower for sells. Only defined within one side;
     * cross-side calls log a warning and return false.
     */
    public boolean hasBetterPrice(Order other) {
        if (side != other.side) {
            log.warn("hasBetterPrice() called on orders of different side: {} vs {}", side, other.side);
            return false;
        }
        if (isBuyOrder()) {
            return limitPrice > other.limitPrice;
        }
        return limitPrice < other.limitPrice;
    }

    // ---- Identity ----

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Order other)) return false;
        return orderId == other.orderId;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(orderId);
    }

    @Override
    public String toString() {
        String filled = fillPrice != null ? " (filled @ " + dollarize(fillPrice) + ")" : "";
        return switch (type) {
            case MARKET -> "(Agent " + agentId + " @ " + timePlaced + ") : MKT Order "
                    + side + " " + quantity + " " + symbol + filled;
            case LIMIT -> "(Agent " + agentId + " @ " + timePlaced + (tag != null ? " [" + tag + "]" : "") + ") : "
                    + side + " " + quantity + " " + symbol + " @ "
                    + (limitPrice < MARKET_PRICE_SENTINEL ? dollarize(limitPrice) : "MKT") + filled;
            case BASKET -> "(Order_ID: " + orderId + " Agent " + agentId + " @ " + timePlaced + ") : "
                    + (isBuyOrder() ? "CREATE " : "REDEEM ") + quantity + " " + symbol
                    + (fillPrice != null ? " (filled @ " + (dollar ? dollarize(fillPrice) : fillPrice) + ")" : "");
        };
    }

    /** Formats integer cents as dollars, e.g. 10050 -> "$100.50". */
    public static String dollarize(long cents) {
        String sign = cents < 0 ? "-" : "";
        long abs = Math.abs(cents);
        return String.format("%s$%d.%02d", sign, abs / 100, abs % 100);
    }
}
