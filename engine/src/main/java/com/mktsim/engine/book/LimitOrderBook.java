package com.mktsim.engine.book;

import com.mktsim.protocol.Fill;
import com.mktsim.protocol.Order;
import com.mktsim.protocol.OrderType;
import com.mktsim.protocol.RejectReason;
import com.mktsim.protocol.Side;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Limit order book for a single symbol.
 *
 * Data structures:
 *   - bids: TreeMap<Long, PriceLevel> ascending; best bid = lastKey() (highest price)
 *   - asks: TreeMap<Long, PriceLevel> ascending; best ask = firstKey() (lowest price)
 *   - orderMap: Long2ObjectOpenHashMap for O(1) cancel lookup
 *
 * Matching is price-time: best opposing price first, oldest order first within
 * a price, execution at the resting order's price. After every insertion the
 * book is uncrossed.
 *
 * Not thread-safe. Only the kernel's delivery step may call into it.
 */
public final class LimitOrderBook {

    private static final Logger log = LoggerFactory.getLogger(LimitOrderBook.class);

    public interface MatchCallback {
        /**
         * Called for each fill generated.
         * @param aggressor the incoming order, at its quantity before this fill
         * @param passive   the resting order, at its quantity before this fill
         * @param fill      price (the passive order's limit) and quantity
         */
        void onFill(Order aggressor, Order passive, Fill fill);
    }

    /** Aggregated size at one price. */
    public record LevelSummary(long price, long quantity) {}

    private final String symbol;

    private final TreeMap<Long, PriceLevel> bids = new TreeMap<>(); // price -> level
    private final TreeMap<Long, PriceLevel> asks = new TreeMap<>(); // price -> level

    // orderId -> current resting record
    private final Long2ObjectOpenHashMap<Order> orderMap = new Long2ObjectOpenHashMap<>(1024);

    private Long lastTradePrice;

    public LimitOrderBook(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Checks a new order before any mutation. Returns null when the order is
     * acceptable.
     */
    public RejectReason validate(Order order) {
        if (order.quantity <= 0) return RejectReason.INVALID_QTY;
        if (!symbol.equals(order.symbol)) return RejectReason.UNKNOWN_SYMBOL;
        if (order.type == OrderType.BASKET) return RejectReason.INVALID_ORDER;
        if (order.type == OrderType.LIMIT && order.limitPrice <= 0) return RejectReason.INVALID_PRICE;
        if (orderMap.containsKey(order.orderId)) return RejectReason.INVALID_ORDER;
        return null;
    }

    /**
     * Add a limit order. Matches against the opposing side first; any remainder
     * rests at the back of its price level.
     * Returns true if a remainder was added to the book.
     */
    public boolean addLimitOrder(Order incoming, long now, MatchCallback cb) {
        long remaining = match(incoming, now, false, cb);
        if (remaining <= 0) return false; // fully filled

        Order rest = remaining == incoming.quantity ? incoming : incoming.withQuantity(remaining);
        restOrder(rest);
        return true;
    }

    /**
     * Execute a market order against the opposing side until it is filled or
     * the side is empty. Never rests. Returns the unfilled quantity.
     */
    public long executeMarketOrder(Order incoming, long now, MatchCallback cb) {
        return match(incoming, now, true, cb);
    }

    private long match(Order incoming, long now, boolean crossesAlways, MatchCallback cb) {
        TreeMap<Long, PriceLevel> opposing = incoming.isBuyOrder() ? asks : bids;
        long remaining = incoming.quantity;

        while (remaining > 0 && !opposing.isEmpty()) {
            Map.Entry<Long, PriceLevel> best = incoming.isBuyOrder() ? opposing.firstEntry() : opposing.lastEntry();
            PriceLevel level = best.getValue();
            Order passive = level.head();
            if (!crossesAlways && !passive.isMatch(incoming)) break; // no cross

            remaining = matchLevel(incoming, remaining, level, now, crossesAlways, cb);

            if (level.isEmpty()) {
                opposing.remove(best.getKey());
            }
        }
        return remaining;
    }

    private long matchLevel(Order incoming, long remaining, PriceLevel level, long now,
                            boolean crossesAlways, MatchCallback cb) {
        Order passive = level.head();
        while (passive != null && remaining > 0) {
            if (!crossesAlways && !passive.isMatch(incoming)) break;

            long fillQty = Math.min(remaining, passive.quantity);
            long price = passive.limitPrice;
            Fill fill = incoming.isBuyOrder()
                    ? new Fill(incoming.orderId, passive.orderId, price, fillQty, now)
                    : new Fill(passive.orderId, incoming.orderId, price, fillQty, now);

            cb.onFill(remaining == incoming.quantity ? incoming : incoming.withQuantity(remaining), passive, fill);

            remaining -= fillQty;
            lastTradePrice = price;

            if (passive.quantity == fillQty) {
                level.removeOrder(passive.orderId);
                orderMap.remove(passive.orderId);
            } else {
                Order reduced = passive.withQuantity(passive.quantity - fillQty);
                level.replace(reduced);
                orderMap.put(reduced.orderId, reduced);
            }
            passive = level.head();
        }
        return remaining;
    }

    private void restOrder(Order o) {
        TreeMap<Long, PriceLevel> book = o.isBuyOrder() ? bids : asks;
        PriceLevel level = book.get(o.limitPrice);
        if (level == null) {
            level = new PriceLevel(o.limitPrice);
            book.put(o.limitPrice, level);
        }
        level.addOrder(o);
        orderMap.put(o.orderId, o);
    }

    /** Cancel by order id. Returns the removed resting record, or null if not resting. */
    public Order cancel(long orderId) {
        Order o = orderMap.remove(orderId);
        if (o == null) return null;

        TreeMap<Long, PriceLevel> book = o.isBuyOrder() ? bids : asks;
        PriceLevel level = book.get(o.limitPrice);
        if (level == null || level.removeOrder(orderId) == null) {
            throw new IllegalStateException("Order " + orderId + " indexed but missing from its level in " + symbol);
        }
        if (level.isEmpty()) {
            book.remove(level.price);
        }
        return o;
    }

    /**
     * Replace a resting order with a new price/quantity. The old slot is
     * vacated before the replacement is inserted, so the order cannot match
     * itself and loses its time priority. The re-inserted record is stamped
     * with {@code now}.
     * Returns the replaced record, or null if the id is not resting (book unchanged).
     */
    public Order modify(Order replacement, long now, MatchCallback cb) {
        Order old = cancel(replacement.orderId);
        if (old == null) {
            log.debug("Modify for {} in {}: order not resting", replacement.orderId, symbol);
            return null;
        }
        addLimitOrder(replacement.withTimePlaced(now), now, cb);
        return old;
    }

    // ---- Queries ----

    /** Copy of the resting record, or null if the id is not resting. */
    public Order getOrder(long orderId) {
        Order o = orderMap.get(orderId);
        return o == null ? null : o.copy();
    }

    public boolean contains(long orderId) {
        return orderMap.containsKey(orderId);
    }

    public boolean isSideEmpty(Side side) {
        return side == Side.BUY ? bids.isEmpty() : asks.isEmpty();
    }

    public long bestBid() { return bids.isEmpty() ? Long.MIN_VALUE : bids.lastKey(); }
    public long bestAsk() { return asks.isEmpty() ? Long.MAX_VALUE : asks.firstKey(); }

    public int bidLevels() { return bids.size(); }
    public int askLevels() { return asks.size(); }

    public int size() { return orderMap.size(); }

    public Long lastTradePrice() { return lastTradePrice; }

    /** Copies of the resting orders of one side in priority order (best price first, then FIFO). */
    public List<Order> orders(Side side) {
        List<Order> out = new ArrayList<>();
        for (PriceLevel level : ladder(side).values()) {
            for (Order o : level.orders()) {
                out.add(o.copy());
            }
        }
        return out;
    }

    /** Aggregated size of the best {@code depth} price levels of one side. */
    public List<LevelSummary> depth(Side side, int depth) {
        List<LevelSummary> out = new ArrayList<>(Math.min(depth, 64));
        for (PriceLevel level : ladder(side).values()) {
            if (out.size() >= depth) break;
            out.add(new LevelSummary(level.price, level.totalQty()));
        }
        return out;
    }

    private Map<Long, PriceLevel> ladder(Side side) {
        return side == Side.BUY ? bids.descendingMap() : asks;
    }

    public String symbol() { return symbol; }
}
