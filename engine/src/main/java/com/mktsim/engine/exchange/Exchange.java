package com.mktsim.engine.exchange;

import com.mktsim.engine.book.LimitOrderBook;
import com.mktsim.protocol.Notification;
import com.mktsim.protocol.Order;
import com.mktsim.protocol.OrderType;
import com.mktsim.protocol.RejectReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Routes order requests to the per-symbol books and turns their outcomes into
 * notifications for the agents involved.
 *
 * Every request ends in at least one notification to its submitter. Nothing
 * here throws for a bad request: it is rejected with a {@link RejectReason}
 * and no book is touched.
 *
 * Single-threaded; owned by the kernel.
 */
public final class Exchange {

    private static final Logger log = LoggerFactory.getLogger(Exchange.class);

    /** Receives each notification together with the id of the agent it is for. */
    @FunctionalInterface
    public interface NotificationSink {
        void notify(int agentId, Notification notification);
    }

    private final Map<String, LimitOrderBook> books = new LinkedHashMap<>();
    private final BasketPricer basketPricer;

    public Exchange(Collection<String> symbols) {
        this(symbols, null);
    }

    public Exchange(Collection<String> symbols, BasketPricer basketPricer) {
        for (String symbol : symbols) {
            books.put(symbol, new LimitOrderBook(symbol));
        }
        this.basketPricer = basketPricer;
        log.info("Exchange open for symbols {}", books.keySet());
    }

    public void placeOrder(Order order, long now, NotificationSink sink) {
        if (order.quantity <= 0) {
            reject(order, RejectReason.INVALID_QTY, sink);
            return;
        }
        LimitOrderBook book = books.get(order.symbol);
        if (book == null) {
            reject(order, RejectReason.UNKNOWN_SYMBOL, sink);
            return;
        }
        if (order.type == OrderType.BASKET) {
            settleBasket(order, now, sink);
            return;
        }

        RejectReason reason = book.validate(order);
        if (reason != null) {
            reject(order, reason, sink);
            return;
        }

        if (order.type == OrderType.LIMIT) {
            sink.notify(order.agentId, Notification.acked(order));
            book.addLimitOrder(order, now, fillNotifier(sink));
        } else {
            if (book.isSideEmpty(order.side.opposite())) {
                log.debug("No liquidity for {}", order);
                reject(order, RejectReason.NO_LIQUIDITY, sink);
                return;
            }
            sink.notify(order.agentId, Notification.acked(order));
            long unfilled = book.executeMarketOrder(order, now, fillNotifier(sink));
            if (unfilled > 0) {
                sink.notify(order.agentId,
                        Notification.rejected(order.withQuantity(unfilled), unfilled, RejectReason.NO_LIQUIDITY));
            }
        }
    }

    /**
     * Replace a resting limit order with {@code replacement} (same order id).
     * The replacement joins the back of its price level, so time priority is lost.
     */
    public void modifyOrder(Order replacement, long now, NotificationSink sink) {
        if (replacement.type != OrderType.LIMIT) {
            reject(replacement, RejectReason.INVALID_ORDER, sink);
            return;
        }
        if (replacement.quantity <= 0) {
            reject(replacement, RejectReason.INVALID_QTY, sink);
            return;
        }
        if (replacement.limitPrice <= 0) {
            reject(replacement, RejectReason.INVALID_PRICE, sink);
            return;
        }
        LimitOrderBook book = books.get(replacement.symbol);
        if (book == null) {
            reject(replacement, RejectReason.UNKNOWN_SYMBOL, sink);
            return;
        }
        Order existing = book.getOrder(replacement.orderId);
        if (existing == null) {
            reject(replacement, RejectReason.ORDER_NOT_FOUND, sink);
            return;
        }
        if (existing.side != replacement.side || existing.agentId != replacement.agentId) {
            reject(replacement, RejectReason.INVALID_ORDER, sink);
            return;
        }

        sink.notify(replacement.agentId, Notification.modified(replacement));
        book.modify(replacement, now, fillNotifier(sink));
    }

    public void cancelOrder(Order order, long now, NotificationSink sink) {
        LimitOrderBook book = books.get(order.symbol);
        if (book == null) {
            reject(order, RejectReason.UNKNOWN_SYMBOL, sink);
            return;
        }
        Order resting = book.getOrder(order.orderId);
        if (resting == null) {
            log.debug("Cancel of {} at {}: not resting", order.orderId, now);
            reject(order, RejectReason.ORDER_NOT_FOUND, sink);
            return;
        }
        if (resting.agentId != order.agentId) {
            log.warn("Agent {} tried to cancel order {} owned by agent {}", order.agentId, order.orderId, resting.agentId);
            reject(order, RejectReason.INVALID_ORDER, sink);
            return;
        }
        Order removed = book.cancel(order.orderId);
        sink.notify(removed.agentId, Notification.cancelled(removed));
    }

    // Baskets never touch the book: they settle at once at the price supplied
    // with the order or by the configured pricer.
    private void settleBasket(Order order, long now, NotificationSink sink) {
        Long price = order.fillPrice;
        if (price == null && basketPricer != null) {
            price = basketPricer.price(order, now);
        }
        if (price == null) {
            reject(order, RejectReason.INVALID_PRICE, sink);
            return;
        }
        sink.notify(order.agentId, Notification.executed(order, price, order.quantity));
    }

    private LimitOrderBook.MatchCallback fillNotifier(NotificationSink sink) {
        return (aggressor, passive, fill) -> {
            sink.notify(passive.agentId, Notification.executed(passive, fill.price(), fill.quantity()));
            sink.notify(aggressor.agentId, Notification.executed(aggressor, fill.price(), fill.quantity()));
        };
    }

    private void reject(Order order, RejectReason reason, NotificationSink sink) {
        log.debug("Rejected {}: {}", order, reason);
        sink.notify(order.agentId, Notification.rejected(order, order.quantity, reason));
    }

    public LimitOrderBook book(String symbol) {
        return books.get(symbol);
    }

    public Set<String> symbols() {
        return books.keySet();
    }

    public Long lastTradePrice(String symbol) {
        LimitOrderBook book = books.get(symbol);
        return book == null ? null : book.lastTradePrice();
    }
}
