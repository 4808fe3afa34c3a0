package com.mktsim.engine.agent;

import com.mktsim.engine.kernel.Agent;
import com.mktsim.engine.kernel.AgentAction;
import com.mktsim.engine.kernel.AgentContext;
import com.mktsim.engine.kernel.Wakeup;
import com.mktsim.protocol.Notification;
import com.mktsim.protocol.Order;
import com.mktsim.protocol.RejectReason;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Replays a historical order stream into one symbol's book.
 *
 * Records are grouped by time. The agent wakes once per distinct time, books
 * its next wake-up first, then turns each record due now into an action:
 *   - id not open, size > 0 -> place a limit order under that id
 *   - id open, size == 0    -> cancel it
 *   - id open, size > 0     -> modify it to the record's price and size
 *
 * Execution reports are kept so the replayed trade tape can be inspected.
 */
public final class MarketReplayAgent implements Agent {

    private static final Logger log = LoggerFactory.getLogger(MarketReplayAgent.class);

    /** One execution reported back to the agent. */
    public record Execution(long time, long orderId, long price, long quantity) {}

    private final int id;
    private final String symbol;

    private final Long2ObjectOpenHashMap<List<ReplayRecord>> recordsByTime = new Long2ObjectOpenHashMap<>();
    private final PriorityQueue<Long> wakeupTimes = new PriorityQueue<>();

    // orderId -> our copy of what is resting
    private final Long2ObjectOpenHashMap<Order> openOrders = new Long2ObjectOpenHashMap<>();
    // orderId -> resting order before a modify the exchange has not answered yet
    private final Long2ObjectOpenHashMap<Order> pendingModifies = new Long2ObjectOpenHashMap<>();
    private final List<Execution> executions = new ArrayList<>();
    private Long lastTradePrice;

    public MarketReplayAgent(int id, String symbol, List<ReplayRecord> records) {
        this.id = id;
        this.symbol = symbol;
        for (ReplayRecord r : records) {
            List<ReplayRecord> atTime = recordsByTime.get(r.time());
            if (atTime == null) {
                atTime = new ArrayList<>();
                recordsByTime.put(r.time(), atTime);
                wakeupTimes.add(r.time());
            }
            atTime.add(r);
        }
    }

    @Override
    public int id() { return id; }

    @Override
    public List<AgentAction> onStart(AgentContext ctx) {
        int skipped = 0;
        while (!wakeupTimes.isEmpty() && wakeupTimes.peek() < ctx.startTime) {
            skipped += recordsByTime.remove((long) wakeupTimes.poll()).size();
        }
        if (skipped > 0) log.info("Replay agent {}: skipped {} records before start", id, skipped);
        if (wakeupTimes.isEmpty()) return List.of();
        return List.of(AgentAction.scheduleWakeup(wakeupTimes.poll()));
    }

    @Override
    public List<AgentAction> onEvent(long currentTime, Object payload) {
        if (payload instanceof Wakeup) {
            return wakeup(currentTime);
        }
        if (payload instanceof Notification n) {
            onNotification(currentTime, n);
        }
        return List.of();
    }

    private List<AgentAction> wakeup(long currentTime) {
        List<AgentAction> actions = new ArrayList<>();
        if (!wakeupTimes.isEmpty()) {
            actions.add(AgentAction.scheduleWakeup(wakeupTimes.poll()));
        } else {
            log.info("Replay agent {} submitted all orders. Last order @ {}", id, currentTime);
        }
        List<ReplayRecord> due = recordsByTime.remove(currentTime);
        if (due != null) {
            for (ReplayRecord r : due) {
                AgentAction action = toAction(currentTime, r);
                if (action != null) actions.add(action);
            }
        }
        return actions;
    }

    private AgentAction toAction(long currentTime, ReplayRecord r) {
        Order existing = openOrders.get(r.orderId());
        if (existing == null && r.size() > 0) {
            Order order = Order.limit(id, currentTime, symbol, r.side(), r.size(), r.price(), r.orderId(), null);
            openOrders.put(r.orderId(), order);
            return AgentAction.placeOrder(order);
        }
        if (existing != null && r.size() == 0) {
            return AgentAction.cancelOrder(existing);
        }
        if (existing != null) {
            Order replacement = Order.limit(id, currentTime, symbol, existing.side, r.size(), r.price(), r.orderId(), null);
            pendingModifies.putIfAbsent(r.orderId(), existing);
            openOrders.put(r.orderId(), replacement);
            return AgentAction.modifyOrder(replacement);
        }
        log.debug("Replay agent {}: ignoring record for unknown order {}", id, r);
        return null;
    }

    private void onNotification(long currentTime, Notification n) {
        long orderId = n.orderId();
        switch (n.kind()) {
            case EXECUTED -> {
                executions.add(new Execution(currentTime, orderId, n.fillPrice(), n.quantity()));
                lastTradePrice = n.fillPrice();
                Order open = openOrders.get(orderId);
                if (open != null) {
                    long left = open.quantity - n.quantity();
                    if (left <= 0) openOrders.remove(orderId);
                    else openOrders.put(orderId, open.withQuantity(left));
                }
            }
            case MODIFIED -> pendingModifies.remove(orderId);
            case CANCELLED -> {
                openOrders.remove(orderId);
                pendingModifies.remove(orderId);
            }
            case REJECTED -> {
                // A rejected modify leaves the previous order resting, unless it is gone.
                Order previous = pendingModifies.remove(orderId);
                if (previous != null && n.reason() != RejectReason.ORDER_NOT_FOUND) {
                    log.debug("Replay agent {}: modify of {} rejected ({}), order still resting", id, orderId, n.reason());
                    openOrders.put(orderId, previous);
                } else {
                    openOrders.remove(orderId);
                }
            }
            default -> { }
        }
    }

    public List<Execution> executions() {
        return Collections.unmodifiableList(executions);
    }

    public Long lastTradePrice() { return lastTradePrice; }

    public int openOrderCount() { return openOrders.size(); }

    public boolean isOpen(long orderId) { return openOrders.containsKey(orderId); }
}
