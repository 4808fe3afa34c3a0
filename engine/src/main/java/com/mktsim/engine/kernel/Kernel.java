package com.mktsim.engine.kernel;

import com.mktsim.common.LatencyStats;
import com.mktsim.common.SimConfig;
import com.mktsim.common.SimTime;
import com.mktsim.engine.agent.Oracle;
import com.mktsim.engine.exchange.Exchange;
import com.mktsim.protocol.Notification;
import com.mktsim.protocol.Order;
import com.mktsim.protocol.RejectReason;
import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Random;

/**
 * Discrete-event simulation kernel.
 *
 * Run loop: pop earliest event -> advance time -> deliver to agent -> apply
 * the agent's actions (orders go to the exchange, notifications and wake-ups
 * go back into the queue). Stops when the queue is empty or the next event is
 * due after {@code endTime}.
 *
 * Single thread. The kernel is the only owner of the event queue, the clock
 * and the exchange; nothing mutates the books outside {@link #run()}.
 */
public final class Kernel {

    private static final Logger log = LoggerFactory.getLogger(Kernel.class);

    private final long startTime;
    private final long endTime;
    private final long seed;
    private final long notificationDelay;
    private final boolean logOrders;

    private final Exchange exchange;
    private final Oracle oracle;
    private final EventQueue queue = new EventQueue(this::currentTime);
    private final OrderIdAllocator orderIds = new OrderIdAllocator();
    private final Int2ObjectLinkedOpenHashMap<Agent> agents = new Int2ObjectLinkedOpenHashMap<>();
    private final LatencyStats handlerLatency = new LatencyStats("agent-handler");

    private final Exchange.NotificationSink notifier = this::scheduleNotification;

    private long currentTime;
    private long eventsDelivered;
    private boolean started;

    public Kernel(SimConfig cfg, Exchange exchange, Oracle oracle) {
        this(cfg.startTime, cfg.endTime, cfg.seed, cfg.notificationDelayNanos, cfg.logOrders, exchange, oracle);
    }

    public Kernel(long startTime, long endTime, long seed, Exchange exchange) {
        this(startTime, endTime, seed, 0L, false, exchange, null);
    }

    public Kernel(long startTime, long endTime, long seed, long notificationDelay, boolean logOrders,
                  Exchange exchange, Oracle oracle) {
        if (endTime < startTime) {
            throw new IllegalArgumentException("endTime " + endTime + " before startTime " + startTime);
        }
        if (notificationDelay < 0) {
            throw new IllegalArgumentException("Negative notification delay: " + notificationDelay);
        }
        this.startTime = startTime;
        this.endTime = endTime;
        this.seed = seed;
        this.notificationDelay = notificationDelay;
        this.logOrders = logOrders;
        this.exchange = exchange;
        this.oracle = oracle;
        this.currentTime = startTime;
    }

    public void addAgent(Agent agent) {
        if (started) throw new IllegalStateException("Cannot add agents to a running kernel");
        if (agents.containsKey(agent.id())) {
            throw new IllegalArgumentException("Duplicate agent id " + agent.id());
        }
        agents.put(agent.id(), agent);
    }

    /** Schedule a wake-up for an agent from outside the run, e.g. during setup. */
    public void scheduleWakeup(int agentId, long time) {
        queue.schedule(time, agentId, new Wakeup(time));
    }

    public RunSummary run() {
        if (started) throw new IllegalStateException("Kernel already ran");
        started = true;

        log.info("Kernel starting: agents={} start={} end={} seed={}",
                agents.size(), SimTime.format(startTime), SimTime.format(endTime), seed);

        for (Agent agent : agents.values()) {
            AgentContext ctx = new AgentContext(agent.id(), startTime, endTime, agentRandom(agent.id()), oracle);
            apply(agent, agent.onStart(ctx));
        }

        RunSummary.StopReason reason = RunSummary.StopReason.QUEUE_EMPTY;
        while (!queue.isEmpty()) {
            if (queue.peekNextTime() > endTime) {
                reason = RunSummary.StopReason.END_TIME_REACHED;
                break;
            }
            ScheduledEvent event = queue.popNext();
            deliver(event);
        }

        for (Agent agent : agents.values()) {
            agent.onStop(currentTime);
        }
        handlerLatency.logAndReset();
        log.info("Kernel stopped: reason={} time={} events={} pending={}",
                reason, SimTime.format(currentTime), eventsDelivered, queue.size());
        return new RunSummary(currentTime, eventsDelivered, reason);
    }

    private void deliver(ScheduledEvent event) {
        if (event.dueTime() < currentTime) {
            throw new IllegalStateException("Event queue out of order: " + event + " popped at " + currentTime);
        }
        Agent agent = agents.get(event.recipientId());
        if (agent == null) {
            throw new IllegalStateException("Event addressed to unknown agent: " + event);
        }
        currentTime = event.dueTime();
        eventsDelivered++;

        long t0 = System.nanoTime();
        List<AgentAction> actions = agent.onEvent(currentTime, event.payload());
        handlerLatency.record(System.nanoTime() - t0);

        apply(agent, actions);
    }

    private void apply(Agent agent, List<AgentAction> actions) {
        if (actions == null) return;
        for (AgentAction action : actions) {
            if (action.order != null && action.order.agentId != agent.id()) {
                log.warn("Agent {} submitted an order owned by agent {}: {}", agent.id(), action.order.agentId, action);
                scheduleNotification(agent.id(),
                        Notification.rejected(action.order, action.order.quantity, RejectReason.INVALID_ORDER));
                continue;
            }
            switch (action.type) {
                case PLACE_ORDER -> {
                    Order order = assignId(action.order);
                    if (logOrders) log.info("{} places {}", agent.id(), order);
                    exchange.placeOrder(order, currentTime, notifier);
                }
                case MODIFY_ORDER -> {
                    if (logOrders) log.info("{} modifies {}", agent.id(), action.order);
                    exchange.modifyOrder(action.order, currentTime, notifier);
                }
                case CANCEL_ORDER -> {
                    if (logOrders) log.info("{} cancels {}", agent.id(), action.order);
                    exchange.cancelOrder(action.order, currentTime, notifier);
                }
                case SCHEDULE_WAKEUP -> scheduleFor(agent.id(), action.time, agent.id(), new Wakeup(action.time));
                case SEND_MESSAGE -> {
                    if (!agents.containsKey(action.recipientId)) {
                        log.warn("Agent {} message to unknown agent {} dropped", agent.id(), action.recipientId);
                    } else {
                        scheduleFor(agent.id(), after(action.time), action.recipientId,
                                new AgentMessage(agent.id(), action.body));
                    }
                }
            }
        }
    }

    // A request into the past does not stop the run; the requester is told instead.
    private void scheduleFor(int requesterId, long dueTime, int recipientId, Object payload) {
        try {
            queue.schedule(dueTime, recipientId, payload);
        } catch (InvalidScheduleException e) {
            log.warn("Agent {} schedule rejected: {}", requesterId, e.getMessage());
            queue.schedule(currentTime, requesterId, new ScheduleRejected(dueTime, currentTime));
        }
    }

    // currentTime + delay, saturating at Long.MAX_VALUE
    private long after(long delay) {
        try {
            return Math.addExact(currentTime, delay);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private Order assignId(Order order) {
        if (order.hasOrderId()) {
            orderIds.observe(order.orderId);
            return order;
        }
        return order.withOrderId(orderIds.next());
    }

    private void scheduleNotification(int agentId, Notification notification) {
        if (!agents.containsKey(agentId)) {
            log.warn("Notification for unknown agent {} dropped: {}", agentId, notification);
            return;
        }
        queue.schedule(after(notificationDelay), agentId, notification);
    }

    // Stable per-agent stream: same seed and id give the same draws.
    private Random agentRandom(int agentId) {
        return new Random(seed * 0x9E3779B97F4A7C15L + agentId);
    }

    public long currentTime() { return currentTime; }

    public Exchange exchange() { return exchange; }

    public int pendingEvents() { return queue.size(); }
}
