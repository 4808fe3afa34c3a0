package com.mktsim.engine.kernel;

import com.mktsim.engine.exchange.Exchange;
import com.mktsim.protocol.Notification;
import com.mktsim.protocol.NotificationKind;
import com.mktsim.protocol.Order;
import com.mktsim.protocol.RejectReason;
import com.mktsim.protocol.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

import static org.junit.jupiter.api.Assertions.*;

class KernelTest {

    private static final String SYM = "ABM";
    private static final long START = 1_000_000L;
    private static final long END = 2_000_000L;

    private Exchange exchange;
    private Kernel kernel;

    @BeforeEach
    void setUp() {
        exchange = new Exchange(List.of(SYM));
        kernel = new Kernel(START, END, 42L, exchange);
    }

    // -----------------------------------------------------------------------
    // Scheduling
    // -----------------------------------------------------------------------
    @Test
    void testDeliversInTimeOrderAndStopsAtEndTime() {
        ScriptedAgent agent = new ScriptedAgent(1, List.of(
                AgentAction.scheduleWakeup(START + 10),
                AgentAction.scheduleWakeup(START + 5),
                AgentAction.scheduleWakeup(END + 1)));
        kernel.addAgent(agent);

        RunSummary summary = kernel.run();

        assertEquals(List.of(START + 5, START + 10), agent.times());
        assertEquals(RunSummary.StopReason.END_TIME_REACHED, summary.stopReason());
        assertEquals(START + 10, summary.finalTime());
        assertEquals(2, summary.eventsDelivered());
        assertEquals(1, kernel.pendingEvents(), "Event past end time is not delivered");
        assertEquals(START + 10, agent.stoppedAt);
    }

    @Test
    void testEventAtEndTimeIsDelivered() {
        ScriptedAgent agent = new ScriptedAgent(1, List.of(AgentAction.scheduleWakeup(END)));
        kernel.addAgent(agent);

        RunSummary summary = kernel.run();

        assertEquals(List.of(END), agent.times());
        assertEquals(RunSummary.StopReason.QUEUE_EMPTY, summary.stopReason());
    }

    @Test
    void testSimultaneousWakeupsFollowScheduleOrder() {
        ScriptedAgent a = new ScriptedAgent(1, List.of(AgentAction.scheduleWakeup(START + 1)));
        ScriptedAgent b = new ScriptedAgent(2, List.of(AgentAction.scheduleWakeup(START + 1)));
        List<Integer> order = new ArrayList<>();
        a.handler = (t, p) -> { order.add(1); return List.of(); };
        b.handler = (t, p) -> { order.add(2); return List.of(); };
        kernel.addAgent(b);
        kernel.addAgent(a);

        kernel.run();

        assertEquals(List.of(2, 1), order, "Agent b started first, so its wake-up was scheduled first");
    }

    @Test
    void testWakeupIntoPastIsReportedToAgent() {
        ScriptedAgent agent = new ScriptedAgent(1, List.of(AgentAction.scheduleWakeup(START + 10)));
        agent.handler = (t, p) -> p instanceof Wakeup ? List.of(AgentAction.scheduleWakeup(START + 5)) : List.of();
        kernel.addAgent(agent);

        RunSummary summary = kernel.run();

        assertEquals(List.of(new Wakeup(START + 10), new ScheduleRejected(START + 5, START + 10)), agent.payloads());
        assertEquals(List.of(START + 10, START + 10), agent.times());
        assertEquals(2, summary.eventsDelivered());
        assertEquals(RunSummary.StopReason.QUEUE_EMPTY, summary.stopReason());
    }

    @Test
    void testMessageDelaySaturatesInsteadOfWrapping() {
        ScriptedAgent a = new ScriptedAgent(1, List.of(AgentAction.scheduleWakeup(START + 5)));
        ScriptedAgent b = new ScriptedAgent(2, List.of());
        a.handler = (t, p) -> p instanceof Wakeup ? List.of(AgentAction.sendMessage(2, Long.MAX_VALUE, "never")) : List.of();
        kernel.addAgent(a);
        kernel.addAgent(b);

        RunSummary summary = kernel.run();

        assertEquals(RunSummary.StopReason.END_TIME_REACHED, summary.stopReason());
        assertEquals(1, kernel.pendingEvents());
        assertTrue(b.received.isEmpty());
        assertEquals(List.of(new Wakeup(START + 5)), a.payloads());
    }

    @Test
    void testUnknownRecipientIsFatal() {
        kernel.addAgent(new ScriptedAgent(1, List.of()));
        kernel.scheduleWakeup(99, START);

        assertThrows(IllegalStateException.class, kernel::run);
    }

    @Test
    void testDuplicateAgentIdRejected() {
        kernel.addAgent(new ScriptedAgent(1, List.of()));
        assertThrows(IllegalArgumentException.class, () -> kernel.addAgent(new ScriptedAgent(1, List.of())));
    }

    @Test
    void testMessagesBetweenAgents() {
        ScriptedAgent a = new ScriptedAgent(1, List.of(AgentAction.sendMessage(2, 3, "hello")));
        ScriptedAgent b = new ScriptedAgent(2, List.of());
        kernel.addAgent(a);
        kernel.addAgent(b);

        kernel.run();

        assertEquals(List.of(START + 3), b.times());
        assertEquals(new AgentMessage(1, "hello"), b.payloads().get(0));
        assertTrue(a.received.isEmpty());
    }

    // -----------------------------------------------------------------------
    // Orders and notifications
    // -----------------------------------------------------------------------
    @Test
    void testFillsDeliveredSameTickBeforeLaterWakeup() {
        ScriptedAgent seller = new ScriptedAgent(1, List.of(
                AgentAction.placeOrder(Order.ask(1, START, SYM, 5, 100))));
        ScriptedAgent buyer = new ScriptedAgent(2, List.of(AgentAction.scheduleWakeup(START + 10)));
        buyer.handler = (t, p) -> p instanceof Wakeup && t == START + 10 && buyer.received.size() == 1
                ? List.of(AgentAction.placeOrder(Order.bid(2, t, SYM, 5, 100)), AgentAction.scheduleWakeup(t))
                : List.of();
        kernel.addAgent(seller);
        kernel.addAgent(buyer);

        kernel.run();

        assertEquals(List.of(NotificationKind.ACKED, NotificationKind.EXECUTED), kinds(seller.payloads()));
        assertEquals(List.of(START, START + 10), seller.times());

        List<Object> got = buyer.payloads();
        assertEquals(4, got.size());
        assertInstanceOf(Wakeup.class, got.get(0));
        assertEquals(NotificationKind.ACKED, ((Notification) got.get(1)).kind());
        assertEquals(NotificationKind.EXECUTED, ((Notification) got.get(2)).kind());
        assertInstanceOf(Wakeup.class, got.get(3));
        assertTrue(buyer.times().stream().allMatch(t -> t == START + 10));

        Notification exec = (Notification) got.get(2);
        assertEquals(100L, exec.fillPrice());
        assertEquals(5L, exec.quantity());
        assertEquals(100L, exec.order().fillPrice);
    }

    @Test
    void testAssignsOrderIds() {
        ScriptedAgent agent = new ScriptedAgent(1, List.of(
                AgentAction.placeOrder(Order.bid(1, START, SYM, 1, 90)),
                AgentAction.placeOrder(Order.limit(1, START, SYM, Side.BUY, 1, 91, 50, null)),
                AgentAction.placeOrder(Order.bid(1, START, SYM, 1, 92))));
        kernel.addAgent(agent);

        kernel.run();

        List<Long> ids = new ArrayList<>();
        for (Object p : agent.payloads()) ids.add(((Notification) p).orderId());
        assertEquals(List.of(1L, 50L, 51L), ids);
        assertTrue(exchange.book(SYM).contains(51));
    }

    @Test
    void testOrderOwnedByAnotherAgentRejected() {
        ScriptedAgent agent = new ScriptedAgent(1, List.of(
                AgentAction.placeOrder(Order.bid(7, START, SYM, 1, 90))));
        kernel.addAgent(agent);

        kernel.run();

        Notification n = (Notification) agent.payloads().get(0);
        assertEquals(NotificationKind.REJECTED, n.kind());
        assertEquals(RejectReason.INVALID_ORDER, n.reason());
        assertEquals(0, exchange.book(SYM).size());
    }

    @Test
    void testMarketOrderWithoutLiquidityIsReported() {
        ScriptedAgent agent = new ScriptedAgent(1, List.of(
                AgentAction.placeOrder(Order.ask(1, START, SYM, 5, 200)),
                AgentAction.placeOrder(Order.market(1, START, SYM, Side.SELL, 5))));
        kernel.addAgent(agent);

        RunSummary summary = kernel.run();

        Notification n = (Notification) agent.payloads().get(1);
        assertEquals(NotificationKind.REJECTED, n.kind());
        assertEquals(RejectReason.NO_LIQUIDITY, n.reason());
        assertEquals(1, exchange.book(SYM).size());
        assertEquals(RunSummary.StopReason.QUEUE_EMPTY, summary.stopReason());
    }

    @Test
    void testNotificationDelay() {
        Kernel delayed = new Kernel(START, END, 1L, 7L, false, exchange, null);
        ScriptedAgent agent = new ScriptedAgent(1, List.of(
                AgentAction.placeOrder(Order.bid(1, START, SYM, 1, 90))));
        delayed.addAgent(agent);

        delayed.run();

        assertEquals(List.of(START + 7), agent.times());
    }

    // -----------------------------------------------------------------------
    // Determinism
    // -----------------------------------------------------------------------
    @Test
    void testAgentRandomIsSeeded() {
        long[] first = drawsFor(42L, 3);
        long[] again = drawsFor(42L, 3);
        long[] otherAgent = drawsFor(42L, 4);
        long[] otherSeed = drawsFor(43L, 3);

        assertArrayEquals(first, again);
        assertFalse(java.util.Arrays.equals(first, otherAgent));
        assertFalse(java.util.Arrays.equals(first, otherSeed));
    }

    private static long[] drawsFor(long seed, int agentId) {
        long[] draws = new long[3];
        Kernel k = new Kernel(START, END, seed, new Exchange(List.of(SYM)));
        k.addAgent(new ScriptedAgent(agentId, List.of()) {
            @Override
            public List<AgentAction> onStart(AgentContext ctx) {
                for (int i = 0; i < draws.length; i++) draws[i] = ctx.random.nextLong();
                return List.of();
            }
        });
        k.run();
        return draws;
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private static List<NotificationKind> kinds(List<Object> payloads) {
        List<NotificationKind> out = new ArrayList<>();
        for (Object p : payloads) out.add(((Notification) p).kind());
        return out;
    }

    record Received(long time, Object payload) {}

    static class ScriptedAgent implements Agent {
        final int id;
        final List<AgentAction> initial;
        final List<Received> received = new ArrayList<>();
        BiFunction<Long, Object, List<AgentAction>> handler = (t, p) -> List.of();
        long stoppedAt = -1;

        ScriptedAgent(int id, List<AgentAction> initial) {
            this.id = id;
            this.initial = initial;
        }

        @Override
        public int id() { return id; }

        @Override
        public List<AgentAction> onStart(AgentContext ctx) {
            return initial;
        }

        @Override
        public List<AgentAction> onEvent(long currentTime, Object payload) {
            received.add(new Received(currentTime, payload));
            return handler.apply(currentTime, payload);
        }

        @Override
        public void onStop(long currentTime) {
            stoppedAt = currentTime;
        }

        List<Long> times() {
            List<Long> out = new ArrayList<>();
            for (Received r : received) out.add(r.time());
            return out;
        }

        List<Object> payloads() {
            List<Object> out = new ArrayList<>();
            for (Received r : received) out.add(r.payload());
            return out;
        }
    }
}
