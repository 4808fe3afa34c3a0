package com.mktsim.engine.kernel;

import java.util.PriorityQueue;
import java.util.function.LongSupplier;

/**
 * Binary min-heap of scheduled events ordered by (dueTime, sequence).
 *
 * The sequence counter makes the order total: events due at the same time
 * come out in the order they were scheduled, whatever their recipient.
 * Events cannot be withdrawn once scheduled.
 */
public final class EventQueue {

    private final PriorityQueue<ScheduledEvent> heap = new PriorityQueue<>(1024);
    private final LongSupplier clock;
    private long nextSequence = 0;

    /** @param clock current simulated time, owned by the kernel */
    public EventQueue(LongSupplier clock) {
        this.clock = clock;
    }

    /**
     * Enqueue a payload for delivery at {@code dueTime}.
     * @throws InvalidScheduleException if dueTime is before the current time; the queue is left unchanged
     */
    public ScheduledEvent schedule(long dueTime, int recipientId, Object payload) {
        long now = clock.getAsLong();
        if (dueTime < now) {
            throw new InvalidScheduleException(dueTime, now);
        }
        ScheduledEvent event = new ScheduledEvent(dueTime, nextSequence++, recipientId, payload);
        heap.add(event);
        return event;
    }

    /** Removes and returns the earliest event, or null if empty. */
    public ScheduledEvent popNext() {
        return heap.poll();
    }

    /** Due time of the earliest event, or {@link Long#MAX_VALUE} if empty. */
    public long peekNextTime() {
        ScheduledEvent head = heap.peek();
        return head == null ? Long.MAX_VALUE : head.dueTime();
    }

    public boolean isEmpty() { return heap.isEmpty(); }

    public int size() { return heap.size(); }
}
