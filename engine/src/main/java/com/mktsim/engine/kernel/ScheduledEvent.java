package com.mktsim.engine.kernel;

/**
 * An event waiting in the {@link EventQueue}. {@code sequence} is assigned at
 * enqueue time from a run-wide counter and only breaks ties on {@code dueTime}.
 */
public record ScheduledEvent(long dueTime, long sequence, int recipientId, Object payload)
        implements Comparable<ScheduledEvent> {

    @Override
    public int compareTo(ScheduledEvent o) {
        int cmp = Long.compare(dueTime, o.dueTime);
        return cmp != 0 ? cmp : Long.compare(sequence, o.sequence);
    }
}
