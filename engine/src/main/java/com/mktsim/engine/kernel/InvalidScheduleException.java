package com.mktsim.engine.kernel;

/** Thrown when an event is scheduled for a time earlier than the current simulated time. */
public final class InvalidScheduleException extends RuntimeException {

    private final long dueTime;
    private final long currentTime;

    public InvalidScheduleException(long dueTime, long currentTime) {
        super("Cannot schedule event at " + dueTime + ": current time is " + currentTime);
        this.dueTime = dueTime;
        this.currentTime = currentTime;
    }

    public long dueTime() { return dueTime; }

    public long currentTime() { return currentTime; }
}
