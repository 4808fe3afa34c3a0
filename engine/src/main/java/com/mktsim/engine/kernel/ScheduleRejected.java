package com.mktsim.engine.kernel;

/**
 * Delivered to an agent at the current time when one of its wake-ups or
 * messages could not be scheduled because {@code requestedTime} was already past.
 */
public record ScheduleRejected(long requestedTime, long currentTime) {
}
