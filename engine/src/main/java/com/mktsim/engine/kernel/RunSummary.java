package com.mktsim.engine.kernel;

public record RunSummary(long finalTime, long eventsDelivered, StopReason stopReason) {

    public enum StopReason {
        /** Nothing left to deliver. */
        QUEUE_EMPTY,
        /** Next event was due after the configured end time; it was not delivered. */
        END_TIME_REACHED
    }
}
