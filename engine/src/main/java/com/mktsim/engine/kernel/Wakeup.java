package com.mktsim.engine.kernel;

/** Payload of a wake-up an agent scheduled for itself. */
public record Wakeup(long requestedTime) {
}
