package com.mktsim.protocol;

public enum NotificationKind {
    /** Order accepted by the exchange (rests or is about to match). */
    ACKED,
    EXECUTED,
    CANCELLED,
    MODIFIED,
    REJECTED
}
