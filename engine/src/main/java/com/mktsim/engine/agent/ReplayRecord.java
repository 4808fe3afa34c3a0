package com.mktsim.engine.agent;

import com.mktsim.protocol.Side;

/**
 * One line of a historical order stream: the state of order {@code orderId}
 * as of {@code time}. A size of zero means the order is gone.
 */
public record ReplayRecord(long time, long orderId, Side side, long price, long size) {
}
