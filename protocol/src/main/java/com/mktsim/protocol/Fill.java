package com.mktsim.protocol;

/**
 * One match between a buy and a sell order, at one price, for one quantity.
 * Ephemeral: consumed immediately to build notifications.
 */
public record Fill(long buyOrderId, long sellOrderId, long price, long quantity, long time) {
}
