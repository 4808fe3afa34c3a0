package com.mktsim.protocol;

/** Variant tag of an {@link Order}. The set is closed. */
public enum OrderType {
    MARKET,
    LIMIT,
    /** ETF creation (buy) or redemption (sell); settles immediately, never rests. */
    BASKET
}
