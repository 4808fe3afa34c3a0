package com.mktsim.protocol;

/**
 * Why a request was not (fully) carried out. Carried on a
 * {@link NotificationKind#REJECTED} notification back to the submitting agent.
 */
public enum RejectReason {
    INVALID_QTY,
    INVALID_PRICE,
    UNKNOWN_SYMBOL,
    /** Request is structurally inconsistent, e.g. a modify that changes side or symbol. */
    INVALID_ORDER,
    /** Market order found no (or not enough) resting interest on the opposing side. */
    NO_LIQUIDITY,
    /** Cancel/modify of an id that is not resting: unknown, already filled or already cancelled. */
    ORDER_NOT_FOUND
}
