package com.marginledger.event;

/**
 * Classifies the order transition that produced an {@link OrderEvent}.
 */
public enum OrderEventType {

    /** Order stored after its margin and commission were deposited. */
    CREATED,

    /** Conditional order removed and fully refunded. */
    CANCELLED,

    /** Order consumed by execution into a position. */
    EXECUTED
}
