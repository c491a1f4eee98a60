package com.marginledger.event;

/**
 * Classifies a trigger-id transition.
 *
 * <p>A stop-loss/take-profit update emits CHANGED (old id → new id, either side may be
 * null) followed by SET when a new id was allocated, so observers tracking the old id
 * and observers tracking the new id can both follow a single event trace.
 */
public enum TriggerEventType {

    /** A new trigger id was allocated at a price. */
    SET,

    /** A replaceable trigger moved from an old id to a new id. */
    CHANGED,

    /** A trigger id was erased together with its position. */
    REMOVED
}
