package com.capgains.costbasis.pool;

/**
 * Per-symbol position state. FLAT is both the initial state and the state reached whenever quantity returns to 0.
 */
public enum PositionState {
    FLAT,
    LONG,
    SHORT
}
