package com.capgains.domain;

/**
 * What happens when a sell exceeds the long quantity held.
 */
public enum OversellPolicy {
    /** Close the long and open a short with the excess. */
    AUTO_SHORT,
    /** Fail the symbol's replay with a position policy violation. */
    REJECT
}
