package com.capgains.domain;

/**
 * Settlement behaviour for an order whose fee breakdown has not been resolved.
 */
public enum UnknownFeePolicy {
    FAIL,
    TREAT_AS_ZERO
}
