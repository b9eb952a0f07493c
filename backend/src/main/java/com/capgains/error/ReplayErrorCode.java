package com.capgains.error;

public enum ReplayErrorCode {
    RATE_UNAVAILABLE,
    FEE_DATA_UNKNOWN,
    INVALID_ORDER,
    POSITION_POLICY_VIOLATION
}
