package com.capgains.error;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Raised under the REJECT oversell policy when a sell exceeds the long quantity held.
 */
@Getter
public class PositionPolicyViolationException extends ReplayException {

    private final String symbol;
    private final BigDecimal requested;
    private final BigDecimal held;

    public PositionPolicyViolationException(String symbol, BigDecimal requested, BigDecimal held) {
        super(ReplayErrorCode.POSITION_POLICY_VIOLATION,
                symbol + ": cannot sell " + requested.toPlainString() + ", only holding " + held.toPlainString());
        this.symbol = symbol;
        this.requested = requested;
        this.held = held;
    }
}
