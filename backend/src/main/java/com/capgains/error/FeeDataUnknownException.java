package com.capgains.error;

import lombok.Getter;

@Getter
public class FeeDataUnknownException extends ReplayException {

    private final String orderId;

    public FeeDataUnknownException(String orderId) {
        super(ReplayErrorCode.FEE_DATA_UNKNOWN, "Fee breakdown not resolved for order " + orderId);
        this.orderId = orderId;
    }
}
