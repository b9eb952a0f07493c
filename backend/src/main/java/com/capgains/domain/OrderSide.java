package com.capgains.domain;

public enum OrderSide {
    BUY,
    SELL
}
