package com.capgains.error;

public class InvalidOrderException extends ReplayException {

    public InvalidOrderException(String message) {
        super(ReplayErrorCode.INVALID_ORDER, message);
    }
}
