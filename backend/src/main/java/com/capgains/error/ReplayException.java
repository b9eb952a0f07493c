package com.capgains.error;

import lombok.Getter;

/**
 * Failure that aborts the replay of one symbol only. TaxCalculator records it against the symbol
 * and continues with the others.
 */
@Getter
public abstract class ReplayException extends RuntimeException {

    private final ReplayErrorCode errorCode;

    protected ReplayException(ReplayErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
