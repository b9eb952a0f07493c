package com.capgains.error;

/**
 * The run was interrupted, cancelled or hit an unexpected failure; no report is produced.
 */
public class TaxCalculationException extends RuntimeException {

    public TaxCalculationException(String message, Throwable cause) {
        super(message, cause);
    }
}
