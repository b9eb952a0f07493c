package com.capgains.error;

/**
 * Invalid tax configuration. Aborts the whole run before any symbol is replayed.
 */
public class TaxConfigurationException extends RuntimeException {

    public TaxConfigurationException(String message) {
        super(message);
    }
}
