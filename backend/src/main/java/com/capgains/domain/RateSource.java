package com.capgains.domain;

/**
 * Where an exchange rate came from, both for stored rates and for a resolution result.
 */
public enum RateSource {
    STORED,
    STORED_NEARBY,
    FRANKFURTER,
    CONFIGURED_FALLBACK,
    MANUAL,
    UNKNOWN
}
