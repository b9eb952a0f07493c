package com.capgains.fx;

import com.capgains.error.RateUnavailableException;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Historical rate of one unit of {@code currency} in the reporting currency on {@code date}.
 * Implementations must be safe for concurrent reads.
 */
public interface ExchangeRateProvider {

    /**
     * @throws RateUnavailableException when no rate exists for (date, currency) and no fallback applies
     */
    BigDecimal rate(LocalDate date, String currency);
}
