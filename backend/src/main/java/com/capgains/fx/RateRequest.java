package com.capgains.fx;

import java.time.LocalDate;

/**
 * Rate lookup for one unit of fromCurrency in toCurrency on a given date. Currencies are upper-case ISO codes.
 */
public record RateRequest(LocalDate date, String fromCurrency, String toCurrency) {
}
