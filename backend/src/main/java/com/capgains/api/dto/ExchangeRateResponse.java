package com.capgains.api.dto;

import com.capgains.domain.RateSource;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ExchangeRateResponse(
        LocalDate date,
        String fromCurrency,
        String toCurrency,
        BigDecimal rate,
        RateSource source
) {
}
