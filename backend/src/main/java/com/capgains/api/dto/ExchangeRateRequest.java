package com.capgains.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * PUT /api/v1/exchange-rates request body: one unit of fromCurrency is worth rate units of toCurrency on date.
 */
public record ExchangeRateRequest(
        @NotNull(message = "INVALID_RATE")
        LocalDate date,

        @NotBlank(message = "INVALID_RATE")
        String fromCurrency,

        @NotBlank(message = "INVALID_RATE")
        String toCurrency,

        @NotNull(message = "INVALID_RATE")
        @Positive(message = "INVALID_RATE")
        BigDecimal rate
) {
}
