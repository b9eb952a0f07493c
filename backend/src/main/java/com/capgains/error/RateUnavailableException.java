package com.capgains.error;

import lombok.Getter;

import java.time.LocalDate;

@Getter
public class RateUnavailableException extends ReplayException {

    private final LocalDate date;
    private final String currency;

    public RateUnavailableException(LocalDate date, String currency, String reportingCurrency) {
        super(ReplayErrorCode.RATE_UNAVAILABLE,
                "No " + currency + "/" + reportingCurrency + " rate available for " + date);
        this.date = date;
        this.currency = currency;
    }
}
