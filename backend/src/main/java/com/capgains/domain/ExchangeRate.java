package com.capgains.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Historical exchange rate: one unit of fromCurrency expressed in toCurrency on the given date.
 */
@Document(collection = "exchange_rates")
@CompoundIndex(name = "date_from_to", def = "{'date': 1, 'fromCurrency': 1, 'toCurrency': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
public class ExchangeRate {

    @Id
    private String id;
    private LocalDate date;
    private String fromCurrency;
    private String toCurrency;
    private BigDecimal rate;
    private RateSource source;
    private Instant recordedAt;
}
