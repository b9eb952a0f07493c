package com.capgains.domain;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface ExchangeRateRepository extends MongoRepository<ExchangeRate, String> {

    Optional<ExchangeRate> findByDateAndFromCurrencyAndToCurrency(LocalDate date, String fromCurrency, String toCurrency);

    /** Inclusive date window, used for the nearby-date lookup. */
    @Query("{ 'fromCurrency' : ?0, 'toCurrency' : ?1, 'date' : { '$gte' : ?2, '$lte' : ?3 } }")
    List<ExchangeRate> findInWindow(String fromCurrency, String toCurrency, LocalDate from, LocalDate to);
}
