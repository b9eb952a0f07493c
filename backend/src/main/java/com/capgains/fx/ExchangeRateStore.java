package com.capgains.fx;

import com.capgains.config.CaffeineConfig;
import com.capgains.domain.ExchangeRate;
import com.capgains.domain.ExchangeRateRepository;
import com.capgains.domain.RateSource;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Upserts historical rates keyed by (date, fromCurrency, toCurrency). Recording a rate clears the memoized
 * lookups so a corrected rate is picked up by the next calculation.
 */
@Service
@RequiredArgsConstructor
public class ExchangeRateStore {

    private final ExchangeRateRepository repository;

    @CacheEvict(cacheNames = CaffeineConfig.EXCHANGE_RATE_CACHE, allEntries = true)
    public ExchangeRate record(LocalDate date, String fromCurrency, String toCurrency, BigDecimal rate, RateSource source) {
        return save(date, fromCurrency, toCurrency, rate, source);
    }

    /**
     * Stores a rate fetched while resolving a lookup. Does not touch the cache: the lookup in progress
     * is about to cache this same value.
     */
    public ExchangeRate remember(LocalDate date, String fromCurrency, String toCurrency, BigDecimal rate, RateSource source) {
        return save(date, fromCurrency, toCurrency, rate, source);
    }

    private ExchangeRate save(LocalDate date, String fromCurrency, String toCurrency, BigDecimal rate, RateSource source) {
        String from = fromCurrency.toUpperCase(Locale.ROOT).strip();
        String to = toCurrency.toUpperCase(Locale.ROOT).strip();
        ExchangeRate entity = repository.findByDateAndFromCurrencyAndToCurrency(date, from, to)
                .orElseGet(ExchangeRate::new);
        entity.setDate(date);
        entity.setFromCurrency(from);
        entity.setToCurrency(to);
        entity.setRate(rate);
        entity.setSource(source);
        entity.setRecordedAt(Instant.now());
        return repository.save(entity);
    }
}
