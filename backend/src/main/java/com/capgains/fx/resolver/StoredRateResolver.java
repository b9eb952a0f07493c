package com.capgains.fx.resolver;

import com.capgains.domain.ExchangeRateRepository;
import com.capgains.domain.RateSource;
import com.capgains.fx.RateRequest;
import com.capgains.fx.RateResolutionResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Exact-date rate from the exchange_rates collection.
 */
@Component
@RequiredArgsConstructor
public class StoredRateResolver {

    private final ExchangeRateRepository repository;

    public RateResolutionResult resolve(RateRequest request) {
        return repository.findByDateAndFromCurrencyAndToCurrency(
                        request.date(), request.fromCurrency(), request.toCurrency())
                .map(r -> RateResolutionResult.known(r.getRate(), RateSource.STORED))
                .orElse(RateResolutionResult.unknown());
    }
}
