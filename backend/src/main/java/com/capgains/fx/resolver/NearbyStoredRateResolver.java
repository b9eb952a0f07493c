package com.capgains.fx.resolver;

import com.capgains.config.FxProperties;
import com.capgains.domain.ExchangeRate;
import com.capgains.domain.ExchangeRateRepository;
import com.capgains.domain.RateSource;
import com.capgains.fx.RateRequest;
import com.capgains.fx.RateResolutionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;

/**
 * Closest recorded rate within ±nearbyLookbackDays of the trade date. Ties go to the earlier date so the
 * choice never depends on storage order. Rows written back by the Frankfurter lookup are ignored: which of
 * them exist depends on what was resolved earlier.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NearbyStoredRateResolver {

    private final ExchangeRateRepository repository;
    private final FxProperties fxProperties;

    public RateResolutionResult resolve(RateRequest request) {
        int window = fxProperties.getNearbyLookbackDays();
        if (window <= 0) {
            return RateResolutionResult.unknown();
        }
        List<ExchangeRate> candidates = repository.findInWindow(request.fromCurrency(), request.toCurrency(),
                request.date().minusDays(window), request.date().plusDays(window));
        return candidates.stream()
                .filter(r -> r.getDate() != null && r.getRate() != null)
                .filter(r -> r.getSource() != RateSource.FRANKFURTER)
                .min(Comparator
                        .comparingLong((ExchangeRate r) -> Math.abs(ChronoUnit.DAYS.between(request.date(), r.getDate())))
                        .thenComparing(ExchangeRate::getDate))
                .map(r -> {
                    log.debug("Using {} {}/{} rate for {}", r.getDate(), request.fromCurrency(),
                            request.toCurrency(), request.date());
                    return RateResolutionResult.known(r.getRate(), RateSource.STORED_NEARBY);
                })
                .orElse(RateResolutionResult.unknown());
    }
}
