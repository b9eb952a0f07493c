package com.capgains.fx;

import com.capgains.config.CaffeineConfig;
import com.capgains.config.TaxProperties;
import com.capgains.error.RateUnavailableException;
import com.capgains.fx.resolver.ConfiguredFallbackRateResolver;
import com.capgains.fx.resolver.FrankfurterRateResolver;
import com.capgains.fx.resolver.NearbyStoredRateResolver;
import com.capgains.fx.resolver.StoredRateResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Chain: base currency (1) → stored exact date → Frankfurter → recorded nearby date → configured fallback →
 * RateUnavailableException. Successful lookups are memoized per (date, currency); failures are not.
 * <p>
 * Every exact-date source is tried before any nearby date, so a date's rate does not depend on which other
 * dates were looked up before it.
 */
@Component
@RequiredArgsConstructor
public class ExchangeRateResolverChain implements ExchangeRateProvider {

    private final TaxProperties taxProperties;
    private final StoredRateResolver storedRateResolver;
    private final NearbyStoredRateResolver nearbyStoredRateResolver;
    private final FrankfurterRateResolver frankfurterRateResolver;
    private final ConfiguredFallbackRateResolver configuredFallbackRateResolver;

    @Override
    @Cacheable(cacheNames = CaffeineConfig.EXCHANGE_RATE_CACHE, sync = true)
    public BigDecimal rate(LocalDate date, String currency) {
        String reporting = taxProperties.getBaseCurrency().toUpperCase(Locale.ROOT);
        if (date == null || currency == null || currency.isBlank()) {
            throw new RateUnavailableException(date, currency, reporting);
        }
        String from = currency.toUpperCase(Locale.ROOT).strip();
        if (from.equals(reporting)) {
            return BigDecimal.ONE;
        }
        RateRequest request = new RateRequest(date, from, reporting);
        RateResolutionResult r = storedRateResolver.resolve(request);
        if (r.isUnknown()) {
            r = frankfurterRateResolver.resolve(request);
        }
        if (r.isUnknown()) {
            r = nearbyStoredRateResolver.resolve(request);
        }
        if (r.isUnknown()) {
            r = configuredFallbackRateResolver.resolve(request);
        }
        return r.getRate().orElseThrow(() -> new RateUnavailableException(date, from, reporting));
    }
}
