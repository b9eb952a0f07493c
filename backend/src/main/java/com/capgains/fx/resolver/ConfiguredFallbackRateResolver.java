package com.capgains.fx.resolver;

import com.capgains.config.FxProperties;
import com.capgains.domain.RateSource;
import com.capgains.fx.RateRequest;
import com.capgains.fx.RateResolutionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Static per-currency rate from capgains.fx.fallback-rates. Only consulted when fallback-enabled is true.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfiguredFallbackRateResolver {

    private final FxProperties fxProperties;

    public RateResolutionResult resolve(RateRequest request) {
        if (!fxProperties.isFallbackEnabled()) {
            return RateResolutionResult.unknown();
        }
        BigDecimal rate = fxProperties.getFallbackRates().get(request.fromCurrency());
        if (rate == null) {
            return RateResolutionResult.unknown();
        }
        log.warn("Using configured fallback rate {} for {}/{} on {}", rate, request.fromCurrency(),
                request.toCurrency(), request.date());
        return RateResolutionResult.known(rate, RateSource.CONFIGURED_FALLBACK);
    }
}
