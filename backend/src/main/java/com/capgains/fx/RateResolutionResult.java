package com.capgains.fx;

import com.capgains.domain.RateSource;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Result of one resolver in the chain: a rate with its source, or UNKNOWN.
 */
@Getter
public class RateResolutionResult {

    private static final RateResolutionResult UNKNOWN = new RateResolutionResult(null, RateSource.UNKNOWN);

    private final BigDecimal rate;
    private final RateSource source;

    private RateResolutionResult(BigDecimal rate, RateSource source) {
        this.rate = rate;
        this.source = source;
    }

    public static RateResolutionResult known(BigDecimal rate, RateSource source) {
        if (rate == null || rate.signum() <= 0 || source == null || source == RateSource.UNKNOWN) {
            return UNKNOWN;
        }
        return new RateResolutionResult(rate, source);
    }

    public static RateResolutionResult unknown() {
        return UNKNOWN;
    }

    public boolean isUnknown() {
        return source == RateSource.UNKNOWN || rate == null;
    }

    public Optional<BigDecimal> getRate() {
        return Optional.ofNullable(rate);
    }
}
