package com.capgains.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Tax and exchange-rate properties, plus the limiter shared by all calls to the Frankfurter API.
 */
@Configuration
@EnableConfigurationProperties({TaxProperties.class, FxProperties.class})
public class FxConfig {

    public static final String FRANKFURTER_RATE_LIMITER = "frankfurterRateLimiter";

    @Bean(name = FRANKFURTER_RATE_LIMITER)
    public RateLimiter frankfurterRateLimiter(FxProperties fxProperties) {
        FxProperties.FrankfurterProperties props = fxProperties.getFrankfurter();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, props.getRequestsPerMinute()))
                .timeoutDuration(Duration.ofSeconds(Math.max(0L, props.getLimiterTimeoutSeconds())))
                .build();
        return RateLimiter.of("frankfurter", config);
    }
}
