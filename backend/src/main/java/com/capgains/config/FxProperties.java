package com.capgains.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Exchange-rate resolution settings. Documented in application.yml under capgains.fx.
 */
@ConfigurationProperties(prefix = "capgains.fx")
@Getter
@Setter
public class FxProperties {

    /**
     * Days either side of the trade date searched for a stored rate when the exact date is missing
     * (weekends, market holidays). 0 disables the nearby lookup.
     */
    private int nearbyLookbackDays = 7;

    /**
     * Use the static fallbackRates table as a last resort. Off by default: a missing rate fails the symbol.
     */
    private boolean fallbackEnabled = false;

    /**
     * Currency (upper case) -> rate into the base currency, used only when fallbackEnabled.
     */
    private Map<String, BigDecimal> fallbackRates = new HashMap<>();

    private FrankfurterProperties frankfurter = new FrankfurterProperties();

    @Getter
    @Setter
    public static class FrankfurterProperties {
        /** Fetch missing rates from the Frankfurter API (ECB reference rates) and store them. */
        private boolean enabled = true;
        private String baseUrl = "https://api.frankfurter.app";
        private int requestsPerMinute = 30;
        /** Longest wait for a limiter permit before the lookup falls through to the next source. */
        private int limiterTimeoutSeconds = 30;
        private int timeoutSeconds = 10;
    }
}
