package com.capgains.config;

import com.capgains.domain.OversellPolicy;
import com.capgains.domain.UnknownFeePolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Tax calculation settings. Documented in application.yml under capgains.tax.
 */
@ConfigurationProperties(prefix = "capgains.tax")
@Getter
@Setter
public class TaxProperties {

    /**
     * Single reporting currency every trade is settled into (ISO code).
     */
    private String baseCurrency = "CNY";

    /**
     * Flat capital-gains rate applied to the positive net gain of the year.
     */
    private BigDecimal taxRate = new BigDecimal("0.20");

    /**
     * Behaviour when a sell exceeds the long quantity held.
     */
    private OversellPolicy oversellPolicy = OversellPolicy.AUTO_SHORT;

    /**
     * Behaviour when an order's fee breakdown has not been resolved yet.
     */
    private UnknownFeePolicy unknownFeePolicy = UnknownFeePolicy.FAIL;
}
