package com.capgains.costbasis.settlement;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Units of underlying per contract. Option symbols (ticker, 6-digit expiry, C or P, strike, market suffix,
 * e.g. AAPL240119C190000.US) trade in lots of 100; everything else is 1.
 */
public final class ContractMultiplier {

    private static final Pattern OPTION_SYMBOL = Pattern.compile("^[A-Z]+\\d{6}[CP]\\d+\\.[A-Z]+$");
    private static final BigDecimal OPTION_MULTIPLIER = BigDecimal.valueOf(100);

    private ContractMultiplier() {
    }

    public static BigDecimal of(String symbol) {
        return isOption(symbol) ? OPTION_MULTIPLIER : BigDecimal.ONE;
    }

    public static boolean isOption(String symbol) {
        if (symbol == null) {
            return false;
        }
        return OPTION_SYMBOL.matcher(symbol.strip().toUpperCase(Locale.ROOT)).matches();
    }
}
