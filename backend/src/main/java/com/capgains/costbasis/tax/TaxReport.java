package com.capgains.costbasis.tax;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Capital-gains report for one fiscal year. Symbols and failures are sorted by symbol. complete is false
 * when any symbol failed; the totals then cover the successful symbols only.
 */
public record TaxReport(
        int year,
        String baseCurrency,
        BigDecimal taxRate,
        List<SymbolTaxSummary> symbols,
        List<SymbolFailure> failures,
        BigDecimal totalGains,
        BigDecimal totalLosses,
        BigDecimal netGainLoss,
        BigDecimal taxDue,
        boolean complete
) {

    public TaxReport {
        symbols = List.copyOf(symbols);
        failures = List.copyOf(failures);
    }

    /** Net realized gain or loss per symbol, in symbol order. */
    public Map<String, BigDecimal> gainLossBySymbol() {
        Map<String, BigDecimal> bySymbol = new LinkedHashMap<>();
        symbols.forEach(s -> bySymbol.put(s.symbol(), s.netGainLoss()));
        return bySymbol;
    }

    /** 0 when every symbol replayed, 1 when the report is incomplete. */
    public int exitStatus() {
        return complete ? 0 : 1;
    }
}
