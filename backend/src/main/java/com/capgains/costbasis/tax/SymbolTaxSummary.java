package com.capgains.costbasis.tax;

import java.math.BigDecimal;
import java.util.List;

/**
 * Realized result of one symbol for the fiscal year. losses is the (non-positive) sum of losing events, so
 * gains + losses = netGainLoss.
 *
 * @param incompleteHistory the first stored order is a sell, so the position may predate the stored history
 */
public record SymbolTaxSummary(
        String symbol,
        List<TaxEvent> events,
        BigDecimal totalProceeds,
        BigDecimal totalCost,
        BigDecimal gains,
        BigDecimal losses,
        BigDecimal netGainLoss,
        boolean incompleteHistory
) {

    public SymbolTaxSummary {
        events = List.copyOf(events);
    }

    static SymbolTaxSummary of(String symbol, List<TaxEvent> events, boolean incompleteHistory) {
        BigDecimal proceeds = BigDecimal.ZERO;
        BigDecimal cost = BigDecimal.ZERO;
        BigDecimal gains = BigDecimal.ZERO;
        BigDecimal losses = BigDecimal.ZERO;
        for (TaxEvent e : events) {
            proceeds = proceeds.add(e.proceeds());
            cost = cost.add(e.cost());
            if (e.gainLoss().signum() > 0) {
                gains = gains.add(e.gainLoss());
            } else {
                losses = losses.add(e.gainLoss());
            }
        }
        return new SymbolTaxSummary(symbol, events, proceeds, cost, gains, losses, gains.add(losses),
                incompleteHistory);
    }
}
