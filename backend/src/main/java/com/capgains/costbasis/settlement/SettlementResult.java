package com.capgains.costbasis.settlement;

import java.math.BigDecimal;

/**
 * One order settled into the reporting currency.
 *
 * @param amount     total cost (buy) or net proceeds (sell) in the reporting currency
 * @param unitPrice  amount / quantity, reporting currency per unit
 * @param rate       exchange rate applied, native to reporting currency
 * @param multiplier contract multiplier applied to quantity · price
 * @param gross      quantity · price · multiplier, native currency
 * @param fees       total fees, native currency
 */
public record SettlementResult(
        BigDecimal amount,
        BigDecimal unitPrice,
        BigDecimal rate,
        BigDecimal multiplier,
        BigDecimal gross,
        BigDecimal fees
) {
}
