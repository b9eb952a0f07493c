package com.capgains.costbasis.pool;

import java.math.BigDecimal;

/**
 * Portion of an order that closed an opposite-sign position.
 *
 * @param closedSide     side of the position that was reduced (LONG closed by a sell, SHORT closed by a buy)
 * @param quantityClosed units closed, always positive
 * @param openingAmount  amount released from the pool at its average: cost basis for a long, proceeds
 *                       received at open for a short
 * @param closingAmount  this order's settled amount attributable to the closed units
 */
public record ClosedPosition(
        PositionState closedSide,
        BigDecimal quantityClosed,
        BigDecimal openingAmount,
        BigDecimal closingAmount
) {

    public BigDecimal proceedsAmount() {
        return closedSide == PositionState.SHORT ? openingAmount : closingAmount;
    }

    public BigDecimal costAmount() {
        return closedSide == PositionState.SHORT ? closingAmount : openingAmount;
    }

    public BigDecimal gainLoss() {
        return proceedsAmount().subtract(costAmount());
    }
}
