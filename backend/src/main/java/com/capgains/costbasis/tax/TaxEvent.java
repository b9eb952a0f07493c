package com.capgains.costbasis.tax;

import com.capgains.costbasis.pool.ClosedPosition;
import com.capgains.costbasis.pool.PositionState;
import com.capgains.costbasis.settlement.SettlementResult;
import com.capgains.domain.Order;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One realized close inside the fiscal year, amounts in the reporting currency.
 * gainLoss = proceeds − cost; closedSide LONG means a sell closed a long, SHORT a buy closed a short.
 */
public record TaxEvent(
        String symbol,
        String orderId,
        Long sequenceId,
        LocalDate tradeDate,
        PositionState closedSide,
        BigDecimal quantityClosed,
        BigDecimal proceeds,
        BigDecimal cost,
        BigDecimal gainLoss,
        BigDecimal rate
) {

    static TaxEvent of(Order order, ClosedPosition closed, SettlementResult settled) {
        return new TaxEvent(
                order.getSymbol(),
                order.getOrderId(),
                order.getSequenceId(),
                order.getTradeDate(),
                closed.closedSide(),
                closed.quantityClosed(),
                closed.proceedsAmount(),
                closed.costAmount(),
                closed.gainLoss(),
                settled.rate());
    }
}
