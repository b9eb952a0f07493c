package com.capgains.api.dto;

import com.capgains.domain.OrderSide;

import java.time.LocalDate;

/**
 * Order whose fee breakdown is still unknown (GET /api/v1/orders/missing-fees).
 */
public record MissingFeeOrderResponse(
        String orderId,
        String symbol,
        OrderSide side,
        LocalDate tradeDate,
        Long sequenceId
) {
}
