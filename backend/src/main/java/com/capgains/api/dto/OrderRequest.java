package com.capgains.api.dto;

import com.capgains.domain.OrderSide;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * One executed order. fees absent or null = not yet known; an empty list = no fees charged.
 */
public record OrderRequest(
        @NotBlank(message = "INVALID_ORDER")
        String orderId,

        @NotBlank(message = "INVALID_ORDER")
        String symbol,

        @NotNull(message = "INVALID_ORDER")
        OrderSide side,

        @NotNull(message = "INVALID_ORDER")
        @Positive(message = "INVALID_ORDER")
        BigDecimal quantity,

        @NotNull(message = "INVALID_ORDER")
        @PositiveOrZero(message = "INVALID_ORDER")
        BigDecimal price,

        @NotBlank(message = "INVALID_ORDER")
        String currency,

        @Valid
        List<FeeItemRequest> fees,

        @NotNull(message = "INVALID_ORDER")
        LocalDate tradeDate,

        @NotNull(message = "INVALID_ORDER")
        Long sequenceId
) {
}
