package com.capgains.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record FeeItemRequest(
        @NotBlank(message = "INVALID_FEE")
        String name,

        @NotNull(message = "INVALID_FEE")
        BigDecimal amount
) {
}
