package com.capgains.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * POST /api/v1/orders request body. Validated with Jakarta Bean Validation.
 */
public record ImportOrdersRequest(
        @NotEmpty(message = "INVALID_ORDER")
        @Valid
        List<OrderRequest> orders
) {
}
