package com.capgains.api.dto;

public record ImportOrdersResponse(int imported) {
}
