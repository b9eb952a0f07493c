package com.capgains.api.controller;

import com.capgains.api.dto.ExchangeRateRequest;
import com.capgains.api.dto.ExchangeRateResponse;
import com.capgains.domain.ExchangeRate;
import com.capgains.domain.RateSource;
import com.capgains.fx.ExchangeRateStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * PUT /exchange-rates: records a manual historical rate, replacing any stored rate for the same key.
 */
@RestController
@RequestMapping("/api/v1/exchange-rates")
@RequiredArgsConstructor
public class ExchangeRateController {

    private final ExchangeRateStore exchangeRateStore;

    @PutMapping
    public ResponseEntity<ExchangeRateResponse> record(@Valid @RequestBody ExchangeRateRequest request) {
        ExchangeRate saved = exchangeRateStore.record(request.date(), request.fromCurrency(), request.toCurrency(),
                request.rate(), RateSource.MANUAL);
        return ResponseEntity.ok(new ExchangeRateResponse(saved.getDate(), saved.getFromCurrency(),
                saved.getToCurrency(), saved.getRate(), saved.getSource()));
    }
}
