package com.capgains.api.controller;

import com.capgains.api.dto.ErrorBody;
import com.capgains.error.TaxCalculationException;
import com.capgains.error.TaxConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps validation failures (@Valid) to 400 and run-level tax failures to 5xx, all with ErrorBody
 * (error, message, timestamp).
 */
@RestControllerAdvice
@Slf4j
public class ValidationExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + ": " + rejected(e))
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(TaxConfigurationException.class)
    public ResponseEntity<ErrorBody> handleConfiguration(TaxConfigurationException ex) {
        log.error("Tax configuration invalid: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorBody.of("TAX_CONFIGURATION", ex.getMessage()));
    }

    @ExceptionHandler(TaxCalculationException.class)
    public ResponseEntity<ErrorBody> handleCalculation(TaxCalculationException ex) {
        log.error("Tax calculation aborted: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("TAX_CALCULATION_FAILED", ex.getMessage()));
    }

    private static String rejected(FieldError e) {
        return e.getRejectedValue() == null ? "required" : "invalid value " + e.getRejectedValue();
    }
}
