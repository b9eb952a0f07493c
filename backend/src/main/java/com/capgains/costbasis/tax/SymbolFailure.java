package com.capgains.costbasis.tax;

import com.capgains.error.ReplayErrorCode;

/**
 * A symbol whose replay was aborted; its gains are absent from the report totals.
 */
public record SymbolFailure(String symbol, ReplayErrorCode errorCode, String message) {
}
