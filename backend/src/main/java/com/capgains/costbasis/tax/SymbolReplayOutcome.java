package com.capgains.costbasis.tax;

/**
 * Result of replaying one symbol: exactly one of summary or failure is set.
 */
record SymbolReplayOutcome(String symbol, SymbolTaxSummary summary, SymbolFailure failure) {

    static SymbolReplayOutcome success(SymbolTaxSummary summary) {
        return new SymbolReplayOutcome(summary.symbol(), summary, null);
    }

    static SymbolReplayOutcome failed(SymbolFailure failure) {
        return new SymbolReplayOutcome(failure.symbol(), null, failure);
    }

    boolean isFailure() {
        return failure != null;
    }
}
