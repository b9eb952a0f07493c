package com.capgains.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Itemised fees charged on an order, in the order's own currency. An empty breakdown means the fees are
 * known to be zero; an order whose breakdown is absent has unknown fees (see {@link Order#getFees()}).
 */
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class FeeBreakdown {

    private List<FeeItem> items = new ArrayList<>();

    public static FeeBreakdown knownZero() {
        return new FeeBreakdown(new ArrayList<>());
    }

    public static FeeBreakdown of(List<FeeItem> items) {
        return new FeeBreakdown(new ArrayList<>(items));
    }

    /**
     * False when the item list, an item, or an item's amount is missing: such a breakdown is unknown fee data.
     */
    public boolean isComplete() {
        return items != null && items.stream().allMatch(item -> item != null && item.getAmount() != null);
    }

    public BigDecimal total() {
        if (!isComplete()) {
            throw new IllegalStateException("Fee breakdown has missing items or amounts");
        }
        BigDecimal total = BigDecimal.ZERO;
        for (FeeItem item : items) {
            total = total.add(item.getAmount());
        }
        return total;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    @Getter
    @Setter
    public static class FeeItem {
        /** Broker fee label, e.g. "commission", "platform_fee", "sec_fee". */
        private String name;
        private BigDecimal amount;
    }
}
