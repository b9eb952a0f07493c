package com.capgains.costbasis.pool;

import com.capgains.domain.OversellPolicy;
import com.capgains.error.InvalidOrderException;
import com.capgains.error.PositionPolicyViolationException;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.Optional;

/**
 * Weighted-average cost state for one symbol, long or short.
 * <p>
 * State is a signed quantity Q (positive long, negative short) and an aggregate cost C in the reporting
 * currency with the same sign as Q. A long holds total cost paid; a short holds total proceeds received.
 * Average per unit is C / Q, computed on demand. Q = 0 always implies C = 0: a full close releases C
 * exactly instead of dividing it.
 * <p>
 * Not thread-safe. One instance per symbol per calculation run.
 */
public class CostPool {

    static final int SCALE = 18;
    static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    @Getter
    private final String symbol;
    private final OversellPolicy oversellPolicy;

    @Getter
    private BigDecimal quantity = BigDecimal.ZERO;
    @Getter
    private BigDecimal totalCost = BigDecimal.ZERO;

    public CostPool(String symbol, OversellPolicy oversellPolicy) {
        this.symbol = symbol;
        this.oversellPolicy = Objects.requireNonNull(oversellPolicy, "oversellPolicy");
    }

    /**
     * Applies a buy of {@code qty} units that settled at {@code settledCost} in the reporting currency.
     * Flat or long: the long is extended and nothing is returned. Short: the short is closed by up to
     * {@code qty} units and any remainder opens a long with its proportional share of the cost.
     */
    public Optional<ClosedPosition> buy(BigDecimal qty, BigDecimal settledCost) {
        requirePositive(qty, "buy");
        Objects.requireNonNull(settledCost, "settledCost");
        if (quantity.signum() >= 0) {
            quantity = quantity.add(qty);
            totalCost = totalCost.add(settledCost);
            return Optional.empty();
        }
        BigDecimal closed = qty.min(quantity.negate());
        BigDecimal openingProceeds = release(closed).negate();
        BigDecimal remainder = qty.subtract(closed);
        BigDecimal remainderCost = share(settledCost, remainder, qty);
        if (remainder.signum() > 0) {
            quantity = quantity.add(remainder);
            totalCost = totalCost.add(remainderCost);
        }
        return Optional.of(new ClosedPosition(PositionState.SHORT, closed, openingProceeds,
                settledCost.subtract(remainderCost)));
    }

    /**
     * Applies a sell of {@code qty} units that settled at {@code settledProceeds} in the reporting currency.
     * Flat or short: the short is extended and nothing is returned. Long: the long is closed by up to
     * {@code qty} units; the excess opens a short under AUTO_SHORT or fails under REJECT.
     */
    public Optional<ClosedPosition> sell(BigDecimal qty, BigDecimal settledProceeds) {
        requirePositive(qty, "sell");
        Objects.requireNonNull(settledProceeds, "settledProceeds");
        if (quantity.signum() <= 0) {
            quantity = quantity.subtract(qty);
            totalCost = totalCost.subtract(settledProceeds);
            return Optional.empty();
        }
        if (oversellPolicy == OversellPolicy.REJECT && qty.compareTo(quantity) > 0) {
            throw new PositionPolicyViolationException(symbol, qty, quantity);
        }
        BigDecimal closed = qty.min(quantity);
        BigDecimal costBasis = release(closed);
        BigDecimal remainder = qty.subtract(closed);
        BigDecimal remainderProceeds = share(settledProceeds, remainder, qty);
        if (remainder.signum() > 0) {
            quantity = quantity.subtract(remainder);
            totalCost = totalCost.subtract(remainderProceeds);
        }
        return Optional.of(new ClosedPosition(PositionState.LONG, closed, costBasis,
                settledProceeds.subtract(remainderProceeds)));
    }

    /**
     * Average cost (long) or average proceeds (short) per unit; empty when flat.
     */
    public Optional<BigDecimal> averageCost() {
        if (quantity.signum() == 0) {
            return Optional.empty();
        }
        return Optional.of(totalCost.divide(quantity, SCALE, ROUNDING));
    }

    public PositionState state() {
        return switch (quantity.signum()) {
            case 1 -> PositionState.LONG;
            case -1 -> PositionState.SHORT;
            default -> PositionState.FLAT;
        };
    }

    /**
     * Removes {@code closed} units (a magnitude no larger than |Q|) at the current average and returns the
     * signed share of C removed.
     */
    private BigDecimal release(BigDecimal closed) {
        BigDecimal held = quantity.abs();
        if (closed.compareTo(held) == 0) {
            BigDecimal all = totalCost;
            quantity = BigDecimal.ZERO;
            totalCost = BigDecimal.ZERO;
            return all;
        }
        BigDecimal released = totalCost.multiply(closed).divide(held, SCALE, ROUNDING);
        quantity = quantity.signum() > 0 ? quantity.subtract(closed) : quantity.add(closed);
        totalCost = totalCost.subtract(released);
        return released;
    }

    private static BigDecimal share(BigDecimal amount, BigDecimal part, BigDecimal whole) {
        if (part.signum() == 0) {
            return BigDecimal.ZERO;
        }
        if (part.compareTo(whole) == 0) {
            return amount;
        }
        return amount.multiply(part).divide(whole, SCALE, ROUNDING);
    }

    private void requirePositive(BigDecimal qty, String side) {
        if (qty == null || qty.signum() <= 0) {
            throw new InvalidOrderException(symbol + ": " + side + " quantity must be positive, got " + qty);
        }
    }
}
