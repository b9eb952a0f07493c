package com.capgains.costbasis.pool;

import com.capgains.domain.OversellPolicy;
import com.capgains.error.InvalidOrderException;
import com.capgains.error.PositionPolicyViolationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CostPoolTest {

    private static BigDecimal d(String v) {
        return new BigDecimal(v);
    }

    @Test
    @DisplayName("buys accumulate quantity and cost; average is total cost / quantity")
    void buysAccumulate() {
        CostPool pool = new CostPool("AAPL.US", OversellPolicy.AUTO_SHORT);

        assertThat(pool.buy(d("100"), d("7000"))).isEmpty();
        assertThat(pool.getQuantity()).isEqualByComparingTo("100");
        assertThat(pool.getTotalCost()).isEqualByComparingTo("7000");
        assertThat(pool.averageCost()).hasValueSatisfying(a -> assertThat(a).isEqualByComparingTo("70"));

        assertThat(pool.buy(d("100"), d("14000"))).isEmpty();
        assertThat(pool.getQuantity()).isEqualByComparingTo("200");
        assertThat(pool.getTotalCost()).isEqualByComparingTo("21000");
        assertThat(pool.averageCost()).hasValueSatisfying(a -> assertThat(a).isEqualByComparingTo("105"));
        assertThat(pool.state()).isEqualTo(PositionState.LONG);
    }

    @Test
    @DisplayName("partial sell releases cost at the average and leaves the average unchanged")
    void partialSellKeepsAverage() {
        CostPool pool = new CostPool("AAPL.US", OversellPolicy.AUTO_SHORT);
        pool.buy(d("100"), d("7000"));
        pool.buy(d("100"), d("14000"));

        Optional<ClosedPosition> closed = pool.sell(d("50"), d("9000"));

        assertThat(closed).isPresent();
        assertThat(closed.get().closedSide()).isEqualTo(PositionState.LONG);
        assertThat(closed.get().quantityClosed()).isEqualByComparingTo("50");
        assertThat(closed.get().costAmount()).isEqualByComparingTo("5250");
        assertThat(closed.get().proceedsAmount()).isEqualByComparingTo("9000");
        assertThat(closed.get().gainLoss()).isEqualByComparingTo("3750");
        assertThat(pool.getQuantity()).isEqualByComparingTo("150");
        assertThat(pool.getTotalCost()).isEqualByComparingTo("15750");
        assertThat(pool.averageCost()).hasValueSatisfying(a -> assertThat(a).isEqualByComparingTo("105"));
    }

    @Test
    @DisplayName("sell from flat opens a short holding the proceeds")
    void sellFromFlatOpensShort() {
        CostPool pool = new CostPool("TSLA.US", OversellPolicy.AUTO_SHORT);

        assertThat(pool.sell(d("10"), d("3500"))).isEmpty();

        assertThat(pool.getQuantity()).isEqualByComparingTo("-10");
        assertThat(pool.getTotalCost()).isEqualByComparingTo("-3500");
        assertThat(pool.averageCost()).hasValueSatisfying(a -> assertThat(a).isEqualByComparingTo("350"));
        assertThat(pool.state()).isEqualTo(PositionState.SHORT);
    }

    @Test
    @DisplayName("closing in thirds returns the pool to exactly zero cost")
    void fullCloseInThirdsIsExactlyFlat() {
        CostPool pool = new CostPool("X.US", OversellPolicy.AUTO_SHORT);
        pool.buy(d("3"), d("10"));

        BigDecimal released = BigDecimal.ZERO;
        for (int i = 0; i < 3; i++) {
            released = released.add(pool.sell(BigDecimal.ONE, d("5")).orElseThrow().costAmount());
        }

        assertThat(released).isEqualByComparingTo("10");
        assertThat(pool.getQuantity().signum()).isZero();
        assertThat(pool.getTotalCost().signum()).isZero();
        assertThat(pool.averageCost()).isEmpty();
        assertThat(pool.state()).isEqualTo(PositionState.FLAT);
    }

    @Test
    @DisplayName("buy against a short realizes opening proceeds minus this buy's cost")
    void buyClosesShortPartially() {
        CostPool pool = new CostPool("TSLA.US", OversellPolicy.AUTO_SHORT);
        pool.sell(d("10"), d("3500"));

        ClosedPosition closed = pool.buy(d("4"), d("1000")).orElseThrow();

        assertThat(closed.closedSide()).isEqualTo(PositionState.SHORT);
        assertThat(closed.quantityClosed()).isEqualByComparingTo("4");
        assertThat(closed.proceedsAmount()).isEqualByComparingTo("1400");
        assertThat(closed.costAmount()).isEqualByComparingTo("1000");
        assertThat(closed.gainLoss()).isEqualByComparingTo("400");
        assertThat(pool.getQuantity()).isEqualByComparingTo("-6");
        assertThat(pool.getTotalCost()).isEqualByComparingTo("-2100");
    }

    @Test
    @DisplayName("sell larger than the long closes it and opens a short with the remainder's share")
    void sellThroughZeroOpensShort() {
        CostPool pool = new CostPool("AAPL.US", OversellPolicy.AUTO_SHORT);
        pool.buy(d("10"), d("1000"));

        ClosedPosition closed = pool.sell(d("15"), d("3000")).orElseThrow();

        assertThat(closed.quantityClosed()).isEqualByComparingTo("10");
        assertThat(closed.costAmount()).isEqualByComparingTo("1000");
        assertThat(closed.proceedsAmount()).isEqualByComparingTo("2000");
        assertThat(pool.getQuantity()).isEqualByComparingTo("-5");
        assertThat(pool.getTotalCost()).isEqualByComparingTo("-1000");
    }

    @Test
    @DisplayName("buy larger than the short closes it and opens a long with the remainder's share")
    void buyThroughZeroOpensLong() {
        CostPool pool = new CostPool("AAPL.US", OversellPolicy.AUTO_SHORT);
        pool.sell(d("5"), d("500"));

        ClosedPosition closed = pool.buy(d("8"), d("1600")).orElseThrow();

        assertThat(closed.quantityClosed()).isEqualByComparingTo("5");
        assertThat(closed.proceedsAmount()).isEqualByComparingTo("500");
        assertThat(closed.costAmount()).isEqualByComparingTo("1000");
        assertThat(closed.gainLoss()).isEqualByComparingTo("-500");
        assertThat(pool.getQuantity()).isEqualByComparingTo("3");
        assertThat(pool.getTotalCost()).isEqualByComparingTo("600");
        assertThat(pool.averageCost()).hasValueSatisfying(a -> assertThat(a).isEqualByComparingTo("200"));
    }

    @Test
    @DisplayName("REJECT fails an oversell against a long and leaves the pool untouched")
    void rejectPolicyFailsOversell() {
        CostPool pool = new CostPool("AAPL.US", OversellPolicy.REJECT);
        pool.buy(d("5"), d("100"));

        assertThatThrownBy(() -> pool.sell(d("6"), d("150")))
                .isInstanceOf(PositionPolicyViolationException.class)
                .hasMessageContaining("AAPL.US");
        assertThat(pool.getQuantity()).isEqualByComparingTo("5");
        assertThat(pool.getTotalCost()).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("REJECT still allows an exact close and a sell from flat")
    void rejectPolicyAllowsExactCloseAndShortFromFlat() {
        CostPool pool = new CostPool("AAPL.US", OversellPolicy.REJECT);
        pool.buy(d("5"), d("100"));

        assertThat(pool.sell(d("5"), d("150"))).isPresent();
        assertThat(pool.sell(d("2"), d("60"))).isEmpty();
        assertThat(pool.getQuantity()).isEqualByComparingTo("-2");
    }

    @Test
    @DisplayName("non-positive quantity is an invalid order")
    void nonPositiveQuantityRejected() {
        CostPool pool = new CostPool("AAPL.US", OversellPolicy.AUTO_SHORT);

        assertThatThrownBy(() -> pool.buy(BigDecimal.ZERO, d("1"))).isInstanceOf(InvalidOrderException.class);
        assertThatThrownBy(() -> pool.sell(d("-1"), d("1"))).isInstanceOf(InvalidOrderException.class);
    }
}
