package com.capgains.costbasis.tax;

import com.capgains.config.AsyncConfig;
import com.capgains.config.TaxProperties;
import com.capgains.costbasis.pool.ClosedPosition;
import com.capgains.costbasis.pool.CostPool;
import com.capgains.costbasis.settlement.SettlementCalculator;
import com.capgains.costbasis.settlement.SettlementResult;
import com.capgains.domain.Order;
import com.capgains.domain.OrderSide;
import com.capgains.error.InvalidOrderException;
import com.capgains.error.ReplayException;
import com.capgains.error.TaxCalculationException;
import com.capgains.error.TaxConfigurationException;
import com.capgains.store.OrderStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Computes a year's realized capital gains. Each relevant symbol's full history up to the year end is
 * replayed through a fresh CostPool; closes dated inside the year become TaxEvents. Symbols replay in
 * parallel on the replay executor, each strictly in (tradeDate, sequenceId) order.
 * <p>
 * A ReplayException aborts only its symbol and is reported as a SymbolFailure. Configuration errors abort
 * the run before any replay.
 */
@Service
@Slf4j
public class TaxCalculator {

    static final Comparator<Order> REPLAY_ORDER = Comparator.comparing(Order::getTradeDate)
            .thenComparing(Order::getSequenceId);

    private final OrderStore orderStore;
    private final SettlementCalculator settlementCalculator;
    private final TaxProperties taxProperties;
    private final Executor replayExecutor;

    public TaxCalculator(OrderStore orderStore,
                         SettlementCalculator settlementCalculator,
                         TaxProperties taxProperties,
                         @Qualifier(AsyncConfig.REPLAY_EXECUTOR) Executor replayExecutor) {
        this.orderStore = orderStore;
        this.settlementCalculator = settlementCalculator;
        this.taxProperties = taxProperties;
        this.replayExecutor = replayExecutor;
    }

    public TaxReport calculate(int year) {
        validateConfiguration();
        LocalDate yearStart = LocalDate.of(year, 1, 1);
        LocalDate yearEnd = LocalDate.of(year, 12, 31);

        Set<String> symbols = orderStore.symbolsWithSells(year);
        log.info("Calculating {} capital gains for {} symbols", year, symbols.size());

        Map<String, CompletableFuture<SymbolReplayOutcome>> pending = new TreeMap<>();
        for (String symbol : symbols) {
            pending.put(symbol, CompletableFuture.supplyAsync(
                    () -> replay(symbol, yearStart, yearEnd), replayExecutor));
        }

        List<SymbolTaxSummary> summaries = new ArrayList<>();
        List<SymbolFailure> failures = new ArrayList<>();
        for (Map.Entry<String, CompletableFuture<SymbolReplayOutcome>> entry : pending.entrySet()) {
            SymbolReplayOutcome outcome = await(entry.getKey(), entry.getValue(), pending);
            if (outcome.isFailure()) {
                failures.add(outcome.failure());
            } else if (!outcome.summary().events().isEmpty() || outcome.summary().incompleteHistory()) {
                summaries.add(outcome.summary());
            }
        }
        TaxReport report = aggregate(year, summaries, failures);
        log.info("{} report: net {} {}, tax due {}, {} symbols, {} failed", year, report.netGainLoss(),
                report.baseCurrency(), report.taxDue(), summaries.size(), failures.size());
        return report;
    }

    SymbolReplayOutcome replay(String symbol, LocalDate yearStart, LocalDate yearEnd) {
        try {
            List<Order> history = new ArrayList<>(orderStore.ordersUntil(symbol, yearEnd));
            validate(symbol, history);
            history.sort(REPLAY_ORDER);
            requireIncreasingSequence(symbol, history);

            boolean incompleteHistory = !history.isEmpty() && history.get(0).getSide() == OrderSide.SELL;
            if (incompleteHistory) {
                log.warn("{}: first stored order {} is a sell; history may start after the position was opened",
                        symbol, history.get(0).getOrderId());
            }

            CostPool pool = new CostPool(symbol, taxProperties.getOversellPolicy());
            List<TaxEvent> events = new ArrayList<>();
            for (Order order : history) {
                SettlementResult settled = settlementCalculator.settle(order);
                Optional<ClosedPosition> closed = order.getSide() == OrderSide.BUY
                        ? pool.buy(order.getQuantity(), settled.amount())
                        : pool.sell(order.getQuantity(), settled.amount());
                LocalDate date = order.getTradeDate();
                if (closed.isPresent() && !date.isBefore(yearStart) && !date.isAfter(yearEnd)) {
                    events.add(TaxEvent.of(order, closed.get(), settled));
                }
            }
            log.debug("{}: replayed {} orders, {} taxable events, closing position {}", symbol, history.size(),
                    events.size(), pool.getQuantity());
            return SymbolReplayOutcome.success(SymbolTaxSummary.of(symbol, events, incompleteHistory));
        } catch (ReplayException e) {
            log.warn("{}: replay failed [{}] {}", symbol, e.getErrorCode(), e.getMessage());
            return SymbolReplayOutcome.failed(new SymbolFailure(symbol, e.getErrorCode(), e.getMessage()));
        }
    }

    private TaxReport aggregate(int year, List<SymbolTaxSummary> summaries, List<SymbolFailure> failures) {
        BigDecimal gains = BigDecimal.ZERO;
        BigDecimal losses = BigDecimal.ZERO;
        for (SymbolTaxSummary s : summaries) {
            gains = gains.add(s.gains());
            losses = losses.add(s.losses());
        }
        BigDecimal net = gains.add(losses);
        BigDecimal taxDue = net.max(BigDecimal.ZERO).multiply(taxProperties.getTaxRate());
        return new TaxReport(year, taxProperties.getBaseCurrency(), taxProperties.getTaxRate(), summaries,
                failures, gains, losses, net, taxDue, failures.isEmpty());
    }

    private static void validate(String symbol, List<Order> history) {
        for (Order o : history) {
            String id = o.getOrderId();
            if (!symbol.equals(o.getSymbol())) {
                throw new InvalidOrderException("Order " + id + " belongs to " + o.getSymbol() + ", not " + symbol);
            }
            if (o.getSide() == null) {
                throw new InvalidOrderException("Order " + id + " has no side");
            }
            if (o.getQuantity() == null || o.getQuantity().signum() <= 0) {
                throw new InvalidOrderException("Order " + id + " quantity must be positive, got " + o.getQuantity());
            }
            if (o.getPrice() == null || o.getPrice().signum() < 0) {
                throw new InvalidOrderException("Order " + id + " price must not be negative, got " + o.getPrice());
            }
            if (o.getCurrency() == null || o.getCurrency().isBlank()) {
                throw new InvalidOrderException("Order " + id + " has no currency");
            }
            if (o.getTradeDate() == null || o.getSequenceId() == null) {
                throw new InvalidOrderException("Order " + id + " has no trade date or sequence id");
            }
        }
    }

    /**
     * Sequence ids grow strictly along the (tradeDate, sequenceId) order; a repeat or a later-dated order with
     * a smaller id means the history is corrupt.
     */
    private static void requireIncreasingSequence(String symbol, List<Order> sorted) {
        for (int i = 1; i < sorted.size(); i++) {
            Order previous = sorted.get(i - 1);
            Order current = sorted.get(i);
            if (current.getSequenceId() <= previous.getSequenceId()) {
                throw new InvalidOrderException("Non-monotonic sequence for " + symbol + ": order "
                        + current.getOrderId() + " (" + current.getTradeDate() + ", #" + current.getSequenceId()
                        + ") follows " + previous.getOrderId() + " (" + previous.getTradeDate() + ", #"
                        + previous.getSequenceId() + ")");
            }
        }
    }

    private void validateConfiguration() {
        String base = taxProperties.getBaseCurrency();
        if (base == null || base.isBlank()) {
            throw new TaxConfigurationException("capgains.tax.base-currency is required");
        }
        BigDecimal rate = taxProperties.getTaxRate();
        if (rate == null || rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) > 0) {
            throw new TaxConfigurationException("capgains.tax.tax-rate must be between 0 and 1, got " + rate);
        }
        if (taxProperties.getOversellPolicy() == null) {
            throw new TaxConfigurationException("capgains.tax.oversell-policy is required");
        }
        if (taxProperties.getUnknownFeePolicy() == null) {
            throw new TaxConfigurationException("capgains.tax.unknown-fee-policy is required");
        }
    }

    private static SymbolReplayOutcome await(String symbol, CompletableFuture<SymbolReplayOutcome> future,
                                             Map<String, CompletableFuture<SymbolReplayOutcome>> all) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            all.values().forEach(f -> f.cancel(true));
            throw new TaxCalculationException("Tax calculation interrupted while replaying " + symbol, e);
        } catch (CancellationException e) {
            all.values().forEach(f -> f.cancel(true));
            throw new TaxCalculationException("Replay of " + symbol + " was cancelled", e);
        } catch (ExecutionException e) {
            all.values().forEach(f -> f.cancel(true));
            throw new TaxCalculationException("Replay of " + symbol + " failed unexpectedly", e.getCause());
        }
    }
}
