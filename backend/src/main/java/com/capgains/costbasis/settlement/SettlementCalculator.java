package com.capgains.costbasis.settlement;

import com.capgains.config.TaxProperties;
import com.capgains.domain.Order;
import com.capgains.domain.OrderSide;
import com.capgains.domain.UnknownFeePolicy;
import com.capgains.error.FeeDataUnknownException;
import com.capgains.error.InvalidOrderException;
import com.capgains.fx.ExchangeRateProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Normalises an order into the reporting currency: buys settle at (gross + fees) · rate, sells at
 * (gross − fees) · rate, with gross = quantity · price · multiplier and the rate taken on the trade date.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SettlementCalculator {

    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private final ExchangeRateProvider exchangeRateProvider;
    private final TaxProperties taxProperties;

    public SettlementResult settle(Order order) {
        if (order.getSide() == null) {
            throw new InvalidOrderException("Order " + order.getOrderId() + " has no side");
        }
        return switch (order.getSide()) {
            case BUY -> settleBuy(order);
            case SELL -> settleSell(order);
        };
    }

    public SettlementResult settleBuy(Order order) {
        return settle(order, OrderSide.BUY);
    }

    public SettlementResult settleSell(Order order) {
        return settle(order, OrderSide.SELL);
    }

    private SettlementResult settle(Order order, OrderSide side) {
        BigDecimal multiplier = ContractMultiplier.of(order.getSymbol());
        BigDecimal gross = order.getQuantity().multiply(order.getPrice()).multiply(multiplier);
        BigDecimal fees = totalFees(order);
        BigDecimal rate = exchangeRateProvider.rate(order.getTradeDate(), order.getCurrency());
        BigDecimal nativeAmount = side == OrderSide.BUY ? gross.add(fees) : gross.subtract(fees);
        BigDecimal amount = nativeAmount.multiply(rate);
        BigDecimal unitPrice = amount.divide(order.getQuantity(), SCALE, ROUNDING);
        log.debug("Settled {} {} {} x {} {}: amount={} rate={}", order.getOrderId(), side, order.getQuantity(),
                order.getPrice(), order.getCurrency(), amount, rate);
        return new SettlementResult(amount, unitPrice, rate, multiplier, gross, fees);
    }

    private BigDecimal totalFees(Order order) {
        if (order.hasKnownFees()) {
            return order.getFees().total();
        }
        if (taxProperties.getUnknownFeePolicy() == UnknownFeePolicy.TREAT_AS_ZERO) {
            log.warn("Fee breakdown unknown or incomplete for order {} ({}), treating fees as zero", order.getOrderId(),
                    order.getSymbol());
            return BigDecimal.ZERO;
        }
        throw new FeeDataUnknownException(order.getOrderId());
    }
}
