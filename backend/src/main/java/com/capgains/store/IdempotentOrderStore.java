package com.capgains.store;

import com.capgains.domain.Order;
import com.capgains.domain.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * Upserts imported orders keyed by broker orderId, so re-importing a statement never duplicates a trade.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentOrderStore {

    private final OrderRepository repository;

    /**
     * Upsert by orderId. An existing order keeps its database id; its fields are replaced, which is how a
     * fee breakdown resolved after the first import reaches the store.
     */
    public Order upsert(Order order) {
        return repository.findByOrderId(order.getOrderId())
                .map(existing -> copyOrderInto(existing, order))
                .map(repository::save)
                .orElseGet(() -> repository.save(order));
    }

    public int upsertAll(List<Order> orders) {
        orders.forEach(this::upsert);
        log.info("Imported {} orders", orders.size());
        return orders.size();
    }

    /**
     * Orders traded in {@code year} whose fee breakdown is still unknown, in replay order.
     */
    public List<Order> findMissingFees(int year) {
        return repository.findWithUnknownFees(LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31)).stream()
                .sorted(Comparator.comparing(Order::getSymbol)
                        .thenComparing(Order::getTradeDate)
                        .thenComparing(Order::getSequenceId, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    private static Order copyOrderInto(Order target, Order source) {
        target.setSymbol(source.getSymbol());
        target.setSide(source.getSide());
        target.setQuantity(source.getQuantity());
        target.setPrice(source.getPrice());
        target.setCurrency(source.getCurrency());
        target.setFees(source.getFees());
        target.setTradeDate(source.getTradeDate());
        target.setSequenceId(source.getSequenceId());
        return target;
    }
}
