package com.capgains.store;

import com.capgains.domain.Order;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Read access to recorded orders for the replay engine.
 */
public interface OrderStore {

    /**
     * Every order of {@code symbol} traded on or before {@code until}, ascending by (tradeDate, sequenceId).
     */
    List<Order> ordersUntil(String symbol, LocalDate until);

    /**
     * Symbols that may realize a gain or loss in {@code year}: a sell in the year, or a buy in the year
     * for a symbol that has any sell on or before the year end (a possible short close).
     */
    Set<String> symbolsWithSells(int year);
}
