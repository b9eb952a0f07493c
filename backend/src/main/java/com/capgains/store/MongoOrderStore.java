package com.capgains.store;

import com.capgains.domain.Order;
import com.capgains.domain.OrderSide;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * OrderStore over the orders collection using MongoTemplate and findDistinct.
 */
@Component
@RequiredArgsConstructor
public class MongoOrderStore implements OrderStore {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<Order> ordersUntil(String symbol, LocalDate until) {
        Query query = new Query(where("symbol").is(symbol).and("tradeDate").lte(until))
                .with(Sort.by(Sort.Order.asc("tradeDate"), Sort.Order.asc("sequenceId")));
        return mongoTemplate.find(query, Order.class);
    }

    @Override
    public Set<String> symbolsWithSells(int year) {
        LocalDate start = LocalDate.of(year, 1, 1);
        LocalDate end = LocalDate.of(year, 12, 31);
        Set<String> symbols = new TreeSet<>(distinctSymbols(OrderSide.SELL, start, end));

        Set<String> everSold = new HashSet<>(distinctSymbols(OrderSide.SELL, null, end));
        for (String bought : distinctSymbols(OrderSide.BUY, start, end)) {
            if (everSold.contains(bought)) {
                symbols.add(bought);
            }
        }
        return symbols;
    }

    private List<String> distinctSymbols(OrderSide side, LocalDate from, LocalDate to) {
        Query query = from == null
                ? new Query(where("side").is(side).and("tradeDate").lte(to))
                : new Query(where("side").is(side).and("tradeDate").gte(from).lte(to));
        return mongoTemplate.findDistinct(query, "symbol", Order.class, String.class);
    }
}
