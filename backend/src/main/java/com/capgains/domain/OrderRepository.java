package com.capgains.domain;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for orders. Replay queries (history window, distinct symbols) live in MongoOrderStore.
 */
public interface OrderRepository extends MongoRepository<Order, String> {

    Optional<Order> findByOrderId(String orderId);

    /** Orders traded in the inclusive window whose fee breakdown is absent or has an item without an amount. */
    @Query("{ 'tradeDate' : { '$gte' : ?0, '$lte' : ?1 }, '$or' : [ { 'fees' : null }, { 'fees.items' : null },"
            + " { 'fees.items' : { '$elemMatch' : { 'amount' : null } } } ] }")
    List<Order> findWithUnknownFees(LocalDate from, LocalDate to);
}
