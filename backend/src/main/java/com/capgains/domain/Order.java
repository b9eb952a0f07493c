package com.capgains.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Executed broker order. Quantity, price and fees are in the order's native currency; all monetary fields
 * are BigDecimal. Replay order is (tradeDate, sequenceId) ascending.
 * <p>
 * {@code fees == null} means the fee breakdown has not been resolved yet, and so does a breakdown with an item
 * missing its amount; an empty breakdown means zero fees.
 */
@Document(collection = "orders")
@CompoundIndexes({
    @CompoundIndex(name = "symbol_tradeDate_sequence", def = "{'symbol': 1, 'tradeDate': 1, 'sequenceId': 1}"),
    @CompoundIndex(name = "side_tradeDate", def = "{'side': 1, 'tradeDate': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Order {

    @Id
    private String id;
    @Indexed(unique = true)
    @EqualsAndHashCode.Include
    private String orderId;
    private String symbol;
    private OrderSide side;
    private BigDecimal quantity;
    private BigDecimal price;
    private String currency;
    private FeeBreakdown fees;
    private LocalDate tradeDate;
    private Long sequenceId;

    public boolean hasKnownFees() {
        return fees != null && fees.isComplete();
    }
}
