package com.capgains.api.controller;

import com.capgains.api.dto.FeeItemRequest;
import com.capgains.api.dto.ImportOrdersRequest;
import com.capgains.api.dto.ImportOrdersResponse;
import com.capgains.api.dto.MissingFeeOrderResponse;
import com.capgains.api.dto.OrderRequest;
import com.capgains.domain.FeeBreakdown;
import com.capgains.domain.Order;
import com.capgains.store.IdempotentOrderStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

/**
 * POST /orders (idempotent import by orderId), GET /orders/missing-fees.
 */
@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class OrderController {

    private final IdempotentOrderStore orderStore;

    @PostMapping
    public ResponseEntity<ImportOrdersResponse> importOrders(@Valid @RequestBody ImportOrdersRequest request) {
        List<Order> orders = request.orders().stream().map(OrderController::toOrder).toList();
        return ResponseEntity.ok(new ImportOrdersResponse(orderStore.upsertAll(orders)));
    }

    @GetMapping("/missing-fees")
    public ResponseEntity<List<MissingFeeOrderResponse>> missingFees(@RequestParam int year) {
        return ResponseEntity.ok(orderStore.findMissingFees(year).stream()
                .map(o -> new MissingFeeOrderResponse(o.getOrderId(), o.getSymbol(), o.getSide(),
                        o.getTradeDate(), o.getSequenceId()))
                .toList());
    }

    private static Order toOrder(OrderRequest r) {
        Order order = new Order();
        order.setOrderId(r.orderId().strip());
        order.setSymbol(r.symbol().strip().toUpperCase(Locale.ROOT));
        order.setSide(r.side());
        order.setQuantity(r.quantity());
        order.setPrice(r.price());
        order.setCurrency(r.currency().strip().toUpperCase(Locale.ROOT));
        order.setFees(r.fees() == null ? null : FeeBreakdown.of(r.fees().stream()
                .map(OrderController::toFeeItem)
                .toList()));
        order.setTradeDate(r.tradeDate());
        order.setSequenceId(r.sequenceId());
        return order;
    }

    private static FeeBreakdown.FeeItem toFeeItem(FeeItemRequest f) {
        return new FeeBreakdown.FeeItem(f.name(), f.amount());
    }
}
