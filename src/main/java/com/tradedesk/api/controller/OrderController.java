package com.tradedesk.api.controller;

import com.tradedesk.api.dto.request.PlaceOrderRequest;
import com.tradedesk.api.dto.request.TradingModeRequest;
import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.domain.model.Order;
import com.tradedesk.domain.model.Trade;
import com.tradedesk.oms.OrderLifecycleManager;
import com.tradedesk.oms.OrderRequest;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the order lifecycle.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/orders -- place an order</li>
 *   <li>GET /api/orders -- order history, newest first (symbol, mode, limit filters)</li>
 *   <li>GET /api/orders/trades -- executions across orders, newest first (same filters)</li>
 *   <li>GET /api/orders/{id} -- one order</li>
 *   <li>GET /api/orders/{id}/trades -- fills of an order</li>
 *   <li>POST /api/orders/{id}/execute -- try to fill at the current market price</li>
 *   <li>DELETE /api/orders/{id} -- cancel an active order</li>
 *   <li>GET/PUT /api/orders/mode -- default trading mode</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);

    private final OrderLifecycleManager orderLifecycleManager;

    public OrderController(OrderLifecycleManager orderLifecycleManager) {
        this.orderLifecycleManager = orderLifecycleManager;
    }

    @PostMapping
    public ResponseEntity<Order> placeOrder(@Valid @RequestBody PlaceOrderRequest request) {
        log.info(
                "Order placement requested: {} {} {} x{}",
                request.getSide(),
                request.getType(),
                request.getSymbol(),
                request.getQuantity());
        Order order = orderLifecycleManager.place(OrderRequest.builder()
                .symbol(request.getSymbol())
                .side(request.getSide())
                .type(request.getType())
                .quantity(request.getQuantity())
                .limitPrice(request.getLimitPrice())
                .stopPrice(request.getStopPrice())
                .mode(request.getMode())
                .expiresAt(request.getExpiresAt())
                .build());
        return ResponseEntity.ok(order);
    }

    @GetMapping
    public ResponseEntity<List<Order>> getOrderHistory(
            @RequestParam(required = false) String symbol,
            @RequestParam(required = false) TradingMode mode,
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(orderLifecycleManager.getOrderHistory(symbol, mode, limit));
    }

    @GetMapping("/trades")
    public ResponseEntity<List<Trade>> getTradeHistory(
            @RequestParam(required = false) String symbol,
            @RequestParam(required = false) TradingMode mode,
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(orderLifecycleManager.getTradeHistory(symbol, mode, limit));
    }

    @GetMapping("/mode")
    public ResponseEntity<Map<String, Object>> getTradingMode() {
        return ResponseEntity.ok(Map.of("mode", orderLifecycleManager.getTradingMode()));
    }

    @PutMapping("/mode")
    public ResponseEntity<Map<String, Object>> switchTradingMode(@Valid @RequestBody TradingModeRequest request) {
        TradingMode previous = orderLifecycleManager.switchTradingMode(request.getMode());
        return ResponseEntity.ok(Map.of("mode", request.getMode(), "previousMode", previous));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Order> getOrder(@PathVariable String id) {
        return ResponseEntity.ok(orderLifecycleManager.getOrder(id));
    }

    @GetMapping("/{id}/trades")
    public ResponseEntity<List<Trade>> getTrades(@PathVariable String id) {
        return ResponseEntity.ok(orderLifecycleManager.getTrades(id));
    }

    /** Returns {@code executed=false} with no trade when the price does not cross the order. */
    @PostMapping("/{id}/execute")
    public ResponseEntity<Map<String, Object>> execute(@PathVariable String id) {
        Optional<Trade> trade = orderLifecycleManager.attemptExecution(id);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("executed", trade.isPresent());
        result.put("trade", trade.orElse(null));
        result.put("order", orderLifecycleManager.getOrder(id));
        return ResponseEntity.ok(result);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Order> cancelOrder(@PathVariable String id) {
        log.info("Cancel requested: order={}", id);
        return ResponseEntity.ok(orderLifecycleManager.cancel(id));
    }
}
