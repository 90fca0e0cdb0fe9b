package com.tradedesk.api.controller;

import com.tradedesk.api.dto.request.PriceUpdateRequest;
import com.tradedesk.exception.ValidationException;
import com.tradedesk.marketdata.MarketDataService;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the simulated market-data feed.
 *
 * <ul>
 *   <li>PUT /api/market-data/{symbol} -- set the price and/or load a close history</li>
 *   <li>GET /api/market-data/{symbol} -- current price and recent closes</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/market-data")
public class MarketDataController {

    private final MarketDataService marketDataService;

    public MarketDataController(MarketDataService marketDataService) {
        this.marketDataService = marketDataService;
    }

    @PutMapping("/{symbol}")
    public ResponseEntity<Map<String, Object>> updatePrice(
            @PathVariable String symbol, @Valid @RequestBody PriceUpdateRequest request) {
        boolean hasHistory = request.getHistory() != null && !request.getHistory().isEmpty();
        if (request.getPrice() == null && !hasHistory) {
            throw new ValidationException("price", "Either price or history is required");
        }
        if (hasHistory) {
            marketDataService.loadHistory(symbol, request.getHistory());
        }
        if (request.getPrice() != null) {
            marketDataService.updatePrice(symbol, request.getPrice());
        }
        return ResponseEntity.ok(snapshot(symbol, 30));
    }

    @GetMapping("/{symbol}")
    public ResponseEntity<Map<String, Object>> getMarketData(
            @PathVariable String symbol, @RequestParam(defaultValue = "30") int lookback) {
        return ResponseEntity.ok(snapshot(symbol, lookback));
    }

    private Map<String, Object> snapshot(String symbol, int lookback) {
        String normalized = MarketDataService.normalize(symbol);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("symbol", normalized);
        body.put("price", marketDataService.getCurrentPrice(normalized).orElse(null));
        body.put("history", marketDataService.getCloseHistory(normalized, lookback));
        return body;
    }
}
