package com.tradedesk.api.controller;

import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.domain.model.PositionSnapshot;
import com.tradedesk.ledger.PositionBook;
import com.tradedesk.marketdata.MarketDataService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for positions.
 *
 * <ul>
 *   <li>GET /api/positions?mode= -- open positions of a mode, by symbol</li>
 *   <li>GET /api/positions/{symbol}?mode= -- one position with its open lots (flat if none)</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/positions")
public class PositionController {

    private final PositionBook positionBook;

    public PositionController(PositionBook positionBook) {
        this.positionBook = positionBook;
    }

    @GetMapping
    public ResponseEntity<List<PositionSnapshot>> getPositions(
            @RequestParam(defaultValue = "SIMULATED") TradingMode mode) {
        return ResponseEntity.ok(positionBook.getPositions(mode));
    }

    @GetMapping("/{symbol}")
    public ResponseEntity<PositionSnapshot> getPosition(
            @PathVariable String symbol, @RequestParam(defaultValue = "SIMULATED") TradingMode mode) {
        return ResponseEntity.ok(positionBook.getPosition(MarketDataService.normalize(symbol), mode));
    }
}
