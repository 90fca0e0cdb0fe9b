package com.tradedesk.api.controller;

import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.portfolio.PortfolioService;
import com.tradedesk.portfolio.PortfolioSummary;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** GET /api/portfolio?mode= -- cash, holdings value and P&L of a trading mode. */
@RestController
@RequestMapping("/api/portfolio")
public class PortfolioController {

    private final PortfolioService portfolioService;

    public PortfolioController(PortfolioService portfolioService) {
        this.portfolioService = portfolioService;
    }

    @GetMapping
    public ResponseEntity<PortfolioSummary> getSummary(@RequestParam(defaultValue = "SIMULATED") TradingMode mode) {
        return ResponseEntity.ok(portfolioService.summary(mode));
    }
}
