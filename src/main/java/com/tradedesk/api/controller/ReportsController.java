package com.tradedesk.api.controller;

import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.domain.model.Lot;
import com.tradedesk.reporting.TaxReport;
import com.tradedesk.reporting.TaxReportService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Tax reporting endpoints.
 * <ul>
 *   <li>GET /api/reports/tax?mode=&year= -- lot-based tax summary. Without a year all lots are included.</li>
 *   <li>GET /api/reports/tax/lots?mode=&symbol= -- individual lots, open and closed, in FIFO order</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/reports")
public class ReportsController {

    private final TaxReportService taxReportService;

    public ReportsController(TaxReportService taxReportService) {
        this.taxReportService = taxReportService;
    }

    @GetMapping("/tax")
    public ResponseEntity<TaxReport> taxReport(
            @RequestParam(defaultValue = "SIMULATED") TradingMode mode, @RequestParam(required = false) Integer year) {
        return ResponseEntity.ok(taxReportService.summary(mode, year));
    }

    @GetMapping("/tax/lots")
    public ResponseEntity<List<Lot>> taxLots(
            @RequestParam(defaultValue = "SIMULATED") TradingMode mode, @RequestParam(required = false) String symbol) {
        return ResponseEntity.ok(taxReportService.listLots(mode, symbol));
    }
}
