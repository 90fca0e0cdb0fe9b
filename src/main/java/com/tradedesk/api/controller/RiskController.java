package com.tradedesk.api.controller;

import com.tradedesk.api.dto.request.RiskCheckRequest;
import com.tradedesk.api.dto.request.RiskLimitsRequest;
import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.domain.enums.VarMethod;
import com.tradedesk.risk.PortfolioRiskSummary;
import com.tradedesk.risk.RiskCheckResult;
import com.tradedesk.risk.RiskLimits;
import com.tradedesk.risk.RiskMetricsService;
import com.tradedesk.risk.RiskService;
import com.tradedesk.risk.VarResult;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for risk: pre-trade preview, VaR, limits and the portfolio risk summary.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/risk/check -- run the risk gate for a hypothetical order</li>
 *   <li>GET /api/risk/var -- VaR and expected shortfall for a symbol or PORTFOLIO</li>
 *   <li>GET /api/risk/limits -- current limits</li>
 *   <li>PUT /api/risk/limits -- update limits; only non-null fields are applied</li>
 *   <li>GET /api/risk/summary -- concentration, diversification and VaR of a mode</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private static final Logger log = LoggerFactory.getLogger(RiskController.class);

    private final RiskService riskService;
    private final RiskMetricsService riskMetricsService;

    public RiskController(RiskService riskService, RiskMetricsService riskMetricsService) {
        this.riskService = riskService;
        this.riskMetricsService = riskMetricsService;
    }

    /** A denial is a normal result here, not an error: {@code allowed=false} plus the violation. */
    @PostMapping("/check")
    public ResponseEntity<Map<String, Object>> check(@Valid @RequestBody RiskCheckRequest request) {
        RiskCheckResult result = riskService.preview(
                request.getSymbol(), request.getSide(), request.getQuantity(), request.getPrice(), request.getMode());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("allowed", result.isAllowed());
        if (result.isDenied()) {
            body.put("code", result.getViolation().getCode());
            body.put("message", result.getViolation().getMessage());
            body.put("violation", result.getViolation().toDetails());
        }
        return ResponseEntity.ok(body);
    }

    @GetMapping("/var")
    public ResponseEntity<VarResult> valueAtRisk(
            @RequestParam(defaultValue = RiskMetricsService.PORTFOLIO) String target,
            @RequestParam(defaultValue = "HISTORICAL") VarMethod method,
            @RequestParam(required = false) BigDecimal confidence,
            @RequestParam(defaultValue = "SIMULATED") TradingMode mode) {
        return ResponseEntity.ok(riskMetricsService.computeVar(target, method, confidence, mode));
    }

    @GetMapping("/limits")
    public ResponseEntity<RiskLimits> getRiskLimits() {
        return ResponseEntity.ok(riskService.getLimits());
    }

    @PutMapping("/limits")
    public ResponseEntity<RiskLimits> updateRiskLimits(@Valid @RequestBody RiskLimitsRequest request) {
        RiskLimits current = riskService.getLimits();
        RiskLimits.RiskLimitsBuilder builder = current.toBuilder();
        if (request.getMaxPositionFraction() != null) {
            builder.maxPositionFraction(request.getMaxPositionFraction());
        }
        if (request.getMaxConcentrationFraction() != null) {
            builder.maxConcentrationFraction(request.getMaxConcentrationFraction());
        }
        if (request.getMaxPairwiseCorrelation() != null) {
            builder.maxPairwiseCorrelation(request.getMaxPairwiseCorrelation());
        }
        if (request.getMaxDailyLossFraction() != null) {
            builder.maxDailyLossFraction(request.getMaxDailyLossFraction());
        }
        if (request.getVarConfidence() != null) {
            builder.varConfidence(request.getVarConfidence());
        }
        if (request.getCorrelationWindow() != null) {
            builder.correlationWindow(request.getCorrelationWindow());
        }
        if (request.getMaxAnnualizedVolatility() != null) {
            builder.maxAnnualizedVolatility(request.getMaxAnnualizedVolatility());
        }
        if (request.isDisableVarLimit()) {
            builder.maxVarFraction(null);
        } else if (request.getMaxVarFraction() != null) {
            builder.maxVarFraction(request.getMaxVarFraction());
        }

        RiskLimits updated = riskService.replaceLimits(builder.build());
        log.info("Risk limits updated: {}", updated);
        return ResponseEntity.ok(updated);
    }

    @GetMapping("/summary")
    public ResponseEntity<PortfolioRiskSummary> summary(@RequestParam(defaultValue = "SIMULATED") TradingMode mode) {
        return ResponseEntity.ok(riskMetricsService.portfolioRiskSummary(mode));
    }
}
