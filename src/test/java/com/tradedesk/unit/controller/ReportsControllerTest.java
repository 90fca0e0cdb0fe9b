package com.tradedesk.unit.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tradedesk.api.controller.PortfolioController;
import com.tradedesk.api.controller.ReportsController;
import com.tradedesk.config.ApiResponseAdvice;
import com.tradedesk.domain.enums.PositionDirection;
import com.tradedesk.domain.enums.TradingMode;
import com.tradedesk.domain.model.Lot;
import com.tradedesk.exception.GlobalExceptionHandler;
import com.tradedesk.portfolio.PortfolioService;
import com.tradedesk.portfolio.PortfolioSummary;
import com.tradedesk.reporting.TaxReport;
import com.tradedesk.reporting.TaxReportService;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for the read-only report endpoints: tax report and portfolio summary.
 */
@ExtendWith(MockitoExtension.class)
class ReportsControllerTest {

    private MockMvc mockMvc;

    @Mock
    private TaxReportService taxReportService;

    @Mock
    private PortfolioService portfolioService;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(
                        new ReportsController(taxReportService), new PortfolioController(portfolioService))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    @Test
    @DisplayName("GET /api/reports/tax passes mode and year")
    void taxReport() throws Exception {
        when(taxReportService.summary(TradingMode.SIMULATED, 2025))
                .thenReturn(TaxReport.builder()
                        .mode(TradingMode.SIMULATED)
                        .year(2025)
                        .lotCount(2)
                        .realizedGain(new BigDecimal("3100.00"))
                        .taxLiability(new BigDecimal("10.50"))
                        .symbols(List.of())
                        .recommendations(List.of("Keep records of every lot sale for tax filing"))
                        .build());

        mockMvc.perform(get("/api/reports/tax").param("year", "2025"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.year").value(2025))
                .andExpect(jsonPath("$.data.taxLiability").value(10.50))
                .andExpect(jsonPath("$.data.recommendations[0]").value("Keep records of every lot sale for tax filing"));
    }

    @Test
    @DisplayName("GET /api/reports/tax/lots lists closed lots alongside open ones")
    void taxLots() throws Exception {
        Lot closed = Lot.builder()
                .id("lot-1")
                .symbol("AAPL")
                .mode(TradingMode.LIVE)
                .direction(PositionDirection.LONG)
                .originalQuantity(50)
                .remainingQuantity(0)
                .soldQuantity(50)
                .unitCost(new BigDecimal("100"))
                .acquiredAt(LocalDateTime.of(2025, 3, 3, 10, 0))
                .realizedGain(new BigDecimal("2500"))
                .build();
        when(taxReportService.listLots(TradingMode.LIVE, "AAPL")).thenReturn(List.of(closed));

        mockMvc.perform(get("/api/reports/tax/lots").param("mode", "LIVE").param("symbol", "AAPL"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].id").value("lot-1"))
                .andExpect(jsonPath("$.data[0].remainingQuantity").value(0))
                .andExpect(jsonPath("$.data[0].realizedGain").value(2500));
    }

    @Test
    @DisplayName("GET /api/portfolio defaults to the simulated book")
    void portfolio() throws Exception {
        when(portfolioService.summary(TradingMode.SIMULATED))
                .thenReturn(PortfolioSummary.builder()
                        .mode(TradingMode.SIMULATED)
                        .cash(new BigDecimal("98997.50"))
                        .portfolioValue(new BigDecimal("99997.50"))
                        .openPositions(1)
                        .positions(List.of())
                        .build());

        mockMvc.perform(get("/api/portfolio"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.cash").value(98997.50))
                .andExpect(jsonPath("$.data.openPositions").value(1));
    }
}
