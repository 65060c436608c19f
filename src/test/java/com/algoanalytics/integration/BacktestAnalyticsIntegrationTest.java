package com.algoanalytics.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.algoanalytics.audit.TradeExecutionAuditLog;
import com.algoanalytics.audit.TradeExecutionAuditLogFactory;
import com.algoanalytics.audit.TradeLogCsvExporter;
import com.algoanalytics.config.AnalyticsConfig;
import com.algoanalytics.config.AuditLogConfig;
import com.algoanalytics.domain.enums.OrderSide;
import com.algoanalytics.domain.model.EquityCurve;
import com.algoanalytics.domain.model.EquityPoint;
import com.algoanalytics.domain.model.Fill;
import com.algoanalytics.domain.model.PortfolioSnapshot;
import com.algoanalytics.drawdown.DrawdownAnalyzer;
import com.algoanalytics.exception.ErrorCode;
import com.algoanalytics.exception.ValidationException;
import com.algoanalytics.observability.AnalyticsDiagnostics;
import com.algoanalytics.reporting.MetricsOrchestrator;
import com.algoanalytics.reporting.MetricsReport;
import com.algoanalytics.returns.ReturnSeriesDeriver;
import com.algoanalytics.risk.BenchmarkComparator;
import com.algoanalytics.risk.RiskAdjustedReturnCalculator;
import com.algoanalytics.risk.ValueAtRiskCalculator;
import com.algoanalytics.rolling.RollingWindowMetricsEngine;
import com.algoanalytics.trades.RoundTripMatcher;
import com.algoanalytics.trades.TradeStatisticsAggregator;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * End-to-end test of one backtest run: the decision and execution sides feed the audit log
 * bar by bar, then the metrics orchestrator turns the fills and equity curve into a report.
 * Wires the real components together; nothing is mocked.
 */
@SuppressWarnings("unchecked")
class BacktestAnalyticsIntegrationTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 2, 16, 0);
    private static final BigDecimal CAPITAL = new BigDecimal("10000");

    @TempDir
    Path tempDir;

    private AnalyticsConfig analyticsConfig;
    private AuditLogConfig auditLogConfig;
    private AnalyticsDiagnostics diagnostics;
    private MetricsOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        analyticsConfig = new AnalyticsConfig();
        analyticsConfig.setRollingWindow(5);
        auditLogConfig = new AuditLogConfig();
        auditLogConfig.setExportDirectory(tempDir.toString());
        diagnostics = new AnalyticsDiagnostics();

        orchestrator = new MetricsOrchestrator(
                new ReturnSeriesDeriver(),
                new DrawdownAnalyzer(),
                new RiskAdjustedReturnCalculator(analyticsConfig, diagnostics),
                new ValueAtRiskCalculator(diagnostics),
                new BenchmarkComparator(analyticsConfig, diagnostics),
                new TradeStatisticsAggregator(new RoundTripMatcher(), diagnostics),
                new RollingWindowMetricsEngine(analyticsConfig, diagnostics),
                analyticsConfig);
    }

    private static EquityCurve dailyCurve(double... values) {
        List<EquityPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(EquityPoint.of(START.plusDays(i), BigDecimal.valueOf(values[i])));
        }
        return EquityCurve.of(points);
    }

    private static Fill fill(OrderSide side, String price, int day) {
        return Fill.builder()
                .symbol("QQQ")
                .side(side)
                .quantity(20)
                .fillPrice(new BigDecimal(price))
                .commission(BigDecimal.ONE)
                .timestamp(START.plusDays(day).plusSeconds(20))
                .build();
    }

    @Test
    @DisplayName("a full run produces an audit CSV and a five-section report")
    void fullRun() throws IOException {
        EquityCurve curve = dailyCurve(10000, 10100, 9900, 10050, 10300, 10250, 10400, 10600);
        List<Fill> fills = List.of(
                fill(OrderSide.BUY, "400", 0),
                fill(OrderSide.SELL, "412", 3),
                fill(OrderSide.BUY, "410", 4),
                fill(OrderSide.SELL, "405", 6));

        TradeExecutionAuditLog auditLog =
                new TradeExecutionAuditLogFactory(auditLogConfig, diagnostics).create(CAPITAL);
        for (int bar = 0; bar < curve.size(); bar++) {
            LocalDateTime barTime = START.plusDays(bar);
            for (Fill fill : fills) {
                if (fill.getTimestamp().toLocalDate().equals(barTime.toLocalDate())) {
                    auditLog.logStrategyContext(
                            barTime,
                            "QQQ",
                            fill.getSide() == OrderSide.BUY ? "Bullish" : "Bearish",
                            "signal",
                            Map.of("ema", fill.getFillPrice()),
                            Map.of("band", new BigDecimal("0.02")));
                    auditLog.logTradeExecution(
                            fill,
                            PortfolioSnapshot.builder().portfolioValue(curve.get(bar).getValue()).build(),
                            PortfolioSnapshot.builder().portfolioValue(curve.get(bar).getValue()).build());
                }
            }
            auditLog.incrementBar();
        }

        Path csv = new TradeLogCsvExporter(auditLogConfig).export(auditLog, "Integration");
        assertThat(Files.readAllLines(csv)).hasSize(5);
        assertThat(auditLog.getTradeRecords()).allSatisfy(record -> assertThat(record.hasContext()).isTrue());

        MetricsReport report = orchestrator.calculateMetrics(fills, curve, CAPITAL);
        Map<String, Object> map = report.toMap();

        assertThat(map).containsOnlyKeys("returns", "risk", "trades", "drawdown", "time_analysis");
        assertThat(report.getReturns().getPeriods()).isEqualTo(7);
        assertThat(report.getReturns().getTotalReturn()).isCloseTo(0.06, within(1e-12));
        assertThat(report.getTrades().getTotalTrades()).isEqualTo(2);
        assertThat(report.getTrades().getWinningTrades()).isEqualTo(1);
        assertThat(report.getTrades().getNetPnl()).isEqualByComparingTo("136");
        assertThat(report.getDrawdown().getMaxDrawdown()).isCloseTo(-200.0 / 10100.0, within(1e-12));
        assertThat(report.getRisk().getCvar95()).isGreaterThanOrEqualTo(report.getRisk().getVar95Historical());
        assertThat(report.getTimeAnalysis().getRolling().definedRows()).hasSize(3);

        Path summarized = new TradeLogCsvExporter(auditLogConfig).export(auditLog, tempDir.resolve("summary.csv"), report);
        List<String> lines = Files.readAllLines(summarized);
        assertThat(lines).hasSize(15);
        assertThat(lines.get(5)).isEmpty();
        assertThat(lines.get(6)).isEqualTo("Summary Statistics:");
        assertThat(lines.get(14)).isEqualTo("Win Rate,50%");

        Map<String, Object> timeAnalysis = (Map<String, Object>) map.get("time_analysis");
        Map<Integer, Map<String, Object>> monthly = (Map<Integer, Map<String, Object>>) timeAnalysis.get("monthly_returns");
        assertThat(monthly.get(2024)).containsEntry("Feb", "no data");
        assertThat(monthly.get(2024).get("Jan")).isInstanceOf(Double.class);
    }

    @Test
    @DisplayName("no fills and a rising curve give a zero trade block and infinite downside ratios")
    void risingCurveNoTrades() {
        MetricsReport report = orchestrator.calculateMetrics(List.of(), dailyCurve(100, 101, 102, 104), new BigDecimal("100"));
        Map<String, Object> risk = (Map<String, Object>) report.toMap().get("risk");
        Map<String, Object> trades = (Map<String, Object>) report.toMap().get("trades");

        assertThat(risk).containsEntry("sortino_ratio", "inf");
        assertThat(risk).containsEntry("calmar_ratio", "inf");
        assertThat(risk).containsEntry("omega_ratio", "inf");
        assertThat(trades).containsEntry("total_trades", 0);
        assertThat(trades).containsEntry("profit_factor", 0.0);
        assertThat(report.getDrawdown().getMaxDrawdown()).isZero();
    }

    @Test
    @DisplayName("CAGR compounds over calendar days")
    void cagr() {
        EquityCurve curve = EquityCurve.of(List.of(
                EquityPoint.of(LocalDateTime.of(2023, 1, 1, 16, 0), new BigDecimal("100")),
                EquityPoint.of(LocalDateTime.of(2023, 7, 1, 16, 0), new BigDecimal("104")),
                EquityPoint.of(LocalDateTime.of(2024, 1, 1, 16, 0), new BigDecimal("110"))));

        MetricsReport report = orchestrator.calculateMetrics(List.of(), curve, new BigDecimal("100"));

        assertThat(report.getTimeAnalysis().getCalendarDays()).isEqualTo(365);
        assertThat(report.getReturns().getCagr()).isCloseTo(0.10, within(1e-12));
        assertThat(report.getTimeAnalysis().getMonthlyReturns().toMap()).containsOnlyKeys(2023, 2024);
    }

    @Test
    @DisplayName("benchmark metrics appear when a benchmark curve is supplied")
    void withBenchmark() {
        EquityCurve curve = dailyCurve(100, 102, 101, 104, 103, 107);
        EquityCurve benchmark = dailyCurve(50, 50.5, 50.2, 51, 50.9, 51.8);

        MetricsReport report = orchestrator.calculateMetrics(List.of(), curve, new BigDecimal("100"), benchmark);

        assertThat(report.getRisk().getBenchmark()).isNotNull();
        assertThat(report.getRisk().getBenchmark().getCorrelation()).isBetween(-1.0, 1.0);
        assertThat(report.getTimeAnalysis().getRolling().isBenchmarkSupplied()).isTrue();
        assertThat((Map<String, Object>) report.toMap().get("risk")).containsKey("benchmark");
    }

    @Test
    @DisplayName("invalid inputs are rejected")
    void validation() {
        assertThatThrownBy(() -> orchestrator.calculateMetrics(List.of(), dailyCurve(100, 101), BigDecimal.ZERO))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("initial capital");
        assertThatThrownBy(() -> orchestrator.calculateMetrics(List.of(), EquityCurve.empty(), BigDecimal.TEN))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("empty");
        assertThatThrownBy(() -> orchestrator.calculateMetrics(
                        List.of(), dailyCurve(100, 101, 102), BigDecimal.TEN, dailyCurve(100, 101)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("benchmark on different timestamps is rejected at the first mismatch")
    void misalignedBenchmark() {
        EquityCurve curve = dailyCurve(100, 102, 101, 104);
        EquityCurve shifted = EquityCurve.of(List.of(
                EquityPoint.of(START, new BigDecimal("50")),
                EquityPoint.of(START.plusDays(1), new BigDecimal("51")),
                EquityPoint.of(START.plusDays(3), new BigDecimal("50")),
                EquityPoint.of(START.plusDays(4), new BigDecimal("52"))));

        assertThatThrownBy(() -> orchestrator.calculateMetrics(List.of(), curve, new BigDecimal("100"), shifted))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("index 2")
                .extracting(e -> ((ValidationException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_EQUITY_CURVE);
    }
}
