package com.algoanalytics.reporting;

import com.algoanalytics.config.AnalyticsConfig;
import com.algoanalytics.core.stats.ReturnStatistics;
import com.algoanalytics.domain.model.EquityCurve;
import com.algoanalytics.domain.model.Fill;
import com.algoanalytics.drawdown.DrawdownAnalysis;
import com.algoanalytics.drawdown.DrawdownAnalyzer;
import com.algoanalytics.exception.ErrorCode;
import com.algoanalytics.exception.ValidationException;
import com.algoanalytics.returns.ReturnSeries;
import com.algoanalytics.returns.ReturnSeriesDeriver;
import com.algoanalytics.risk.BenchmarkComparator;
import com.algoanalytics.risk.BenchmarkMetrics;
import com.algoanalytics.risk.RiskAdjustedReturnCalculator;
import com.algoanalytics.risk.ValueAtRiskCalculator;
import com.algoanalytics.rolling.RollingMetricsTable;
import com.algoanalytics.rolling.RollingWindowMetricsEngine;
import com.algoanalytics.trades.TradeStatistics;
import com.algoanalytics.trades.TradeStatisticsAggregator;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of the analytics engine: turns one run's fills and equity curve into a
 * {@link MetricsReport}.
 *
 * <p>The return series is derived once and shared by every calculator. Apart from logging
 * and diagnostics, this is a pure function of its inputs.
 */
@Service
public class MetricsOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(MetricsOrchestrator.class);

    private static final double DAYS_PER_YEAR = 365.0;

    private final ReturnSeriesDeriver returnSeriesDeriver;
    private final DrawdownAnalyzer drawdownAnalyzer;
    private final RiskAdjustedReturnCalculator riskAdjustedReturnCalculator;
    private final ValueAtRiskCalculator valueAtRiskCalculator;
    private final BenchmarkComparator benchmarkComparator;
    private final TradeStatisticsAggregator tradeStatisticsAggregator;
    private final RollingWindowMetricsEngine rollingWindowMetricsEngine;
    private final AnalyticsConfig config;

    public MetricsOrchestrator(
            ReturnSeriesDeriver returnSeriesDeriver,
            DrawdownAnalyzer drawdownAnalyzer,
            RiskAdjustedReturnCalculator riskAdjustedReturnCalculator,
            ValueAtRiskCalculator valueAtRiskCalculator,
            BenchmarkComparator benchmarkComparator,
            TradeStatisticsAggregator tradeStatisticsAggregator,
            RollingWindowMetricsEngine rollingWindowMetricsEngine,
            AnalyticsConfig config) {
        this.returnSeriesDeriver = returnSeriesDeriver;
        this.drawdownAnalyzer = drawdownAnalyzer;
        this.riskAdjustedReturnCalculator = riskAdjustedReturnCalculator;
        this.valueAtRiskCalculator = valueAtRiskCalculator;
        this.benchmarkComparator = benchmarkComparator;
        this.tradeStatisticsAggregator = tradeStatisticsAggregator;
        this.rollingWindowMetricsEngine = rollingWindowMetricsEngine;
        this.config = config;
    }

    public MetricsReport calculateMetrics(List<Fill> fills, EquityCurve equityCurve, BigDecimal initialCapital) {
        return calculateMetrics(fills, equityCurve, initialCapital, null);
    }

    /**
     * Computes the full report.
     *
     * @param fills executed fills of the run, any order
     * @param equityCurve portfolio value per bar
     * @param initialCapital starting capital, must be positive
     * @param benchmarkCurve benchmark values on the same timestamps, or null
     * @throws ValidationException on an invalid curve, non-positive capital or a benchmark
     *     whose timestamps differ from the equity curve
     */
    public MetricsReport calculateMetrics(
            List<Fill> fills, EquityCurve equityCurve, BigDecimal initialCapital, EquityCurve benchmarkCurve) {
        if (initialCapital == null || initialCapital.signum() <= 0) {
            throw new ValidationException("initial capital must be positive: " + initialCapital);
        }
        equityCurve.validate();
        if (benchmarkCurve != null) {
            benchmarkCurve.validate();
            requireAligned(equityCurve, benchmarkCurve);
        }

        log.info("Calculating metrics: {} fills, {} equity points", fills.size(), equityCurve.size());

        ReturnSeries returnSeries = returnSeriesDeriver.derive(equityCurve);
        ReturnSeries benchmarkSeries = benchmarkCurve != null ? returnSeriesDeriver.derive(benchmarkCurve) : null;
        double[] returns = returnSeries.values();

        DrawdownAnalysis drawdown = drawdownAnalyzer.analyze(equityCurve);

        long calendarDays = ChronoUnit.DAYS.between(
                equityCurve.first().getTimestamp(), equityCurve.last().getTimestamp());
        BigDecimal finalValue = equityCurve.last().getValue();
        double growth = finalValue.divide(initialCapital, MathContext.DECIMAL64).doubleValue();
        double cagr = calendarDays == 0 ? 0.0 : Math.pow(growth, DAYS_PER_YEAR / calendarDays) - 1.0;

        ReturnsMetrics returnsMetrics = ReturnsMetrics.builder()
                .initialCapital(initialCapital)
                .finalValue(finalValue)
                .totalReturn(growth - 1.0)
                .cagr(cagr)
                .meanPeriodReturn(ReturnStatistics.mean(returns))
                .periods(returns.length)
                .build();

        BenchmarkMetrics benchmarkMetrics =
                benchmarkSeries != null ? benchmarkComparator.compare(returns, benchmarkSeries.values()) : null;
        RiskMetrics riskMetrics = buildRiskMetrics(returns, cagr, drawdown.getMaxDrawdown(), benchmarkMetrics);

        TradeStatistics tradeStatistics = tradeStatisticsAggregator.aggregate(fills);

        MonthlyReturnsTable monthly = MonthlyReturnsTable.from(returnSeries);
        Optional<Map.Entry<YearMonth, Double>> best = monthly.best();
        Optional<Map.Entry<YearMonth, Double>> worst = monthly.worst();
        RollingMetricsTable rolling =
                rollingWindowMetricsEngine.compute(returnSeries, benchmarkSeries, config.getRollingWindow());

        TimeAnalysis timeAnalysis = TimeAnalysis.builder()
                .start(equityCurve.first().getTimestamp())
                .end(equityCurve.last().getTimestamp())
                .calendarDays(calendarDays)
                .years(calendarDays / DAYS_PER_YEAR)
                .cagr(cagr)
                .monthlyReturns(monthly)
                .bestMonth(best.map(Map.Entry::getKey).orElse(null))
                .bestMonthReturn(best.map(Map.Entry::getValue).orElse(null))
                .worstMonth(worst.map(Map.Entry::getKey).orElse(null))
                .worstMonthReturn(worst.map(Map.Entry::getValue).orElse(null))
                .rolling(rolling)
                .build();

        log.info(
                "Performance: return={}, CAGR={}, sharpe={}, maxDD={}, round trips={}",
                returnsMetrics.getTotalReturn(),
                cagr,
                riskMetrics.getSharpe(),
                drawdown.getMaxDrawdown(),
                tradeStatistics.getTotalTrades());

        return MetricsReport.builder()
                .returns(returnsMetrics)
                .risk(riskMetrics)
                .trades(tradeStatistics)
                .drawdown(drawdown)
                .timeAnalysis(timeAnalysis)
                .build();
    }

    private RiskMetrics buildRiskMetrics(
            double[] returns, double cagr, double maxDrawdown, BenchmarkMetrics benchmarkMetrics) {
        double confidence = config.getVarConfidence();
        double confidenceHigh = config.getVarConfidenceHigh();

        return RiskMetrics.builder()
                .volatility(riskAdjustedReturnCalculator.annualizedVolatility(returns))
                .sharpe(riskAdjustedReturnCalculator.sharpe(returns))
                .sortino(riskAdjustedReturnCalculator.sortino(returns))
                .omega(riskAdjustedReturnCalculator.omega(returns))
                .tailRatio(riskAdjustedReturnCalculator.tailRatio(returns))
                .calmar(riskAdjustedReturnCalculator.calmar(cagr, maxDrawdown))
                .varConfidence(confidence)
                .varConfidenceHigh(confidenceHigh)
                .var95Historical(valueAtRiskCalculator.historical(returns, confidence))
                .var95Parametric(valueAtRiskCalculator.parametric(returns, confidence))
                .var95CornishFisher(valueAtRiskCalculator.cornishFisher(returns, confidence))
                .var99Historical(valueAtRiskCalculator.historical(returns, confidenceHigh))
                .cvar95(valueAtRiskCalculator.conditionalValueAtRisk(returns, confidence))
                .cvar99(valueAtRiskCalculator.conditionalValueAtRisk(returns, confidenceHigh))
                .skewness(ReturnStatistics.skewness(returns))
                .kurtosis(ReturnStatistics.excessKurtosis(returns))
                .benchmark(benchmarkMetrics)
                .build();
    }

    private static void requireAligned(EquityCurve equityCurve, EquityCurve benchmarkCurve) {
        if (benchmarkCurve.size() != equityCurve.size()) {
            throw new ValidationException(
                    ErrorCode.INVALID_EQUITY_CURVE,
                    "benchmark curve has " + benchmarkCurve.size() + " points, equity curve has " + equityCurve.size());
        }
        for (int i = 0; i < equityCurve.size(); i++) {
            LocalDateTime expected = equityCurve.get(i).getTimestamp();
            LocalDateTime actual = benchmarkCurve.get(i).getTimestamp();
            if (!expected.equals(actual)) {
                throw new ValidationException(
                        ErrorCode.INVALID_EQUITY_CURVE,
                        "benchmark timestamps do not match the equity curve (first at index " + i + ")",
                        Map.of("index", i, "expected", expected.toString(), "actual", actual.toString()));
            }
        }
    }
}
