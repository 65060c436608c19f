package com.algoanalytics.audit;

import com.algoanalytics.config.AuditLogConfig;
import com.algoanalytics.domain.model.PortfolioSnapshot;
import com.algoanalytics.domain.model.TradeRecord;
import com.algoanalytics.exception.ErrorCode;
import com.algoanalytics.exception.ValidationException;
import com.algoanalytics.reporting.MetricsReport;
import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes a {@link TradeExecutionAuditLog} as CSV.
 *
 * <p>Layout: the fixed columns in {@link #FIXED_COLUMNS} order, then one
 * {@code Indicator_<name>} column per indicator name, then one {@code Threshold_<name>}
 * column per threshold name. Dynamic columns are the sorted union of names over every logged
 * context, so the header does not depend on logging order; a record missing a value gets an
 * empty cell. Fields are quoted per RFC 4180.
 *
 * <p>Exports given a {@link MetricsReport} end with a summary footer: a blank line, a
 * {@value #SUMMARY_TITLE} line and one {@code label,value} line per headline metric.
 */
@Component
public class TradeLogCsvExporter {

    private static final Logger log = LoggerFactory.getLogger(TradeLogCsvExporter.class);

    public static final List<String> FIXED_COLUMNS = List.of(
            "Trade_ID",
            "Date",
            "Bar_Number",
            "Strategy_State",
            "Ticker",
            "Decision",
            "Decision_Reason",
            "Shares",
            "Fill_Price",
            "Position_Value",
            "Commission",
            "Portfolio_Value_Before",
            "Portfolio_Value_After",
            "Cash_Before",
            "Cash_After",
            "Cumulative_Return_Pct",
            "Allocation_Before",
            "Allocation_After");

    public static final String INDICATOR_PREFIX = "Indicator_";
    public static final String THRESHOLD_PREFIX = "Threshold_";

    static final String EMPTY_ALLOCATION = "CASH: 100%";

    public static final String SUMMARY_TITLE = "Summary Statistics:";

    private static final String LINE_SEPARATOR = "\n";

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HHmmss");

    private final AuditLogConfig auditLogConfig;

    public TradeLogCsvExporter(AuditLogConfig auditLogConfig) {
        this.auditLogConfig = auditLogConfig;
    }

    /**
     * Builds the table without touching the filesystem.
     *
     * @throws ValidationException if the log holds no records
     */
    public TradeLogTable toTable(TradeExecutionAuditLog auditLog) {
        List<TradeRecord> records = auditLog.getTradeRecords();
        if (records.isEmpty()) {
            throw new ValidationException(ErrorCode.NOTHING_TO_EXPORT, "nothing to export: trade log is empty");
        }

        SortedSet<String> indicatorKeys = auditLog.getIndicatorKeys();
        SortedSet<String> thresholdKeys = auditLog.getThresholdKeys();

        List<String> columns = new ArrayList<>(FIXED_COLUMNS);
        indicatorKeys.forEach(k -> columns.add(INDICATOR_PREFIX + k));
        thresholdKeys.forEach(k -> columns.add(THRESHOLD_PREFIX + k));

        List<List<String>> rows = new ArrayList<>(records.size());
        for (TradeRecord record : records) {
            rows.add(toRow(record, indicatorKeys, thresholdKeys));
        }
        return new TradeLogTable(List.copyOf(columns), List.copyOf(rows));
    }

    /**
     * Exports to the given file, creating parent directories as needed.
     *
     * @return the written path
     * @throws ValidationException if the log holds no records
     * @throws IOException if the file cannot be written
     */
    public Path export(TradeExecutionAuditLog auditLog, Path target) throws IOException {
        return write(toTable(auditLog), target, List.of());
    }

    /**
     * Exports to the given file and appends the summary footer for {@code report}.
     *
     * @return the written path
     */
    public Path export(TradeExecutionAuditLog auditLog, Path target, MetricsReport report) throws IOException {
        return write(toTable(auditLog), target, summaryFooter(report));
    }

    /**
     * Exports to {@code <exportDirectory>/<strategyName>_<yyyy-MM-dd_HHmmss>.csv}.
     *
     * @return the written path
     */
    public Path export(TradeExecutionAuditLog auditLog, String strategyName) throws IOException {
        return export(auditLog, autoNamed(strategyName));
    }

    /** Auto-named export with the summary footer for {@code report}. */
    public Path export(TradeExecutionAuditLog auditLog, String strategyName, MetricsReport report)
            throws IOException {
        return export(auditLog, autoNamed(strategyName), report);
    }

    /**
     * Footer lines for a report. Money is written at full precision, returns, drawdown and win
     * rate as percentages, Sharpe as a plain number or {@code inf}.
     */
    public List<List<String>> summaryFooter(MetricsReport report) {
        List<List<String>> lines = new ArrayList<>();
        lines.add(List.of());
        lines.add(List.of(SUMMARY_TITLE));
        lines.add(List.of("Initial Capital", number(report.getReturns().getInitialCapital())));
        lines.add(List.of("Final Value", number(report.getReturns().getFinalValue())));
        lines.add(List.of("Total Return", percent(report.getReturns().getTotalReturn())));
        lines.add(List.of("Annualized Return", percent(report.getReturns().getCagr())));
        lines.add(List.of("Sharpe Ratio", String.valueOf(report.getRisk().getSharpe().toReportValue())));
        lines.add(List.of("Max Drawdown", percent(report.getDrawdown().getMaxDrawdown())));
        lines.add(List.of("Total Trades", Integer.toString(report.getTrades().getTotalTrades())));
        lines.add(List.of("Win Rate", percent(report.getTrades().getWinRate())));
        return lines;
    }

    private Path autoNamed(String strategyName) {
        if (strategyName == null || strategyName.isBlank()) {
            throw new ValidationException("strategy name is required for an auto-named export");
        }
        String fileName = strategyName + "_" + LocalDateTime.now().format(FILE_STAMP) + ".csv";
        return Paths.get(auditLogConfig.getExportDirectory()).resolve(fileName);
    }

    private Path write(TradeLogTable table, Path target, List<List<String>> footer) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            writeLine(writer, table.getColumns());
            for (List<String> row : table.getRows()) {
                writeLine(writer, row);
            }
            for (List<String> line : footer) {
                writeLine(writer, line);
            }
        }

        log.info(
                "Exported {} trade records ({} columns{}) to {}",
                table.getRowCount(),
                table.getColumns().size(),
                footer.isEmpty() ? "" : ", with summary",
                target);
        return target;
    }

    private List<String> toRow(TradeRecord record, SortedSet<String> indicatorKeys, SortedSet<String> thresholdKeys) {
        PortfolioSnapshot before = record.getBefore();
        PortfolioSnapshot after = record.getAfter();

        List<String> row = new ArrayList<>(FIXED_COLUMNS.size() + indicatorKeys.size() + thresholdKeys.size());
        row.add(Integer.toString(record.getTradeId()));
        row.add(record.getDate().format(DATE_FORMAT));
        row.add(Long.toString(record.getBarNumber()));
        row.add(record.getStrategyState());
        row.add(record.getTicker());
        row.add(record.getDecision());
        row.add(record.getDecisionReason());
        row.add(Integer.toString(record.getFill().getQuantity()));
        row.add(number(record.getFill().getFillPrice()));
        row.add(number(record.getFill().getPositionValue()));
        row.add(number(record.getFill().getCommission()));
        row.add(number(before.getPortfolioValue()));
        row.add(number(after.getPortfolioValue()));
        row.add(number(before.getCash()));
        row.add(number(after.getCash()));
        row.add(number(record.getCumulativeReturnPct()));
        row.add(allocation(before.getAllocation()));
        row.add(allocation(after.getAllocation()));

        for (String key : indicatorKeys) {
            row.add(number(record.getIndicatorValues().get(key)));
        }
        for (String key : thresholdKeys) {
            row.add(number(record.getThresholdValues().get(key)));
        }
        return row;
    }

    static String allocation(Map<String, BigDecimal> allocation) {
        if (allocation.isEmpty()) {
            return EMPTY_ALLOCATION;
        }
        return allocation.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + ": " + e.getValue().toPlainString() + "%")
                .collect(Collectors.joining(", "));
    }

    static String quote(String field) {
        if (field.indexOf(',') >= 0 || field.indexOf('"') >= 0 || field.indexOf('\n') >= 0 || field.indexOf('\r') >= 0) {
            return "\"" + field.replace("\"", "\"\"") + "\"";
        }
        return field;
    }

    private static String number(BigDecimal value) {
        return value == null ? "" : value.toPlainString();
    }

    private static String percent(double fraction) {
        return BigDecimal.valueOf(fraction).movePointRight(2).toPlainString() + "%";
    }

    private static void writeLine(BufferedWriter writer, List<String> fields) throws IOException {
        writer.write(fields.stream().map(TradeLogCsvExporter::quote).collect(Collectors.joining(",")));
        writer.write(LINE_SEPARATOR);
    }
}
