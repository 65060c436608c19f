package com.algoanalytics.reporting;

import com.algoanalytics.returns.ReturnSeries;
import java.time.Month;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Compounded returns per calendar month, pivoted by year.
 *
 * <p>The table covers every month of every year the series touches. A month without any
 * period return has no value and renders as {@link #NO_DATA}, never as zero.
 */
public final class MonthlyReturnsTable {

    public static final String NO_DATA = "no data";

    private final SortedMap<YearMonth, Double> returns;
    private final int firstYear;
    private final int lastYear;

    private MonthlyReturnsTable(SortedMap<YearMonth, Double> returns) {
        this.returns = Collections.unmodifiableSortedMap(returns);
        this.firstYear = returns.isEmpty() ? 0 : returns.firstKey().getYear();
        this.lastYear = returns.isEmpty() ? -1 : returns.lastKey().getYear();
    }

    /** Groups returns by the calendar month of their timestamp and compounds each group. */
    public static MonthlyReturnsTable from(ReturnSeries series) {
        SortedMap<YearMonth, Double> growth = new TreeMap<>();
        for (int i = 0; i < series.size(); i++) {
            YearMonth month = YearMonth.from(series.timestampAt(i));
            growth.merge(month, 1.0 + series.get(i), (a, b) -> a * b);
        }
        growth.replaceAll((month, factor) -> factor - 1.0);
        return new MonthlyReturnsTable(growth);
    }

    public Optional<Double> get(YearMonth month) {
        return Optional.ofNullable(returns.get(month));
    }

    /** Months that have at least one period return. */
    public SortedMap<YearMonth, Double> getReturns() {
        return returns;
    }

    public boolean isEmpty() {
        return returns.isEmpty();
    }

    public Optional<Map.Entry<YearMonth, Double>> best() {
        return returns.entrySet().stream().max(Map.Entry.comparingByValue());
    }

    public Optional<Map.Entry<YearMonth, Double>> worst() {
        return returns.entrySet().stream().min(Map.Entry.comparingByValue());
    }

    /** {@code year -> (Jan..Dec -> return or "no data")}. */
    public Map<Integer, Map<String, Object>> toMap() {
        Map<Integer, Map<String, Object>> byYear = new LinkedHashMap<>();
        for (int year = firstYear; year <= lastYear; year++) {
            Map<String, Object> months = new LinkedHashMap<>();
            for (Month month : Month.values()) {
                Double value = returns.get(YearMonth.of(year, month));
                months.put(month.getDisplayName(TextStyle.SHORT, Locale.ENGLISH), value != null ? value : NO_DATA);
            }
            byYear.put(year, months);
        }
        return byYear;
    }
}
