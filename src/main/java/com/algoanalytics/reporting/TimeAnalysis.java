package com.algoanalytics.reporting;

import com.algoanalytics.rolling.RollingMetricsTable;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Calendar view of a run: span, CAGR, month-by-month returns and the rolling table. */
@Value
@Builder
public class TimeAnalysis {

    LocalDateTime start;
    LocalDateTime end;
    long calendarDays;
    double years;
    double cagr;
    MonthlyReturnsTable monthlyReturns;

    /** Null when no month has data. */
    YearMonth bestMonth;

    Double bestMonthReturn;
    YearMonth worstMonth;
    Double worstMonthReturn;
    RollingMetricsTable rolling;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("start", start);
        map.put("end", end);
        map.put("calendar_days", calendarDays);
        map.put("years", years);
        map.put("cagr", cagr);
        map.put("monthly_returns", monthlyReturns.toMap());
        map.put("best_month", bestMonth != null ? bestMonth.toString() : MonthlyReturnsTable.NO_DATA);
        map.put("best_month_return", bestMonthReturn);
        map.put("worst_month", worstMonth != null ? worstMonth.toString() : MonthlyReturnsTable.NO_DATA);
        map.put("worst_month_return", worstMonthReturn);
        map.put("rolling", rolling.toMap());
        return map;
    }
}
