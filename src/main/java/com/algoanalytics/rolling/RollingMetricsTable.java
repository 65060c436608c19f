package com.algoanalytics.rolling;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Value;

/** Rolling metrics indexed by return timestamp, one row per return. */
@Value
public class RollingMetricsTable {

    int window;
    boolean benchmarkSupplied;
    List<RollingMetricsRow> rows;

    public int size() {
        return rows.size();
    }

    public RollingMetricsRow get(int index) {
        return rows.get(index);
    }

    /** Rows whose window has filled. */
    public List<RollingMetricsRow> definedRows() {
        return rows.stream().filter(RollingMetricsRow::isDefined).toList();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("window", window);
        map.put("benchmark", benchmarkSupplied);
        map.put("rows", rows.stream().map(RollingMetricsRow::toMap).toList());
        return map;
    }
}
