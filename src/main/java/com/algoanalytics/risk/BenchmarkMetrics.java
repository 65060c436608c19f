package com.algoanalytics.risk;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Strategy returns measured against a benchmark's returns over the same periods. */
@Value
@Builder
public class BenchmarkMetrics {

    double correlation;
    double beta;

    /** Annualized Jensen's alpha. */
    double alpha;

    double benchmarkTotalReturn;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("correlation", correlation);
        map.put("beta", beta);
        map.put("alpha", alpha);
        map.put("benchmark_total_return", benchmarkTotalReturn);
        return map;
    }
}
