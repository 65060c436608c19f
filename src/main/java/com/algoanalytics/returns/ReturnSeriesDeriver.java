package com.algoanalytics.returns;

import com.algoanalytics.domain.model.EquityCurve;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Converts an equity curve into periodic simple returns: {@code r_t = V_t / V_(t-1) - 1}.
 *
 * <p>A curve with fewer than two points yields an empty series, which is not an error.
 * Value positivity is the curve's own invariant and is checked by callers that require it.
 */
@Slf4j
@Component
public class ReturnSeriesDeriver {

    public ReturnSeries derive(EquityCurve equityCurve) {
        int n = equityCurve.size();
        if (n < 2) {
            log.debug("Equity curve has {} point(s), no returns derived", n);
            return ReturnSeries.empty();
        }

        double[] values = equityCurve.values();
        double[] returns = new double[n - 1];
        List<LocalDateTime> timestamps = new ArrayList<>(n - 1);
        for (int i = 1; i < n; i++) {
            returns[i - 1] = values[i] / values[i - 1] - 1.0;
            timestamps.add(equityCurve.get(i).getTimestamp());
        }
        return new ReturnSeries(timestamps, returns);
    }
}
