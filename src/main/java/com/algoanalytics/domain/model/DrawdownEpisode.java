package com.algoanalytics.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * One peak-to-trough-to-recovery stretch of the equity curve. Invariant: troughValue &lt;= peakValue.
 * {@code recoveryTime} and {@code recoveryDays} are null while the curve has not regained the peak.
 */
@Value
@Builder
public class DrawdownEpisode {

    BigDecimal peakValue;
    LocalDateTime peakTime;
    BigDecimal troughValue;
    LocalDateTime troughTime;
    LocalDateTime recoveryTime;

    /** (trough - peak) / peak, always &lt;= 0. */
    double depth;

    /** Calendar days from peak to trough. */
    long durationDays;

    /** Calendar days from trough to recovery. */
    Long recoveryDays;

    public boolean isRecovered() {
        return recoveryTime != null;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("depth", depth);
        map.put("peak_value", peakValue);
        map.put("peak_time", peakTime);
        map.put("trough_value", troughValue);
        map.put("trough_time", troughTime);
        map.put("recovery_time", recoveryTime);
        map.put("duration_days", durationDays);
        map.put("recovery_days", recoveryDays);
        return map;
    }
}
